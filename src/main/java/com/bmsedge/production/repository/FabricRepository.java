package com.bmsedge.production.repository;

import com.bmsedge.production.model.Fabric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FabricRepository extends JpaRepository<Fabric, Long> {

    boolean existsByName(String name);

    List<Fabric> findAllByOrderByNameAsc();
}
