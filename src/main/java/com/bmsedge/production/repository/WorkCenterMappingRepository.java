package com.bmsedge.production.repository;

import com.bmsedge.production.model.WorkCenterMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkCenterMappingRepository extends JpaRepository<WorkCenterMapping, String> {

    List<WorkCenterMapping> findByMachineId(Long machineId);
}
