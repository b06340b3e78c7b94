package com.bmsedge.production.repository;

import com.bmsedge.production.model.MachineDailyLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface MachineDailyLogRepository extends JpaRepository<MachineDailyLog, Long> {

    Optional<MachineDailyLog> findByMachineIdAndLogDate(Long machineId, LocalDate logDate);

    List<MachineDailyLog> findByMachineIdOrderByLogDateAsc(Long machineId);

    @Query("SELECT l FROM MachineDailyLog l ORDER BY l.machineId, l.logDate")
    List<MachineDailyLog> findAllOrdered();
}
