package com.bmsedge.production.repository;

import com.bmsedge.production.model.DailyLog;
import com.bmsedge.production.model.Machine;
import com.bmsedge.production.model.MachineDailyLog;
import com.bmsedge.production.model.MachineSnapshot;
import com.bmsedge.production.model.WorkCenterMapping;
import com.bmsedge.production.util.DailyLogMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class JpaProductionStore implements ProductionStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaProductionStore.class);

    @Autowired
    private MachineRepository machineRepository;

    @Autowired
    private MachineDailyLogRepository dailyLogRepository;

    @Autowired
    private WorkCenterMappingRepository workCenterMappingRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    /**
     * Per-date records take precedence over the embedded collection for the same date.
     */
    @Override
    @Transactional(readOnly = true)
    public List<MachineSnapshot> loadMachines() {
        Map<Long, List<MachineDailyLog>> recordsByMachine = dailyLogRepository.findAllOrdered().stream()
                .collect(Collectors.groupingBy(MachineDailyLog::getMachineId));

        List<MachineSnapshot> snapshots = new ArrayList<>();
        for (Machine machine : machineRepository.findAllByOrderByMachineNameAsc()) {
            List<DailyLog> history = DailyLogMapper.mergeHistory(machine.getDailyLogs(),
                    recordsByMachine.getOrDefault(machine.getId(), Collections.emptyList()));

            snapshots.add(new MachineSnapshot(
                    machine.getId(),
                    machine.getMachineName(),
                    machine.getMachineNumber(),
                    machine.getMachineType(),
                    new ArrayList<>(machine.getWorkCenterAliases()),
                    history
            ));
        }

        logger.debug("Loaded {} machines for reconciliation", snapshots.size());
        return snapshots;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> loadWorkCenterMappings() {
        Map<String, Long> mappings = new LinkedHashMap<>();
        workCenterMappingRepository.findAll().forEach(mapping ->
                mappings.put(mapping.getWorkCenter(), mapping.getMachineId()));
        return mappings;
    }

    @Override
    @Transactional
    public void saveWorkCenterMappings(Map<String, Long> mappings) {
        List<WorkCenterMapping> entities = mappings.entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> new WorkCenterMapping(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        workCenterMappingRepository.saveAll(entities);
        logger.info("Saved {} work-center mapping(s)", entities.size());
    }

    @Override
    @Transactional
    public void deleteWorkCenterMapping(String workCenter) {
        if (workCenterMappingRepository.existsById(workCenter)) {
            workCenterMappingRepository.deleteById(workCenter);
            logger.info("Removed work-center mapping for '{}'", workCenter);
        }
    }

    @Override
    public int commit(WriteBatch batch) {
        Integer updated = transactionTemplate.execute(status -> {
            int count = 0;
            for (LogWrite write : batch.getWrites()) {
                if (applyWrite(write)) {
                    count++;
                }
            }
            return count;
        });
        return updated != null ? updated : 0;
    }

    private boolean applyWrite(LogWrite write) {
        Optional<Machine> machineOpt = machineRepository.findById(write.getMachineId());
        if (machineOpt.isEmpty()) {
            logger.warn("Machine {} no longer exists, skipping log for {}",
                    write.getMachineId(), write.getLog().getDate());
            return false;
        }

        Machine machine = machineOpt.get();
        DailyLog log = write.getLog();

        // Operation 1: machine log collection and current state
        machine.upsertLog(DailyLogMapper.toEntry(log));
        if (machine.isLatestDate(log.getDate())) {
            machine.refreshCurrentState(log);
        }
        machineRepository.save(machine);

        // Operation 2: per-date record
        MachineDailyLog record = dailyLogRepository
                .findByMachineIdAndLogDate(machine.getId(), log.getDate())
                .orElseGet(() -> new MachineDailyLog(machine.getId(), log.getDate()));
        DailyLogMapper.applyToRecord(log, record);
        dailyLogRepository.save(record);

        return true;
    }
}
