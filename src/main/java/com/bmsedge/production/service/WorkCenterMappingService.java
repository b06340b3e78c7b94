package com.bmsedge.production.service;

import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.repository.MachineRepository;
import com.bmsedge.production.repository.ProductionStore;
import com.bmsedge.production.repository.WorkCenterMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maintenance of the persistent work-center to machine table outside of an import.
 */
@Service
public class WorkCenterMappingService {

    private static final Logger logger = LoggerFactory.getLogger(WorkCenterMappingService.class);

    @Autowired
    private ProductionStore productionStore;

    @Autowired
    private WorkCenterMappingRepository workCenterMappingRepository;

    @Autowired
    private MachineRepository machineRepository;

    public Map<String, Long> getAllMappings() {
        return productionStore.loadWorkCenterMappings();
    }

    public List<String> getWorkCentersForMachine(Long machineId) {
        return workCenterMappingRepository.findByMachineId(machineId).stream()
                .map(mapping -> mapping.getWorkCenter())
                .sorted()
                .collect(Collectors.toList());
    }

    public void saveMapping(String workCenter, Long machineId) {
        if (workCenter == null || workCenter.isBlank()) {
            throw new BusinessException("Work center is required");
        }
        if (machineId == null) {
            throw new BusinessException("Machine id is required");
        }
        if (!machineRepository.existsById(machineId)) {
            throw new ResourceNotFoundException("Machine not found with id: " + machineId);
        }
        productionStore.saveWorkCenterMappings(Map.of(workCenter.trim(), machineId));
        logger.info("Work center '{}' mapped to machine {}", workCenter.trim(), machineId);
    }

    public void deleteMapping(String workCenter) {
        if (!workCenterMappingRepository.existsById(workCenter)) {
            throw new ResourceNotFoundException("No mapping for work center: " + workCenter);
        }
        productionStore.deleteWorkCenterMapping(workCenter);
    }
}
