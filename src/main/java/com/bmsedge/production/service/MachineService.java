package com.bmsedge.production.service;

import com.bmsedge.production.dto.DailyLogResponse;
import com.bmsedge.production.dto.MachineResponse;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.model.DailyLog;
import com.bmsedge.production.model.Machine;
import com.bmsedge.production.repository.MachineDailyLogRepository;
import com.bmsedge.production.repository.MachineRepository;
import com.bmsedge.production.util.DailyLogMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class MachineService {

    @Autowired
    private MachineRepository machineRepository;

    @Autowired
    private MachineDailyLogRepository dailyLogRepository;

    public List<MachineResponse> getAllMachines() {
        return machineRepository.findAllByOrderByMachineNameAsc().stream()
                .map(this::convertToMachineResponse)
                .collect(Collectors.toList());
    }

    public MachineResponse getMachineById(Long id) {
        return convertToMachineResponse(findMachine(id));
    }

    /**
     * Logs of one machine in date order, optionally limited to an inclusive date range.
     */
    public List<DailyLogResponse> getMachineLogs(Long id, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BusinessException("Start date " + from + " is after end date " + to);
        }
        Machine machine = findMachine(id);
        List<DailyLog> history = DailyLogMapper.mergeHistory(machine.getDailyLogs(),
                dailyLogRepository.findByMachineIdOrderByLogDateAsc(id));

        return history.stream()
                .filter(log -> from == null || !log.getDate().isBefore(from))
                .filter(log -> to == null || !log.getDate().isAfter(to))
                .map(DailyLogResponse::new)
                .collect(Collectors.toList());
    }

    private Machine findMachine(Long id) {
        return machineRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Machine not found with id: " + id));
    }

    private MachineResponse convertToMachineResponse(Machine machine) {
        MachineResponse response = new MachineResponse();
        response.setId(machine.getId());
        response.setMachineName(machine.getMachineName());
        response.setMachineNumber(machine.getMachineNumber());
        response.setMachineType(machine.getMachineType());
        response.setStatus(machine.getStatus());
        response.setClient(machine.getClient());
        response.setFabric(machine.getFabric());
        response.setRemainingMfg(machine.getRemainingMfg());
        response.setLastLogDate(machine.getLastLogDate());
        response.setWorkCenterAliases(new ArrayList<>(machine.getWorkCenterAliases()));
        response.setLogCount(machine.getDailyLogs().size());
        return response;
    }
}
