package com.bmsedge.production.controller;

import com.bmsedge.production.dto.DailyLogResponse;
import com.bmsedge.production.dto.MachineResponse;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.service.MachineService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/machines")
@CrossOrigin(origins = "*")
public class MachineController {

    @Autowired
    private MachineService machineService;

    @GetMapping
    public ResponseEntity<?> getAllMachines() {
        try {
            List<MachineResponse> machines = machineService.getAllMachines();
            return ResponseEntity.ok(machines);
        } catch (Exception e) {
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to fetch machines: " + e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getMachineById(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(machineService.getMachineById(id));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/{id}/logs")
    public ResponseEntity<?> getMachineLogs(
            @PathVariable Long id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        try {
            List<DailyLogResponse> logs = machineService.getMachineLogs(id, from, to);
            return ResponseEntity.ok(logs);
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (BusinessException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage()));
        }
    }
}
