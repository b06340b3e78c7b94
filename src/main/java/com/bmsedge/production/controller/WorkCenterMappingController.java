package com.bmsedge.production.controller;

import com.bmsedge.production.dto.MappingUpdateRequest;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.service.WorkCenterMappingService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/work-center-mappings")
@CrossOrigin(origins = "*")
public class WorkCenterMappingController {

    @Autowired
    private WorkCenterMappingService workCenterMappingService;

    @GetMapping
    public ResponseEntity<?> getMappings(@RequestParam(value = "machineId", required = false) Long machineId) {
        if (machineId != null) {
            return ResponseEntity.ok(workCenterMappingService.getWorkCentersForMachine(machineId));
        }
        return ResponseEntity.ok(workCenterMappingService.getAllMappings());
    }

    @PutMapping
    public ResponseEntity<?> saveMapping(@Valid @RequestBody MappingUpdateRequest request) {
        try {
            workCenterMappingService.saveMapping(request.getWorkCenter(), request.getMachineId());
            return ResponseEntity.ok(Map.of(
                    "workCenter", request.getWorkCenter().trim(),
                    "machineId", request.getMachineId()));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (BusinessException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping
    public ResponseEntity<?> deleteMapping(@RequestParam("workCenter") String workCenter) {
        try {
            workCenterMappingService.deleteMapping(workCenter);
            return ResponseEntity.noContent().build();
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
