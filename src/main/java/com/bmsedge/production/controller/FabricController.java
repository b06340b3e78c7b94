package com.bmsedge.production.controller;

import com.bmsedge.production.dto.FabricRequest;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.model.Fabric;
import com.bmsedge.production.service.FabricService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/fabrics")
@CrossOrigin(origins = "*")
public class FabricController {

    @Autowired
    private FabricService fabricService;

    @GetMapping
    public ResponseEntity<?> getAllFabrics() {
        try {
            List<Fabric> fabrics = fabricService.getAllFabrics();
            return ResponseEntity.ok(fabrics);
        } catch (Exception e) {
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to fetch fabrics: " + e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<?> createFabric(@Valid @RequestBody FabricRequest request) {
        try {
            Fabric fabric = fabricService.createFabric(request.getName());
            return ResponseEntity.status(HttpStatus.CREATED).body(fabric);
        } catch (BusinessException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage()));
        } catch (DataIntegrityViolationException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Fabric with this name already exists"));
        }
    }
}
