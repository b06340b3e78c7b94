package com.bmsedge.production.controller;

import com.bmsedge.production.dto.*;
import com.bmsedge.production.model.ImportSession;
import com.bmsedge.production.model.RowFilter;
import com.bmsedge.production.model.StagedReconciliationRow;
import com.bmsedge.production.service.ImportSessionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Daily production import. Errors are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/api/imports")
@CrossOrigin(origins = "*")
public class ImportController {

    private static final Logger logger = LoggerFactory.getLogger(ImportController.class);

    @Autowired
    private ImportSessionService importSessionService;

    @PostMapping
    public ResponseEntity<ImportSessionResponse> startImport(
            @RequestParam("file") MultipartFile file,
            @RequestParam("targetDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate) {

        logger.info("Import upload '{}' for {}", file.getOriginalFilename(), targetDate);
        ImportSession session = importSessionService.start(file, targetDate);
        return ResponseEntity.status(HttpStatus.CREATED).body(ImportSessionResponse.from(session, RowFilter.ALL));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ImportSessionResponse> getImport(
            @PathVariable String sessionId,
            @RequestParam(value = "filter", defaultValue = "ALL") RowFilter filter) {

        ImportSession session = importSessionService.getSession(sessionId);
        return ResponseEntity.ok(ImportSessionResponse.from(session, filter));
    }

    @PutMapping("/{sessionId}/mappings")
    public ResponseEntity<ImportSessionResponse> updateMapping(
            @PathVariable String sessionId,
            @Valid @RequestBody MappingUpdateRequest request) {

        ImportSession session = importSessionService.updateMapping(sessionId, request.getWorkCenter(), request.getMachineId());
        return ResponseEntity.ok(ImportSessionResponse.from(session, RowFilter.ALL));
    }

    @PostMapping("/{sessionId}/mappings/confirm")
    public ResponseEntity<ImportSessionResponse> confirmMappings(@PathVariable String sessionId) {
        ImportSession session = importSessionService.confirmMappings(sessionId);
        return ResponseEntity.ok(ImportSessionResponse.from(session, RowFilter.ALL));
    }

    @PostMapping("/{sessionId}/fabrics")
    public ResponseEntity<ImportSessionResponse> resolveFabrics(
            @PathVariable String sessionId,
            @RequestBody(required = false) FabricCreationRequest request) {

        ImportSession session = importSessionService.resolveFabrics(sessionId,
                request != null ? request.getCreate() : null);
        return ResponseEntity.ok(ImportSessionResponse.from(session, RowFilter.ALL));
    }

    @PatchMapping("/{sessionId}/rows/{machineId}")
    public ResponseEntity<StagedReconciliationRow> updateRow(
            @PathVariable String sessionId,
            @PathVariable Long machineId,
            @Valid @RequestBody RowUpdateRequest request) {

        return ResponseEntity.ok(importSessionService.updateRow(sessionId, machineId, request));
    }

    @PutMapping("/{sessionId}/rows/selection")
    public ResponseEntity<Map<String, Object>> selectRows(
            @PathVariable String sessionId,
            @Valid @RequestBody RowSelectionRequest request) {

        int changed = importSessionService.selectRows(sessionId, request.getFilter(), request.getSelected());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("filter", request.getFilter());
        response.put("selected", request.getSelected());
        response.put("rowsChanged", changed);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{sessionId}/apply")
    public ResponseEntity<Map<String, Object>> applyImport(@PathVariable String sessionId) {
        CommitResult result = importSessionService.apply(sessionId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Imported logs for " + result.getMachinesUpdated() + " machine(s) on " + result.getTargetDate());
        response.put("result", result);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> discardImport(@PathVariable String sessionId) {
        importSessionService.discard(sessionId);
        return ResponseEntity.noContent().build();
    }
}
