package com.bmsedge.production.controller;

import com.bmsedge.production.dto.CommitResult;
import com.bmsedge.production.service.CarryForwardService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/daily-logs")
@CrossOrigin(origins = "*")
public class DailyLogController {

    @Autowired
    private CarryForwardService carryForwardService;

    @PostMapping("/carry-forward")
    public ResponseEntity<Map<String, Object>> carryForward(
            @RequestParam("targetDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate,
            @RequestParam(value = "sourceDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate sourceDate) {

        CommitResult result = carryForwardService.carryForward(targetDate, sourceDate);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", result.getRowsWritten() == 0
                ? "No logs to carry forward"
                : "Carried forward " + result.getMachinesUpdated() + " machine(s) to " + targetDate);
        response.put("result", result);
        return ResponseEntity.ok(response);
    }
}
