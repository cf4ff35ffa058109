package com.company.triage.controller;

import com.company.triage.service.AlertProcessor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final AlertProcessor alertProcessor;

    @GetMapping
    @Operation(summary = "Health check with current batch size")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "alert-triage-service");
        response.put("loadedAlerts", alertProcessor.getAlerts().size());
        response.put("rejectedAlerts", alertProcessor.getRejectedCount());
        response.put("source", alertProcessor.getSourceDescription());

        return ResponseEntity.ok(response);
    }
}
