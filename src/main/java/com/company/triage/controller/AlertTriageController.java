package com.company.triage.controller;

import com.company.triage.domain.Alert;
import com.company.triage.domain.AlertGroup;
import com.company.triage.dto.request.FilterCriteria;
import com.company.triage.dto.response.*;
import com.company.triage.service.AlertProcessor;
import com.company.triage.source.AlertBatch;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alert Triage", description = "Filtered, grouped and scored views of the loaded alert batch")
@RequiredArgsConstructor
@Validated
@Slf4j
public class AlertTriageController {

    private static final String WINDOW_MESSAGE = "windowMinutes must not be negative";

    private final AlertProcessor alertProcessor;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List alerts matching all supplied criteria")
    public ResponseEntity<List<AlertResponse>> getAlerts(
            @Parameter(description = "Severity label, case-insensitive") @RequestParam(required = false) String severity,
            @Parameter(description = "Service name, case-insensitive") @RequestParam(required = false) String service,
            @Parameter(description = "Keep alerts from the last N minutes") @RequestParam(required = false)
            @Min(value = 0, message = WINDOW_MESSAGE) Integer windowMinutes) {

        countRequest("alerts");

        List<Alert> alerts = alertProcessor.filter(criteria(severity, service, windowMinutes));

        return ResponseEntity.ok(alerts.stream()
                .map(this::toAlertResponse)
                .collect(Collectors.toList()));
    }

    @GetMapping("/groups")
    @Operation(
            summary = "Group matching alerts by service and component",
            description = "Groups are ordered by first appearance; each carries its own priority score"
    )
    public ResponseEntity<List<AlertGroupResponse>> getGroups(
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) @Min(value = 0, message = WINDOW_MESSAGE) Integer windowMinutes) {

        countRequest("groups");

        List<Alert> alerts = alertProcessor.filter(criteria(severity, service, windowMinutes));
        List<AlertGroup> groups = alertProcessor.group(alerts);

        log.debug("Returning {} groups for {} alerts", groups.size(), alerts.size());

        return ResponseEntity.ok(groups.stream()
                .map(this::toAlertGroupResponse)
                .collect(Collectors.toList()));
    }

    @GetMapping("/priority")
    @Operation(summary = "Weighted incident priority of the matching alerts")
    public ResponseEntity<PriorityResponse> getPriority(
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) @Min(value = 0, message = WINDOW_MESSAGE) Integer windowMinutes) {

        countRequest("priority");

        List<Alert> alerts = alertProcessor.filter(criteria(severity, service, windowMinutes));

        return ResponseEntity.ok(PriorityResponse.builder()
                .alertCount(alerts.size())
                .affectedComponents(alertProcessor.affectedComponents(alerts))
                .priorityScore(alertProcessor.score(alerts))
                .build());
    }

    @GetMapping("/summary")
    @Operation(
            summary = "Distribution counts and time range",
            description = "An empty selection returns only totalAlerts = 0"
    )
    public ResponseEntity<AlertSummary> getSummary(
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) @Min(value = 0, message = WINDOW_MESSAGE) Integer windowMinutes) {

        countRequest("summary");

        FilterCriteria criteria = criteria(severity, service, windowMinutes);
        AlertSummary summary = criteria.isEmpty()
                ? alertProcessor.summarize()
                : alertProcessor.summarize(alertProcessor.filter(criteria));

        return ResponseEntity.ok(summary);
    }

    @PostMapping("/reload")
    @Operation(summary = "Re-read the alert source and replace the current batch")
    public ResponseEntity<ReloadResponse> reload() {
        log.info("Reload requested for {}", alertProcessor.getSourceDescription());

        AlertBatch batch = alertProcessor.reload();

        return ResponseEntity.ok(ReloadResponse.builder()
                .loadedAlerts(batch.getAlerts().size())
                .rejectedAlerts(batch.getRejectedCount())
                .source(batch.getSource())
                .reloadedAt(Instant.now())
                .build());
    }

    private FilterCriteria criteria(String severity, String service, Integer windowMinutes) {
        return FilterCriteria.builder()
                .severity(severity)
                .service(service)
                .windowMinutes(windowMinutes)
                .build();
    }

    private void countRequest(String view) {
        meterRegistry.counter("api.alerts.requests", "view", view).increment();
    }

    private AlertResponse toAlertResponse(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .timestamp(alert.getTimestamp())
                .service(alert.getService())
                .component(alert.getComponent())
                .severity(alert.getSeverity())
                .metric(alert.getMetric())
                .value(alert.getValue())
                .threshold(alert.getThreshold())
                .deviationPercent(alert.deviationPercent())
                .description(alert.getDescription())
                .build();
    }

    private AlertGroupResponse toAlertGroupResponse(AlertGroup group) {
        return AlertGroupResponse.builder()
                .service(group.getService())
                .component(group.getComponent())
                .totalAlerts(group.getTotalAlerts())
                .severityCounts(group.getSeverityCounts())
                .priorityScore(alertProcessor.score(group.getAlerts()))
                .alerts(group.getAlerts().stream()
                        .map(this::toAlertResponse)
                        .collect(Collectors.toList()))
                .build();
    }
}
