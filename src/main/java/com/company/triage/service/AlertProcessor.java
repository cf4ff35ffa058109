package com.company.triage.service;

import com.company.triage.domain.Alert;
import com.company.triage.domain.AlertGroup;
import com.company.triage.dto.request.FilterCriteria;
import com.company.triage.dto.response.AlertSummary;
import com.company.triage.exception.AlertSourceException;
import com.company.triage.source.AlertBatch;
import com.company.triage.source.AlertSource;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Processing session over one loaded alert batch.
 * The batch is an immutable snapshot, replaced as a whole on reload, so
 * concurrent read-only passes need no locking.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertProcessor {

    private final AlertSource alertSource;
    private final AlertFilterService filterService;
    private final AlertGroupingService groupingService;
    private final PriorityScoringService scoringService;
    private final AlertSummaryService summaryService;
    private final MeterRegistry meterRegistry;

    private volatile AlertBatch batch;

    @PostConstruct
    void init() {
        try {
            batch = alertSource.load();
        } catch (AlertSourceException e) {
            log.error("Failed to load alerts from {}, starting with an empty batch: {}",
                    alertSource.describe(), e.getMessage());
            batch = AlertBatch.empty(alertSource.describe());
        }
    }

    /**
     * Re-read the source and swap in the new batch. On failure the previous batch stays.
     */
    public AlertBatch reload() {
        AlertBatch reloaded = alertSource.load();
        batch = reloaded;

        meterRegistry.counter("triage.alerts.reloads").increment();
        log.info("Reloaded {} alerts from {} ({} rejected)",
                reloaded.getAlerts().size(), reloaded.getSource(), reloaded.getRejectedCount());

        return reloaded;
    }

    public List<Alert> getAlerts() {
        return currentBatch().getAlerts();
    }

    public int getRejectedCount() {
        return currentBatch().getRejectedCount();
    }

    public String getSourceDescription() {
        return currentBatch().getSource();
    }

    public List<Alert> filter(FilterCriteria criteria) {
        return filterService.filter(getAlerts(), criteria);
    }

    public List<AlertGroup> group() {
        return group(getAlerts());
    }

    public List<AlertGroup> group(List<Alert> alerts) {
        return groupingService.group(alerts);
    }

    public double score(List<Alert> alerts) {
        meterRegistry.counter("triage.priority.computations").increment();
        return scoringService.score(alerts);
    }

    public int affectedComponents(List<Alert> alerts) {
        return scoringService.affectedComponents(alerts);
    }

    public AlertSummary summarize() {
        return summarize(getAlerts());
    }

    public AlertSummary summarize(List<Alert> alerts) {
        return summaryService.summarize(alerts);
    }

    private AlertBatch currentBatch() {
        AlertBatch current = batch;
        return current != null ? current : AlertBatch.empty(alertSource.describe());
    }
}
