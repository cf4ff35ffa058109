package com.company.triage.service;

import com.company.triage.domain.Alert;
import com.company.triage.dto.response.AlertSummary;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AlertSummaryService {

    /**
     * Distribution counts and time range over the given alerts.
     *
     * @throws com.company.triage.exception.TimestampParseException if any timestamp is invalid
     */
    public AlertSummary summarize(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return AlertSummary.empty();
        }

        Map<String, Integer> severityCounts = new LinkedHashMap<>();
        Map<String, Integer> serviceCounts = new LinkedHashMap<>();
        Map<String, Integer> componentCounts = new LinkedHashMap<>();
        Instant earliest = null;
        Instant latest = null;

        for (Alert alert : alerts) {
            severityCounts.merge(alert.getSeverity(), 1, Integer::sum);
            serviceCounts.merge(alert.getService(), 1, Integer::sum);
            componentCounts.merge(alert.getComponent(), 1, Integer::sum);

            Instant time = alert.parsedTime();
            if (earliest == null || time.isBefore(earliest)) {
                earliest = time;
            }
            if (latest == null || time.isAfter(latest)) {
                latest = time;
            }
        }

        return AlertSummary.builder()
                .totalAlerts(alerts.size())
                .severityDistribution(severityCounts)
                .serviceDistribution(serviceCounts)
                .componentDistribution(componentCounts)
                .timeRange(new AlertSummary.TimeRange(earliest, latest))
                .build();
    }
}
