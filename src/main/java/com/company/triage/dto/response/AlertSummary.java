package com.company.triage.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Batch overview. When totalAlerts is 0 no other field is populated,
 * so callers must check it before reading the distributions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertSummary {
    private int totalAlerts;
    private Map<String, Integer> severityDistribution;
    private Map<String, Integer> serviceDistribution;
    private Map<String, Integer> componentDistribution;
    private TimeRange timeRange;

    public static AlertSummary empty() {
        return AlertSummary.builder().totalAlerts(0).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalAlerts == 0;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeRange {
        private Instant earliest;
        private Instant latest;
    }
}
