package com.company.triage.service;

import com.company.triage.domain.Alert;
import com.company.triage.domain.GroupKey;
import com.company.triage.domain.enums.SeverityLevel;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Weighted incident priority. Higher means more urgent.
 *
 * <p>score = 0.5 * severityScore + 0.3 * avgDeviation + 0.2 * affectedComponents
 *
 * <p>The weights are policy constants. Changing them changes ranking for every
 * consumer and is not a tuning knob.
 */
@Service
public class PriorityScoringService {

    public static final double SEVERITY_WEIGHT = 0.5;
    public static final double DEVIATION_WEIGHT = 0.3;
    public static final double BREADTH_WEIGHT = 0.2;

    public double score(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return 0.0;
        }

        return (severityScore(alerts) * SEVERITY_WEIGHT)
                + (averageDeviation(alerts) * DEVIATION_WEIGHT)
                + (affectedComponents(alerts) * BREADTH_WEIGHT);
    }

    /**
     * Sum of catalog weights; labels outside the catalog count for nothing.
     */
    public int severityScore(List<Alert> alerts) {
        return alerts.stream()
                .map(Alert::getSeverity)
                .map(SeverityLevel::fromLabel)
                .mapToInt(level -> level.map(SeverityLevel::getWeight).orElse(0))
                .sum();
    }

    /**
     * Mean absolute deviation percentage. Summed in sorted order so the result
     * does not depend on input order.
     */
    public double averageDeviation(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return 0.0;
        }
        double total = alerts.stream()
                .mapToDouble(alert -> Math.abs(alert.deviationPercent()))
                .sorted()
                .sum();
        return total / alerts.size();
    }

    public int affectedComponents(List<Alert> alerts) {
        return alerts.stream()
                .map(Alert::groupKey)
                .collect(Collectors.<GroupKey>toSet())
                .size();
    }
}
