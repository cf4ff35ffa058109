package com.company.triage.source;

import com.company.triage.domain.Alert;
import lombok.Getter;

import java.util.List;

/**
 * One loaded batch. The alert list is an unmodifiable copy, independent of whatever list the source built.
 */
@Getter
public class AlertBatch {
    private final List<Alert> alerts;
    private final int rejectedCount;
    private final String source;

    public AlertBatch(List<Alert> alerts, int rejectedCount, String source) {
        this.alerts = List.copyOf(alerts);
        this.rejectedCount = rejectedCount;
        this.source = source;
    }

    public static AlertBatch empty(String source) {
        return new AlertBatch(List.of(), 0, source);
    }
}
