package com.company.triage.domain;

import lombok.Getter;

import java.util.*;

/**
 * Alerts sharing one (service, component) origin.
 * Only appended to while a grouping pass builds it.
 */
@Getter
public class AlertGroup {

    private final String service;
    private final String component;
    private final List<Alert> alerts = new ArrayList<>();
    private final Map<String, Integer> severityCounts = new LinkedHashMap<>();
    private int totalAlerts;

    public AlertGroup(String service, String component) {
        this.service = service;
        this.component = component;
    }

    public static AlertGroup forKey(GroupKey key) {
        return new AlertGroup(key.getService(), key.getComponent());
    }

    /**
     * Append an alert and tally it under its raw severity string.
     */
    public void addAlert(Alert alert) {
        alerts.add(alert);
        severityCounts.merge(alert.getSeverity(), 1, Integer::sum);
        totalAlerts = alerts.size();
    }

    public List<Alert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    public Map<String, Integer> getSeverityCounts() {
        return Collections.unmodifiableMap(severityCounts);
    }

    public GroupKey getKey() {
        return new GroupKey(service, component);
    }
}
