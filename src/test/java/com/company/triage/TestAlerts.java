package com.company.triage;

import com.company.triage.domain.Alert;

public final class TestAlerts {

    private TestAlerts() {
    }

    public static Alert alert(String id, String severity, String service, String component,
                              double value, double threshold) {
        return alert(id, "2024-01-15T10:30:00Z", severity, service, component, value, threshold);
    }

    public static Alert alert(String id, String timestamp, String severity, String service, String component,
                              double value, double threshold) {
        return Alert.builder()
                .id(id)
                .timestamp(timestamp)
                .service(service)
                .component(component)
                .severity(severity)
                .metric("cpu_usage")
                .value(value)
                .threshold(threshold)
                .description("test alert " + id)
                .build();
    }
}
