package com.company.triage.report;

import com.company.triage.domain.Alert;
import com.company.triage.domain.AlertGroup;
import com.company.triage.dto.request.FilterCriteria;
import com.company.triage.dto.response.AlertSummary;
import com.company.triage.service.AlertProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Plain-text triage report for consoles and logs.
 */
@Component
public class TriageReportRenderer {

    private static final String NO_ALERTS = "No alerts loaded.";

    private final AlertProcessor alertProcessor;
    private final String focusService;

    public TriageReportRenderer(
            AlertProcessor alertProcessor,
            @Value("${triage.report.focus-service:payment-processor}") String focusService) {
        this.alertProcessor = alertProcessor;
        this.focusService = focusService;
    }

    public String renderAlerts(String title, List<Alert> alerts) {
        StringJoiner out = new StringJoiner(System.lineSeparator());
        out.add(String.format("%s: %d alerts", title, alerts.size()));
        for (Alert alert : alerts) {
            out.add(String.format("  %s: %s - %s/%s - %s=%s",
                    alert.getId(), alert.getSeverity(), alert.getService(), alert.getComponent(),
                    alert.getMetric(), alert.getValue()));
        }
        return out.toString();
    }

    public String renderGroups(List<AlertGroup> groups) {
        StringJoiner out = new StringJoiner(System.lineSeparator());
        out.add(String.format("Alert Groups: %d groups", groups.size()));
        for (AlertGroup group : groups) {
            out.add(String.format("  %s/%s: %d alerts",
                    group.getService(), group.getComponent(), group.getTotalAlerts()));
            for (Alert alert : group.getAlerts()) {
                out.add(String.format("    %s: %s - %s=%s",
                        alert.getId(), alert.getSeverity(), alert.getMetric(), alert.getValue()));
            }
        }
        return out.toString();
    }

    /**
     * Summary, critical alerts, focus-service alerts, groups and overall priority.
     */
    public String renderOverview() {
        AlertSummary summary = alertProcessor.summarize();
        if (summary.isEmpty()) {
            return NO_ALERTS;
        }

        List<Alert> alerts = alertProcessor.getAlerts();
        List<Alert> critical = alertProcessor.filter(FilterCriteria.builder().severity("critical").build());
        List<Alert> focus = alertProcessor.filter(FilterCriteria.builder().service(focusService).build());

        StringJoiner out = new StringJoiner(System.lineSeparator());
        out.add(String.format("Loaded %d alerts", summary.getTotalAlerts()));
        out.add("Severity: " + summary.getSeverityDistribution());
        out.add("");
        out.add(renderAlerts("Critical Alerts", critical));
        out.add("");
        out.add(renderAlerts(titleFor(focusService), focus));
        out.add("");
        out.add(renderGroups(alertProcessor.group()));
        out.add("");
        out.add(String.format(Locale.ROOT, "Overall Priority: %.1f", alertProcessor.score(alerts)));
        return out.toString();
    }

    // "payment-processor" -> "Payment Processor Alerts"
    private static String titleFor(String service) {
        StringJoiner words = new StringJoiner(" ");
        for (String part : service.split("[-_\\s]+")) {
            if (!part.isEmpty()) {
                words.add(Character.toUpperCase(part.charAt(0)) + part.substring(1));
            }
        }
        return words + " Alerts";
    }
}
