package com.company.triage.domain;

import org.junit.jupiter.api.Test;

import static com.company.triage.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class AlertGroupTest {

    @Test
    void countsStayConsistentAfterEveryAppend() {
        AlertGroup group = new AlertGroup("svc", "db");

        group.addAlert(alert("1", "critical", "svc", "db", 1, 1));
        assertThat(group.getTotalAlerts()).isEqualTo(1);

        group.addAlert(alert("2", "critical", "svc", "db", 1, 1));
        group.addAlert(alert("3", "Critcal", "svc", "db", 1, 1));

        assertThat(group.getTotalAlerts()).isEqualTo(group.getAlerts().size()).isEqualTo(3);
        assertThat(group.getSeverityCounts()).containsExactly(
                entry("critical", 2),
                entry("Critcal", 1));
        assertThat(group.getSeverityCounts().values().stream().mapToInt(Integer::intValue).sum())
                .isEqualTo(group.getTotalAlerts());
    }

    @Test
    void exposedCollectionsAreReadOnly() {
        AlertGroup group = new AlertGroup("svc", "db");
        group.addAlert(alert("1", "info", "svc", "db", 1, 1));

        assertThatThrownBy(() -> group.getAlerts().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> group.getSeverityCounts().put("info", 9))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
