package com.company.triage.source;

import com.company.triage.domain.Alert;
import com.company.triage.exception.AlertSourceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonAlertSourceTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void loadsValidEntriesAndCountsRejectedOnes() {
        JsonAlertSource source = new JsonAlertSource(
                new ClassPathResource("fixtures/mixed_alerts.json"), objectMapper, validator);

        AlertBatch batch = source.load();

        assertThat(batch.getAlerts()).extracting(Alert::getId).containsExactly("ok-1", "ok-2", "ok-3");
        assertThat(batch.getRejectedCount()).isEqualTo(5);
        assertThat(batch.getSource()).contains("mixed_alerts.json");
    }

    @Test
    void mapsEveryFieldOfAValidEntry() {
        JsonAlertSource source = new JsonAlertSource(
                new ClassPathResource("fixtures/mixed_alerts.json"), objectMapper, validator);

        Alert first = source.load().getAlerts().get(0);

        assertThat(first.getTimestamp()).isEqualTo("2024-01-15T10:30:00Z");
        assertThat(first.getService()).isEqualTo("payment-processor");
        assertThat(first.getComponent()).isEqualTo("database");
        assertThat(first.getSeverity()).isEqualTo("critical");
        assertThat(first.getMetric()).isEqualTo("cpu_usage");
        assertThat(first.getValue()).isEqualTo(95.5);
        assertThat(first.getThreshold()).isEqualTo(80.0);
        assertThat(first.getDescription()).isEqualTo("Database CPU usage exceeded threshold");
    }

    @Test
    void keepsEntriesWithUnknownSeverityAndExtraFields() {
        JsonAlertSource source = new JsonAlertSource(
                new ClassPathResource("fixtures/mixed_alerts.json"), objectMapper, validator);

        Alert third = source.load().getAlerts().get(2);

        assertThat(third.getSeverity()).isEqualTo("sev-unknown");
    }

    @Test
    void missingResourceFailsTheLoad() {
        JsonAlertSource source = new JsonAlertSource(
                new FileSystemResource(tempDir.resolve("absent.json")), objectMapper, validator);

        assertThatThrownBy(source::load)
                .isInstanceOf(AlertSourceException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedJsonFailsTheLoad() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"alerts\": [ {\"id\": ");

        JsonAlertSource source = new JsonAlertSource(new FileSystemResource(file), objectMapper, validator);

        assertThatThrownBy(source::load)
                .isInstanceOf(AlertSourceException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void missingAlertsArrayFailsTheLoad() throws IOException {
        Path file = tempDir.resolve("no_array.json");
        Files.writeString(file, "{\"alerts\": {\"id\": \"x\"}}");

        JsonAlertSource source = new JsonAlertSource(new FileSystemResource(file), objectMapper, validator);

        assertThatThrownBy(source::load)
                .isInstanceOf(AlertSourceException.class)
                .hasMessageContaining("'alerts' array");
    }

    @Test
    void emptyAlertsArrayIsAnEmptyBatch() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "{\"alerts\": []}");

        AlertBatch batch = new JsonAlertSource(new FileSystemResource(file), objectMapper, validator).load();

        assertThat(batch.getAlerts()).isEmpty();
        assertThat(batch.getRejectedCount()).isZero();
    }
}
