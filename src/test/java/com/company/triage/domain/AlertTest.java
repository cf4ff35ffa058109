package com.company.triage.domain;

import com.company.triage.exception.TimestampParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static com.company.triage.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AlertTest {

    @Test
    void deviationIsSignedPercentageOfThreshold() {
        assertThat(alert("a", "critical", "svc", "db", 95, 50).deviationPercent())
                .isCloseTo(90.0, within(1e-9));
        assertThat(alert("b", "info", "svc", "db", 40, 50).deviationPercent())
                .isCloseTo(-20.0, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -5.0, 1e9})
    void deviationIsZeroForZeroThreshold(double value) {
        assertThat(alert("z", "info", "svc", "db", value, 0).deviationPercent()).isEqualTo(0.0);
    }

    @Test
    void zuluSuffixEqualsExplicitUtcOffset() {
        Alert zulu = alert("a", "2024-01-15T10:30:00Z", "info", "svc", "db", 1, 1);
        Alert offset = alert("b", "2024-01-15T10:30:00+00:00", "info", "svc", "db", 1, 1);

        assertThat(zulu.parsedTime()).isEqualTo(offset.parsedTime());
        assertThat(zulu.parsedTime()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void offsetTimestampIsNormalizedToInstant() {
        Alert alert = alert("a", "2024-01-15T12:30:00+02:00", "info", "svc", "db", 1, 1);

        assertThat(alert.parsedTime()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void timestampWithoutOffsetIsReadAsUtc() {
        Alert alert = alert("a", "2024-01-15T10:30:00", "info", "svc", "db", 1, 1);

        assertThat(alert.parsedTime()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void spaceSeparatedTimestampMatchesIsoForm() {
        Alert spaced = alert("a", "2024-01-15 10:30:00+00:00", "info", "svc", "db", 1, 1);
        Alert local = alert("b", "2024-01-15 10:30:00", "info", "svc", "db", 1, 1);

        assertThat(spaced.parsedTime()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(local.parsedTime()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void invalidTimestampRaisesParseError() {
        Alert alert = alert("bad-1", "yesterday at noon", "info", "svc", "db", 1, 1);

        assertThatThrownBy(alert::parsedTime)
                .isInstanceOf(TimestampParseException.class)
                .hasMessageContaining("bad-1")
                .hasMessageContaining("yesterday at noon");
    }

    @Test
    void groupKeyIsServiceAndComponent() {
        Alert alert = alert("a", "info", "payment-processor", "db", 1, 1);

        assertThat(alert.groupKey()).isEqualTo(new GroupKey("payment-processor", "db"));
        assertThat(alert.groupKey()).hasToString("payment-processor/db");
    }
}
