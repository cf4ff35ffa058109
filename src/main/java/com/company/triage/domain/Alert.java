package com.company.triage.domain;

import com.company.triage.exception.TimestampParseException;
import com.company.triage.util.TimestampParser;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * A single metric observation that crossed its threshold.
 * Immutable once built by an alert source.
 */
@Value
@Builder
public class Alert {
    String id;
    String timestamp; // ISO-8601, UTC
    String service;
    String component;
    String severity; // raw label, not necessarily a known SeverityLevel
    String metric;
    double value;
    double threshold;
    String description;

    /**
     * @throws TimestampParseException if the timestamp is not valid ISO-8601
     */
    public Instant parsedTime() {
        try {
            return TimestampParser.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new TimestampParseException(id, timestamp, e);
        }
    }

    /**
     * Signed percentage distance of the value from the threshold; 0.0 for a zero threshold.
     */
    public double deviationPercent() {
        if (threshold == 0) {
            return 0.0;
        }
        return ((value - threshold) / threshold) * 100;
    }

    public GroupKey groupKey() {
        return new GroupKey(service, component);
    }
}
