package com.company.triage.exception;

import lombok.Getter;

@Getter
public class TimestampParseException extends RuntimeException {

    private final String alertId;
    private final String timestamp;

    public TimestampParseException(String alertId, String timestamp, Throwable cause) {
        super("Invalid ISO-8601 timestamp '" + timestamp + "' on alert " + alertId, cause);
        this.alertId = alertId;
        this.timestamp = timestamp;
    }
}
