package com.company.triage.source;

/**
 * Supplies a validated alert batch to the processing session.
 */
public interface AlertSource {

    /**
     * @throws com.company.triage.exception.AlertSourceException if the batch as a whole cannot be read
     */
    AlertBatch load();

    /**
     * Human-readable origin of the batch, for logs and responses.
     */
    String describe();
}
