package com.company.triage.service;

import com.company.triage.domain.Alert;
import com.company.triage.dto.request.FilterCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class AlertFilterService {

    private final Clock clock;

    /**
     * Apply every supplied criterion as a conjunction, preserving input order.
     * The recency cutoff is computed once per call.
     *
     * @throws IllegalArgumentException if the recency window is negative
     * @throws com.company.triage.exception.TimestampParseException if a recency check meets a bad timestamp
     */
    public List<Alert> filter(List<Alert> alerts, FilterCriteria criteria) {
        if (alerts.isEmpty()) {
            return List.of();
        }
        if (criteria == null || criteria.isEmpty()) {
            return List.copyOf(alerts);
        }

        Predicate<Alert> predicate = alert -> true;

        if (criteria.hasSeverity()) {
            String severity = criteria.getSeverity().toLowerCase(Locale.ROOT);
            predicate = predicate.and(alert -> severity.equals(lower(alert.getSeverity())));
        }

        if (criteria.hasService()) {
            String service = criteria.getService().toLowerCase(Locale.ROOT);
            predicate = predicate.and(alert -> service.equals(lower(alert.getService())));
        }

        if (criteria.hasWindow()) {
            if (criteria.getWindowMinutes() < 0) {
                throw new IllegalArgumentException(
                        "Recency window must not be negative: " + criteria.getWindowMinutes());
            }
            Instant cutoff = clock.instant().minus(Duration.ofMinutes(criteria.getWindowMinutes()));
            predicate = predicate.and(alert -> !alert.parsedTime().isBefore(cutoff));
        }

        List<Alert> filtered = alerts.stream()
                .filter(predicate)
                .collect(Collectors.toUnmodifiableList());

        log.debug("Filter {} kept {} of {} alerts", criteria, filtered.size(), alerts.size());

        return filtered;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
