package com.company.triage.source;

import com.company.triage.domain.Alert;
import com.company.triage.exception.AlertSourceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads {"alerts": [...]} from a Spring resource. Invalid entries are skipped
 * and counted; only an unreadable document fails the whole load.
 */
@Slf4j
public class JsonAlertSource implements AlertSource {

    private static final String ALERTS_FIELD = "alerts";

    private final Resource resource;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public JsonAlertSource(Resource resource, ObjectMapper objectMapper, Validator validator) {
        this.resource = resource;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @Override
    public AlertBatch load() {
        JsonNode root = readDocument();

        JsonNode entries = root.get(ALERTS_FIELD);
        if (entries == null || !entries.isArray()) {
            throw new AlertSourceException(
                    "Invalid alert document " + describe() + ": missing '" + ALERTS_FIELD + "' array");
        }

        List<Alert> alerts = new ArrayList<>();
        int rejected = 0;
        int index = 0;

        for (JsonNode entry : entries) {
            try {
                alerts.add(toAlert(entry));
            } catch (InvalidAlertEntryException e) {
                rejected++;
                log.warn("Skipping invalid alert at index {} in {}: {}", index, describe(), e.getMessage());
            }
            index++;
        }

        log.info("Loaded {} alerts from {} ({} rejected)", alerts.size(), describe(), rejected);

        return new AlertBatch(alerts, rejected, describe());
    }

    @Override
    public String describe() {
        return resource.getDescription();
    }

    private JsonNode readDocument() {
        if (!resource.exists()) {
            throw new AlertSourceException("Alert source not found: " + describe());
        }

        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isObject()) {
                throw new AlertSourceException("Invalid alert document " + describe() + ": expected a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AlertSourceException("Invalid JSON in " + describe() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new AlertSourceException("Failed to read alerts from " + describe(), e);
        }
    }

    private Alert toAlert(JsonNode entry) {
        if (!entry.isObject()) {
            throw new InvalidAlertEntryException("entry is not a JSON object");
        }

        AlertPayload payload;
        try {
            payload = objectMapper.treeToValue(entry, AlertPayload.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAlertEntryException(e.getOriginalMessage());
        }

        Set<ConstraintViolation<AlertPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(", "));
            throw new InvalidAlertEntryException(reasons);
        }

        return payload.toAlert();
    }

    private static class InvalidAlertEntryException extends RuntimeException {
        InvalidAlertEntryException(String message) {
            super(message);
        }
    }
}
