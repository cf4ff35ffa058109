package com.company.triage.source;

import com.company.triage.domain.Alert;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw entry of the "alerts" array, before validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertPayload {
    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "timestamp is required")
    private String timestamp;

    @NotBlank(message = "service is required")
    private String service;

    @NotBlank(message = "component is required")
    private String component;

    @NotBlank(message = "severity is required")
    private String severity;

    @NotBlank(message = "metric is required")
    private String metric;

    @NotNull(message = "value is required")
    private Double value;

    @NotNull(message = "threshold is required")
    private Double threshold;

    @NotNull(message = "description is required")
    private String description;

    public Alert toAlert() {
        return Alert.builder()
                .id(id)
                .timestamp(timestamp)
                .service(service)
                .component(component)
                .severity(severity)
                .metric(metric)
                .value(value)
                .threshold(threshold)
                .description(description)
                .build();
    }
}
