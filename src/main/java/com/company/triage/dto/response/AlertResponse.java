package com.company.triage.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private String id;
    private String timestamp;
    private String service;
    private String component;
    private String severity;
    private String metric;
    private double value;
    private double threshold;
    private double deviationPercent;
    private String description;
}
