package com.company.triage.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroupResponse {
    private String service;
    private String component;
    private int totalAlerts;
    private Map<String, Integer> severityCounts;
    private double priorityScore;
    private List<AlertResponse> alerts;
}
