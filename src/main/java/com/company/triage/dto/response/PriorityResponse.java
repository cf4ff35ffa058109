package com.company.triage.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriorityResponse {
    private int alertCount;
    private int affectedComponents;
    private double priorityScore;
}
