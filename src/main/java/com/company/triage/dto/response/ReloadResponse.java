package com.company.triage.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReloadResponse {
    private int loadedAlerts;
    private int rejectedAlerts;
    private String source;
    private Instant reloadedAt;
}
