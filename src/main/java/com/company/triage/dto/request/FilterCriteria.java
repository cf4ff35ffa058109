package com.company.triage.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional filter constraints; omitted (null or blank) ones impose nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterCriteria {
    private String severity;       // case-insensitive exact match
    private String service;        // case-insensitive exact match
    private Integer windowMinutes; // keep alerts no older than this; null or 0 = no limit

    public static FilterCriteria none() {
        return new FilterCriteria();
    }

    public boolean hasSeverity() {
        return severity != null && !severity.isBlank();
    }

    public boolean hasService() {
        return service != null && !service.isBlank();
    }

    public boolean hasWindow() {
        return windowMinutes != null && windowMinutes != 0;
    }

    public boolean isEmpty() {
        return !hasSeverity() && !hasService() && !hasWindow();
    }
}
