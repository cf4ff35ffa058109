package com.company.triage.domain.enums;

import java.util.Optional;

public enum SeverityLevel {
    CRITICAL("critical", 10),
    WARNING("warning", 5),
    INFO("info", 1);

    private final String label;
    private final int weight;

    SeverityLevel(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    public String getLabel() {
        return label;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Exact, case-sensitive lookup by label. Unknown labels are not an error.
     */
    public static Optional<SeverityLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (SeverityLevel level : values()) {
            if (level.label.equals(label)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
