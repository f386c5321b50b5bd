package com.phillippitts.mockinterview.domain;

import java.util.Locale;

/** Seniority the generated questions are pitched at. */
public enum ExperienceLevel {
    ENTRY,
    MID,
    SENIOR;

    public static ExperienceLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ExperienceLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
