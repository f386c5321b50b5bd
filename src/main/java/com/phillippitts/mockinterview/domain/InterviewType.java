package com.phillippitts.mockinterview.domain;

import java.util.Locale;

/**
 * Flavour of questions the backend generates for a session.
 */
public enum InterviewType {
    BEHAVIORAL,
    TECHNICAL,
    MIXED;

    /**
     * Parses a case-insensitive name ("Behavioral", "technical", ...).
     *
     * @param value raw value
     * @return matching type, or {@code null} when value is null or unknown
     */
    public static InterviewType parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return InterviewType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
