package com.phillippitts.mockinterview.domain;

/** Severity of an integrity violation, ordered from least to most serious. */
public enum ViolationSeverity {
    INFO,
    WARNING,
    CRITICAL;

    public boolean isAtLeast(ViolationSeverity other) {
        return other == null || compareTo(other) >= 0;
    }
}
