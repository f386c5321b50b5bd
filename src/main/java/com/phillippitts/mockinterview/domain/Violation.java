package com.phillippitts.mockinterview.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A recorded integrity-monitoring event. Violations never block the session.
 *
 * @param kind      what was observed
 * @param severity  how serious it is
 * @param timestamp when it was observed
 * @param detail    optional free-form description (no candidate content)
 */
public record Violation(
        ViolationKind kind,
        ViolationSeverity severity,
        Instant timestamp,
        String detail
) {

    public Violation {
        Objects.requireNonNull(kind, "kind must not be null");
        if (severity == null) {
            severity = kind.defaultSeverity();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static Violation of(ViolationKind kind, ViolationSeverity severity) {
        return new Violation(kind, severity, Instant.now(), null);
    }
}
