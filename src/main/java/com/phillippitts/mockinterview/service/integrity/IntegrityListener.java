package com.phillippitts.mockinterview.service.integrity;

import com.phillippitts.mockinterview.domain.Violation;

import java.util.List;

/**
 * Receives the violations found by one monitor evaluation. Never called with an empty list.
 */
@FunctionalInterface
public interface IntegrityListener {

    void onViolations(IntegrityMonitor monitor, List<Violation> violations);
}
