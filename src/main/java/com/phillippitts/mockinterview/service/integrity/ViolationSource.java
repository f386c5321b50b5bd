package com.phillippitts.mockinterview.service.integrity;

import com.phillippitts.mockinterview.domain.Violation;

import java.util.List;
import java.util.UUID;

/**
 * Source of integrity signals for a session. Each poll returns the violations observed since
 * the previous poll; an empty list means nothing was observed.
 */
public interface ViolationSource {

    List<Violation> poll(UUID handle);
}
