package com.phillippitts.mockinterview.domain;

/**
 * Environment capabilities probed before a session may start.
 */
public enum Capability {
    CAMERA,
    MICROPHONE,
    NETWORK,
    ENVIRONMENT
}
