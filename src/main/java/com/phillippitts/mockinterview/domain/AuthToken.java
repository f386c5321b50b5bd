package com.phillippitts.mockinterview.domain;

/**
 * Bearer credential issued by the external auth collaborator and passed explicitly into the engine.
 *
 * @param value raw token value
 */
public record AuthToken(String value) {

    public AuthToken {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Auth token must not be blank");
        }
    }

    public String bearerHeader() {
        return "Bearer " + value;
    }

    /**
     * Short stable fingerprint used to key per-user state without keeping the raw token in logs.
     */
    public String fingerprint() {
        return Integer.toHexString(value.hashCode());
    }

    @Override
    public String toString() {
        return "AuthToken[" + fingerprint() + "]";
    }
}
