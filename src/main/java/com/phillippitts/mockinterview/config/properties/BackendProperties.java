package com.phillippitts.mockinterview.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the backend collaborator that owns sessions, questions and scoring.
 * The base address is the engine's only environment dependency.
 */
@Validated
@ConfigurationProperties(prefix = "interview.backend")
public class BackendProperties {

    @NotBlank
    private final String baseUrl;

    @Positive
    private final int connectTimeoutMs;

    @Positive
    private final int readTimeoutMs;

    @ConstructorBinding
    public BackendProperties(String baseUrl, Integer connectTimeoutMs, Integer readTimeoutMs) {
        this.baseUrl = baseUrl;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 10_000 : readTimeoutMs;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }
}
