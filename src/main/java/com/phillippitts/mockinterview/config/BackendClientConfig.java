package com.phillippitts.mockinterview.config;

import com.phillippitts.mockinterview.config.properties.BackendProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the HTTP client used to talk to the backend collaborator.
 */
@Configuration
public class BackendClientConfig {

    private static final Logger LOG = LogManager.getLogger(BackendClientConfig.class);

    @Bean(name = "backendRestTemplate")
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, BackendProperties props) {
        LOG.info("Backend collaborator at {} (connectTimeout={}ms, readTimeout={}ms)",
                props.getBaseUrl(), props.getConnectTimeoutMs(), props.getReadTimeoutMs());
        return builder
                .rootUri(props.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .build();
    }
}
