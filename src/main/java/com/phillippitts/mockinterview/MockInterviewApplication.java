package com.phillippitts.mockinterview;

import com.phillippitts.mockinterview.config.properties.BackendProperties;
import com.phillippitts.mockinterview.config.properties.CompletionProperties;
import com.phillippitts.mockinterview.config.properties.FeedbackPollingProperties;
import com.phillippitts.mockinterview.config.properties.IntegrityProperties;
import com.phillippitts.mockinterview.config.properties.PreflightProperties;
import com.phillippitts.mockinterview.config.properties.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        BackendProperties.class,
        SessionProperties.class,
        PreflightProperties.class,
        IntegrityProperties.class,
        FeedbackPollingProperties.class,
        CompletionProperties.class
})
@EnableScheduling
public class MockInterviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(MockInterviewApplication.class, args);
    }

}
