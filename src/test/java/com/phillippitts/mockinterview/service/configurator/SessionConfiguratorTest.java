package com.phillippitts.mockinterview.service.configurator;

import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.ExperienceLevel;
import com.phillippitts.mockinterview.domain.InterviewType;
import com.phillippitts.mockinterview.domain.JobContext;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.exception.ValidationException;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.backend.SessionRequest;
import com.phillippitts.mockinterview.testutil.FakeBackendClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SessionConfiguratorTest {

    private static final AuthToken TOKEN = new AuthToken("token-1");

    @ParameterizedTest
    @ValueSource(ints = {5, 6, 10, 15, 19, 20})
    void returnsExactlyRequestedQuestionCount(int count) {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());

        ConfiguredSession configured = configurator.submit(JobContext.of("Backend Engineer"),
                InterviewParameters.of(count, 2, "Behavioral"), null, TOKEN);

        assertThat(configured.questions()).hasSize(count);
        assertThat(configured.request().config().questionCount()).isEqualTo(count);
        assertThat(configured.sessionId()).isNotBlank();
    }

    @Test
    void trimsSurplusQuestions() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient().extraQuestions(3));

        ConfiguredSession configured = configurator.submit(JobContext.of("SRE"),
                InterviewParameters.of(5, 1, "technical"), null, TOKEN);

        assertThat(configured.questions()).hasSize(5);
    }

    @Test
    void tooFewQuestionsIsFatal() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient().extraQuestions(-2));

        assertThatThrownBy(() -> configurator.submit(JobContext.of("SRE"),
                InterviewParameters.of(8, 1, "technical"), null, TOKEN))
                .isInstanceOf(FatalSessionException.class)
                .hasMessageContaining("expected 8");
    }

    @Test
    void appliesFormDefaults() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());

        SessionRequest request = configurator.validate(new JobContext("  Data Analyst ", "Acme", null),
                new InterviewParameters(null, null, null, null), "  ");

        assertThat(request.config().questionCount()).isEqualTo(10);
        assertThat(request.config().timePerQuestionMinutes()).isEqualTo(3);
        assertThat(request.config().interviewType()).isEqualTo(InterviewType.MIXED);
        assertThat(request.config().experienceLevel()).isEqualTo(ExperienceLevel.MID);
        assertThat(request.jobContext().title()).isEqualTo("Data Analyst");
        assertThat(request.resumeReference()).isNull();
    }

    @Test
    void missingTitleFailsWithoutContactingBackend() {
        BackendClient backend = mock(BackendClient.class);
        SessionConfigurator configurator = new SessionConfigurator(backend);

        assertThatThrownBy(() -> configurator.submit(new JobContext(" ", null, null),
                InterviewParameters.of(10, 3, "mixed"), null, TOKEN))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("jobTitle"));
        verify(backend, never()).createSession(any(), any());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 4, 21, 100})
    void rejectsQuestionCountOutOfRange(int count) {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());

        assertThatThrownBy(() -> configurator.validate(JobContext.of("QA"),
                InterviewParameters.of(count, 2, "mixed"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("questionCount"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6})
    void rejectsMinutesOutOfRange(int minutes) {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());

        assertThatThrownBy(() -> configurator.validate(JobContext.of("QA"),
                InterviewParameters.of(10, minutes, "mixed"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("timePerQuestion"));
    }

    @Test
    void rejectsUnknownTypeAndLevel() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());

        assertThatThrownBy(() -> configurator.validate(JobContext.of("QA"),
                InterviewParameters.of(10, 2, "panel"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("interviewType"));
        assertThatThrownBy(() -> configurator.validate(JobContext.of("QA"),
                new InterviewParameters(10, 2, "mixed", "principal"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("experienceLevel"));
    }

    @Test
    void rejectsOverlongFields() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient());
        String longCompany = "c".repeat(SessionConfigurator.MAX_COMPANY_LENGTH + 1);

        assertThatThrownBy(() -> configurator.validate(new JobContext("QA", longCompany, null),
                InterviewParameters.of(10, 2, "mixed"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("company"));
    }

    @Test
    void backendFailurePropagates() {
        SessionConfigurator configurator = new SessionConfigurator(new FakeBackendClient()
                .failCreate(() -> new NetworkException("timeout")));

        assertThatThrownBy(() -> configurator.submit(JobContext.of("QA"),
                InterviewParameters.of(10, 2, "mixed"), null, TOKEN))
                .isInstanceOf(NetworkException.class);
    }
}
