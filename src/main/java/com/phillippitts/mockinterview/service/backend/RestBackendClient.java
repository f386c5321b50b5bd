package com.phillippitts.mockinterview.service.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.ExperienceLevel;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.InterviewType;
import com.phillippitts.mockinterview.domain.Question;
import com.phillippitts.mockinterview.domain.ScoreDimension;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.exception.BackendExceptionBuilder;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link BackendClient} over HTTP/JSON using Spring's {@link RestTemplate}.
 *
 * <p>Wire payloads use the backend's snake_case field names. Scores arrive on the raw 0-10
 * scale and are passed through untouched; normalization belongs to the score aggregator.
 *
 * <p><b>Error Handling:</b> every HTTP failure goes through {@link BackendExceptionBuilder}, so
 * callers only ever see the engine taxonomy, never Spring client exceptions.
 */
@Component
public class RestBackendClient implements BackendClient {

    private static final Logger LOG = LogManager.getLogger(RestBackendClient.class);

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    static final int DEFAULT_TIME_LIMIT_SECONDS = 180;

    private final RestTemplate restTemplate;

    public RestBackendClient(@Qualifier("backendRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
    }

    @Override
    public CreatedSession createSession(SessionRequest request, AuthToken token) {
        InterviewConfig config = request.config();
        CreateSessionBody body = new CreateSessionBody(
                request.jobContext().title(),
                request.jobContext().company(),
                request.jobContext().description(),
                config.interviewType().wireValue(),
                config.experienceLevel().wireValue(),
                config.questionCount(),
                config.timeLimitSeconds(),
                request.resumeReference());

        CreateSessionResponse response = call("createSession", null, () ->
                restTemplate.exchange("/sessions", HttpMethod.POST, entity(body, token), CreateSessionResponse.class));
        if (response == null || response.sessionId() == null) {
            throw new FatalSessionException("unknown", "Backend returned no session id");
        }
        LOG.info("Backend created session {} with {} questions", response.sessionId(),
                response.questions() == null ? 0 : response.questions().size());
        return new CreatedSession(response.sessionId(), toQuestions(response.questions(), config.timeLimitSeconds()));
    }

    @Override
    public SessionRecord fetchSession(String sessionId, AuthToken token) {
        SessionResponse response = call("fetchSession", sessionId, () ->
                restTemplate.exchange("/sessions/{id}", HttpMethod.GET, entity(null, token),
                        SessionResponse.class, sessionId));
        if (response == null) {
            throw new FatalSessionException(sessionId, "Backend returned an empty session record");
        }
        InterviewConfig config = toConfig(response);
        int fallbackLimit = config != null ? config.timeLimitSeconds() : DEFAULT_TIME_LIMIT_SECONDS;
        return new SessionRecord(
                response.sessionId() != null ? response.sessionId() : sessionId,
                response.status(),
                config,
                toQuestions(response.questions(), fallbackLimit),
                toAnswers(response.responses()),
                toFeedback(response.aiFeedback(), response.overallScore()),
                Boolean.TRUE.equals(response.flaggedForReview()));
    }

    @Override
    public void saveAnswer(String sessionId, Answer answer, AuthToken token) {
        AnswerBody body = new AnswerBody(answer.questionIndex(), answer.text(), answer.timeSpentSeconds(),
                answer.channel().name().toLowerCase(Locale.ROOT));
        call("saveAnswer", sessionId, () -> restTemplate.exchange("/sessions/{id}/answers/{index}",
                HttpMethod.PUT, entity(body, token), Void.class, sessionId, answer.questionIndex()));
    }

    @Override
    public void submitCompletion(CompletionSubmission submission, AuthToken token) {
        List<AnswerBody> answers = new ArrayList<>(submission.answers().size());
        for (Answer a : submission.answers()) {
            answers.add(new AnswerBody(a.questionIndex(), a.text(), a.timeSpentSeconds(),
                    a.channel().name().toLowerCase(Locale.ROOT)));
        }
        List<ViolationBody> violations = new ArrayList<>(submission.violations().size());
        for (Violation v : submission.violations()) {
            violations.add(new ViolationBody(v.kind().name().toLowerCase(Locale.ROOT), v.severity().name().toLowerCase(Locale.ROOT),
                    v.timestamp(), v.detail()));
        }
        CompletionBody body = new CompletionBody(submission.idempotencyKey(), answers, violations,
                submission.flaggedForReview(), submission.totalDurationSeconds(), submission.completedAt());

        HttpHeaders headers = headers(token);
        headers.set(IDEMPOTENCY_HEADER, submission.idempotencyKey());
        call("submitCompletion", submission.sessionId(), () -> restTemplate.exchange("/sessions/{id}/completion",
                HttpMethod.PUT, new HttpEntity<>(body, headers), Void.class, submission.sessionId()));
    }

    @Override
    public boolean ping() {
        try {
            ResponseEntity<Void> response = restTemplate.exchange("/health", HttpMethod.GET, HttpEntity.EMPTY, Void.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            LOG.debug("Backend health probe failed: {}", e.toString());
            return false;
        }
    }

    private <T> T call(String operation, String sessionId, Supplier<ResponseEntity<T>> exchange) {
        try {
            return exchange.get().getBody();
        } catch (HttpStatusCodeException e) {
            throw BackendExceptionBuilder.create("Backend call failed")
                    .operation(operation)
                    .session(sessionId)
                    .status(e.getStatusCode().value())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw BackendExceptionBuilder.create("Backend unreachable")
                    .operation(operation)
                    .session(sessionId)
                    .cause(e)
                    .build();
        }
    }

    private static HttpEntity<Object> entity(Object body, AuthToken token) {
        return new HttpEntity<>(body, headers(token));
    }

    private static HttpHeaders headers(AuthToken token) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, token.bearerHeader());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static List<Question> toQuestions(List<QuestionBody> bodies, int fallbackLimitSeconds) {
        if (bodies == null) {
            return List.of();
        }
        List<Question> questions = new ArrayList<>(bodies.size());
        for (QuestionBody q : bodies) {
            int limit = q.timeLimit() != null && q.timeLimit() > 0 ? q.timeLimit() : fallbackLimitSeconds;
            questions.add(new Question(q.id(), q.questionText() == null ? "" : q.questionText(), q.type(),
                    q.category(), q.difficultyLevel(), q.skillsAssessed(), limit));
        }
        return questions;
    }

    private static List<Answer> toAnswers(List<ResponseBody> bodies) {
        if (bodies == null) {
            return List.of();
        }
        List<Answer> answers = new ArrayList<>(bodies.size());
        for (int i = 0; i < bodies.size(); i++) {
            ResponseBody r = bodies.get(i);
            if (r == null || r.responseText() == null) {
                continue;
            }
            int index = r.questionIndex() != null ? r.questionIndex() : i;
            Instant at = r.submittedAt() != null ? r.submittedAt() : Instant.now();
            long spent = r.timeSpent() != null ? Math.max(0, r.timeSpent()) : 0;
            answers.add(new Answer(index, r.responseText(), at, spent, AnswerChannel.TYPED));
        }
        return answers;
    }

    private static Feedback toFeedback(FeedbackBody body, Double overallScore) {
        if (body == null) {
            return null;
        }
        Map<ScoreDimension, Double> subscores = new EnumMap<>(ScoreDimension.class);
        putIfPresent(subscores, ScoreDimension.COMMUNICATION, body.communicationScore());
        putIfPresent(subscores, ScoreDimension.TECHNICAL, body.technicalScore());
        putIfPresent(subscores, ScoreDimension.PROBLEM_SOLVING, body.problemSolvingScore());
        putIfPresent(subscores, ScoreDimension.BEHAVIORAL, body.behavioralScore());
        double overall = body.overallScore() != null ? body.overallScore()
                : overallScore != null ? overallScore : 0.0;
        return new Feedback(overall, subscores, body.strengths(), body.weaknesses(), body.recommendations());
    }

    private static void putIfPresent(Map<ScoreDimension, Double> map, ScoreDimension key, Double value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static InterviewConfig toConfig(SessionResponse r) {
        InterviewType type = InterviewType.parse(r.interviewType());
        ExperienceLevel level = ExperienceLevel.parse(r.experienceLevel());
        if (r.questionCount() == null || r.timeLimitPerQuestion() == null || type == null || level == null) {
            return null;
        }
        int minutes = (int) Math.round(r.timeLimitPerQuestion() / 60.0);
        minutes = Math.max(InterviewConfig.MIN_MINUTES_PER_QUESTION,
                Math.min(InterviewConfig.MAX_MINUTES_PER_QUESTION, minutes));
        int count = Math.max(InterviewConfig.MIN_QUESTIONS, Math.min(InterviewConfig.MAX_QUESTIONS, r.questionCount()));
        return new InterviewConfig(count, minutes, type, level);
    }

    // --- Wire payloads ---

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateSessionBody(
            @JsonProperty("job_title") String jobTitle,
            @JsonProperty("company") String company,
            @JsonProperty("job_description") String jobDescription,
            @JsonProperty("interview_type") String interviewType,
            @JsonProperty("experience_level") String experienceLevel,
            @JsonProperty("question_count") int questionCount,
            @JsonProperty("time_limit_per_question") int timeLimitPerQuestion,
            @JsonProperty("resume_reference") String resumeReference) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateSessionResponse(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("questions") List<QuestionBody> questions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuestionBody(
            @JsonProperty("id") String id,
            @JsonProperty("question_text") String questionText,
            @JsonProperty("type") String type,
            @JsonProperty("category") String category,
            @JsonProperty("difficulty_level") String difficultyLevel,
            @JsonProperty("skills_assessed") Set<String> skillsAssessed,
            @JsonProperty("time_limit") Integer timeLimit) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionResponse(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("status") String status,
            @JsonProperty("interview_type") String interviewType,
            @JsonProperty("experience_level") String experienceLevel,
            @JsonProperty("question_count") Integer questionCount,
            @JsonProperty("time_limit_per_question") Integer timeLimitPerQuestion,
            @JsonProperty("questions") List<QuestionBody> questions,
            @JsonProperty("responses") List<ResponseBody> responses,
            @JsonProperty("ai_feedback") FeedbackBody aiFeedback,
            @JsonProperty("overall_score") Double overallScore,
            @JsonProperty("flagged_for_review") Boolean flaggedForReview) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseBody(
            @JsonProperty("question_index") Integer questionIndex,
            @JsonProperty("response_text") String responseText,
            @JsonProperty("submitted_at") Instant submittedAt,
            @JsonProperty("time_spent") Long timeSpent) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FeedbackBody(
            @JsonProperty("overall_score") Double overallScore,
            @JsonProperty("communication_score") Double communicationScore,
            @JsonProperty("technical_score") Double technicalScore,
            @JsonProperty("problem_solving_score") Double problemSolvingScore,
            @JsonProperty("behavioral_score") Double behavioralScore,
            @JsonProperty("strengths") List<String> strengths,
            @JsonProperty("weaknesses") List<String> weaknesses,
            @JsonProperty("recommendations") List<String> recommendations) {}

    record AnswerBody(
            @JsonProperty("question_index") int questionIndex,
            @JsonProperty("response_text") String responseText,
            @JsonProperty("time_spent") long timeSpent,
            @JsonProperty("channel") String channel) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ViolationBody(
            @JsonProperty("event_type") String eventType,
            @JsonProperty("severity") String severity,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("description") String description) {}

    record CompletionBody(
            @JsonProperty("submission_id") String submissionId,
            @JsonProperty("responses") List<AnswerBody> responses,
            @JsonProperty("anti_cheat_events") List<ViolationBody> antiCheatEvents,
            @JsonProperty("flagged_for_review") boolean flaggedForReview,
            @JsonProperty("total_duration") long totalDuration,
            @JsonProperty("completed_at") Instant completedAt) {}
}
