package com.phillippitts.mockinterview.service.configurator;

import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.ExperienceLevel;
import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.InterviewType;
import com.phillippitts.mockinterview.domain.JobContext;
import com.phillippitts.mockinterview.domain.Question;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.ValidationException;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.backend.CreatedSession;
import com.phillippitts.mockinterview.service.backend.SessionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Validates interview parameters, packages them into a {@link SessionRequest} and asks the backend
 * to create the session and generate its questions.
 *
 * <p>Validation fails fast with a {@link ValidationException} naming the offending field; nothing
 * is sent to the backend in that case.
 */
@Service
public class SessionConfigurator {

    private static final Logger LOG = LogManager.getLogger(SessionConfigurator.class);

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_COMPANY_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final BackendClient backend;

    public SessionConfigurator(BackendClient backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    /**
     * Validates inputs and creates the session on the backend.
     *
     * @param jobContext      role being practiced (title required)
     * @param parameters      raw interview parameters
     * @param resumeReference optional uploaded resume reference
     * @param token           caller's bearer credential
     * @return backend session id with exactly {@code questionCount} questions
     * @throws ValidationException   if any field is invalid
     * @throws FatalSessionException if the backend returns fewer questions than requested
     */
    public ConfiguredSession submit(JobContext jobContext,
                                    InterviewParameters parameters,
                                    String resumeReference,
                                    AuthToken token) {
        Objects.requireNonNull(token, "token must not be null");
        SessionRequest request = validate(jobContext, parameters, resumeReference);

        CreatedSession created = backend.createSession(request, token);
        int expected = request.config().questionCount();
        List<Question> questions = created.questions();
        if (questions.size() < expected) {
            throw new FatalSessionException(created.sessionId(),
                    "Backend generated " + questions.size() + " questions, expected " + expected);
        }
        if (questions.size() > expected) {
            LOG.warn("Backend generated {} questions for session {}, keeping first {}",
                    questions.size(), created.sessionId(), expected);
            questions = questions.subList(0, expected);
        }
        LOG.info("Configured session {} (type={}, questions={}, minutesPerQuestion={})",
                created.sessionId(), request.config().interviewType(), expected,
                request.config().timePerQuestionMinutes());
        return new ConfiguredSession(created.sessionId(), request, questions);
    }

    /**
     * Validates inputs without contacting the backend.
     *
     * @return validated request
     * @throws ValidationException if any field is invalid
     */
    public SessionRequest validate(JobContext jobContext, InterviewParameters parameters, String resumeReference) {
        if (jobContext == null || jobContext.title() == null || jobContext.title().isBlank()) {
            throw new ValidationException("jobTitle", "is required");
        }
        if (jobContext.title().length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("jobTitle", "must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (jobContext.company() != null && jobContext.company().length() > MAX_COMPANY_LENGTH) {
            throw new ValidationException("company", "must be at most " + MAX_COMPANY_LENGTH + " characters");
        }
        if (jobContext.description() != null && jobContext.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("jobDescription",
                    "must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (parameters == null) {
            throw new ValidationException("parameters", "are required");
        }

        int questionCount = parameters.questionCount() != null
                ? parameters.questionCount() : InterviewParameters.DEFAULT_QUESTION_COUNT;
        if (questionCount < InterviewConfig.MIN_QUESTIONS || questionCount > InterviewConfig.MAX_QUESTIONS) {
            throw new ValidationException("questionCount", "must be between " + InterviewConfig.MIN_QUESTIONS
                    + " and " + InterviewConfig.MAX_QUESTIONS + ", got " + questionCount);
        }

        int minutes = parameters.timePerQuestionMinutes() != null
                ? parameters.timePerQuestionMinutes() : InterviewParameters.DEFAULT_MINUTES_PER_QUESTION;
        if (minutes < InterviewConfig.MIN_MINUTES_PER_QUESTION || minutes > InterviewConfig.MAX_MINUTES_PER_QUESTION) {
            throw new ValidationException("timePerQuestion", "must be between "
                    + InterviewConfig.MIN_MINUTES_PER_QUESTION + " and "
                    + InterviewConfig.MAX_MINUTES_PER_QUESTION + " minutes, got " + minutes);
        }

        InterviewType type = InterviewType.MIXED;
        if (parameters.interviewType() != null) {
            type = InterviewType.parse(parameters.interviewType());
            if (type == null) {
                throw new ValidationException("interviewType",
                        "must be one of Behavioral, Technical, Mixed, got '" + parameters.interviewType() + "'");
            }
        }

        ExperienceLevel level = ExperienceLevel.MID;
        if (parameters.experienceLevel() != null) {
            level = ExperienceLevel.parse(parameters.experienceLevel());
            if (level == null) {
                throw new ValidationException("experienceLevel",
                        "must be one of entry, mid, senior, got '" + parameters.experienceLevel() + "'");
            }
        }

        String resume = resumeReference == null || resumeReference.isBlank() ? null : resumeReference.trim();
        JobContext context = new JobContext(jobContext.title().trim(), jobContext.company(), jobContext.description());
        return new SessionRequest(context, new InterviewConfig(questionCount, minutes, type, level), resume);
    }
}
