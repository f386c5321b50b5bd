package com.phillippitts.mockinterview.presentation.controller;

import com.phillippitts.mockinterview.config.logging.SessionLogContext;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.JobContext;
import com.phillippitts.mockinterview.domain.SessionSummary;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.domain.ViolationKind;
import com.phillippitts.mockinterview.domain.ViolationSeverity;
import com.phillippitts.mockinterview.exception.UnauthorizedException;
import com.phillippitts.mockinterview.exception.ValidationException;
import com.phillippitts.mockinterview.service.configurator.InterviewParameters;
import com.phillippitts.mockinterview.service.preflight.PreflightReport;
import com.phillippitts.mockinterview.service.session.InterviewSessionService;
import com.phillippitts.mockinterview.service.session.NavigationAction;
import com.phillippitts.mockinterview.service.session.SessionSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * REST adapter over {@link InterviewSessionService}. Every call needs a bearer credential; the
 * credential is passed to the engine explicitly and never stored here.
 */
@RestController
@RequestMapping("/api/v1/mock-interviews")
class InterviewSessionController {

    private static final Logger LOG = LogManager.getLogger(InterviewSessionController.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final InterviewSessionService sessions;

    InterviewSessionController(InterviewSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    ResponseEntity<SessionSnapshot> configure(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                              @Valid @RequestBody ConfigureRequest body) {
        AuthToken token = bearer(auth);
        JobContext job = new JobContext(body.jobTitle(), body.company(), body.jobDescription());
        InterviewParameters params = new InterviewParameters(body.questionCount(), body.timePerQuestion(),
                body.interviewType(), body.experienceLevel());
        SessionSnapshot snapshot = sessions.configure(job, params, body.resumeReference(), token);
        withSession(snapshot.sessionId());
        LOG.info("Session {} configured with handle {}", snapshot.sessionId(), snapshot.handle());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
    }

    @PostMapping("/resume/{sessionId}")
    ResponseEntity<SessionSnapshot> resume(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                           @PathVariable String sessionId) {
        withSession(sessionId);
        return ResponseEntity.ok(sessions.resume(sessionId, bearer(auth)));
    }

    @GetMapping("/{handle}")
    ResponseEntity<SessionSnapshot> view(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                         @PathVariable UUID handle) {
        return ResponseEntity.ok(sessions.view(handle, bearer(auth)));
    }

    @PostMapping("/{handle}/capabilities")
    ResponseEntity<Void> reportCapabilities(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                            @PathVariable UUID handle,
                                            @RequestBody Map<String, Boolean> body) {
        Map<Capability, Boolean> reported = new EnumMap<>(Capability.class);
        body.forEach((name, available) -> reported.put(parseCapability(name), available));
        sessions.reportCapabilities(handle, bearer(auth), reported);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{handle}/preflight")
    ResponseEntity<PreflightReport> runPreflight(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                                 @PathVariable UUID handle) {
        return ResponseEntity.ok(sessions.runPreflight(handle, bearer(auth)));
    }

    @PostMapping("/{handle}/preflight/{check}/retry")
    ResponseEntity<PreflightReport> retryCheck(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                               @PathVariable UUID handle,
                                               @PathVariable String check) {
        return ResponseEntity.ok(sessions.retryCheck(handle, bearer(auth), parseCapability(check)));
    }

    @PutMapping("/{handle}/answers/{index}")
    ResponseEntity<SessionSnapshot> saveAnswer(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                               @PathVariable UUID handle,
                                               @PathVariable int index,
                                               @Valid @RequestBody AnswerRequest body) {
        return ResponseEntity.ok(sessions.saveAnswer(handle, bearer(auth), index, body.text(), AnswerChannel.TYPED));
    }

    @PutMapping("/{handle}/answers/{index}/voice")
    ResponseEntity<SessionSnapshot> saveVoiceAnswer(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                                    @PathVariable UUID handle,
                                                    @PathVariable int index,
                                                    @Valid @RequestBody AnswerRequest body) {
        return ResponseEntity.ok(sessions.saveAnswer(handle, bearer(auth), index, body.text(), AnswerChannel.VOICE));
    }

    @PostMapping("/{handle}/navigation")
    ResponseEntity<SessionSnapshot> navigate(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                             @PathVariable UUID handle,
                                             @Valid @RequestBody NavigationRequest body) {
        return ResponseEntity.ok(sessions.navigate(handle, bearer(auth), body.action(), body.targetIndex()));
    }

    @PostMapping("/{handle}/finish")
    ResponseEntity<SessionSnapshot> finish(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                           @PathVariable UUID handle) {
        return ResponseEntity.ok(sessions.finish(handle, bearer(auth)));
    }

    @PostMapping("/{handle}/abort")
    ResponseEntity<SessionSnapshot> abort(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                          @PathVariable UUID handle,
                                          @RequestBody(required = false) AbortRequest body) {
        return ResponseEntity.ok(sessions.abort(handle, bearer(auth), body == null ? null : body.reason()));
    }

    @PostMapping("/{handle}/signals")
    ResponseEntity<Void> reportSignal(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                      @PathVariable UUID handle,
                                      @Valid @RequestBody SignalRequest body) {
        Violation violation = new Violation(body.kind(), body.severity(), body.timestamp(), body.detail());
        sessions.reportSignal(handle, bearer(auth), violation);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{handle}/summary")
    ResponseEntity<SessionSummary> summary(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                           @PathVariable UUID handle) {
        return ResponseEntity.ok(sessions.summary(handle, bearer(auth)));
    }

    static AuthToken bearer(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException("Missing bearer credential");
        }
        String value = header.substring(BEARER_PREFIX.length()).trim();
        if (value.isEmpty()) {
            throw new UnauthorizedException("Missing bearer credential");
        }
        return new AuthToken(value);
    }

    static Capability parseCapability(String name) {
        try {
            return Capability.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("check", "unknown capability '" + name + "'");
        }
    }

    private static void withSession(String sessionId) {
        if (sessionId != null) {
            ThreadContext.put(SessionLogContext.SESSION_ID, sessionId);
        }
    }

    record ConfigureRequest(
            String jobTitle,
            String company,
            String jobDescription,
            Integer questionCount,
            Integer timePerQuestion,
            String interviewType,
            String experienceLevel,
            String resumeReference
    ) {}

    record AnswerRequest(@NotNull String text) {}

    record NavigationRequest(@NotNull NavigationAction action, Integer targetIndex) {}

    record AbortRequest(String reason) {}

    record SignalRequest(@NotNull ViolationKind kind, ViolationSeverity severity, Instant timestamp, String detail) {}
}
