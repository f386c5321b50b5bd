package com.phillippitts.mockinterview.domain;

/**
 * Kinds of integrity signals the monitoring collaborator can raise, with the severity
 * assumed when a signal does not carry one.
 */
public enum ViolationKind {
    TAB_SWITCH(ViolationSeverity.WARNING),
    WINDOW_FOCUS_LOST(ViolationSeverity.WARNING),
    FULLSCREEN_EXIT(ViolationSeverity.WARNING),
    MULTIPLE_FACES(ViolationSeverity.CRITICAL),
    FACE_NOT_DETECTED(ViolationSeverity.WARNING),
    SUSPICIOUS_ACTIVITY(ViolationSeverity.INFO),
    BROWSER_DEV_TOOLS(ViolationSeverity.CRITICAL),
    SCREENSHOT_ATTEMPT(ViolationSeverity.WARNING),
    EXTERNAL_DEVICE(ViolationSeverity.WARNING);

    private final ViolationSeverity defaultSeverity;

    ViolationKind(ViolationSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public ViolationSeverity defaultSeverity() {
        return defaultSeverity;
    }
}
