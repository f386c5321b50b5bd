package com.phillippitts.mockinterview.service.integrity;

/**
 * What the session should do after a violation was recorded.
 */
public enum EscalationDecision {
    /** Keep going; nothing new to flag. */
    NONE,
    /** Threshold crossed for the first time: flag the session for review. */
    FLAG,
    /** Threshold crossed and termination is enabled: flag and abort. */
    FLAG_AND_TERMINATE
}
