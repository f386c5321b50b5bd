package com.phillippitts.mockinterview.service.preflight;

/** State of one preflight check: {@code CHECKING → SUCCESS | FAILED}. */
public enum CheckStatus {
    CHECKING,
    SUCCESS,
    FAILED
}
