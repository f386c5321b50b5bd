package com.phillippitts.mockinterview.domain;

/** Input channel an answer revision came from. */
public enum AnswerChannel {
    TYPED,
    VOICE
}
