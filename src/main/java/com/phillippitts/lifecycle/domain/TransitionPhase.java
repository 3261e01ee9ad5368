package com.phillippitts.lifecycle.domain;

/**
 * Phase a transition context is in when it is handed to a validator or recorded.
 */
public enum TransitionPhase {
    PRE_EXECUTION,
    EXECUTION,
    POST_EXECUTION,
    ERROR
}
