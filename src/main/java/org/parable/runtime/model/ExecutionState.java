package org.parable.runtime.model;

/**
 * The lifecycle of one message execution.
 */
public enum ExecutionState {
    RUNNING,
    /** Transient, while a call is being set up. */
    AWAITING_CALL,
    ENDED
}
