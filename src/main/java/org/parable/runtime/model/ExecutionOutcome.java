package org.parable.runtime.model;

/**
 * How a message execution ended.
 */
public enum ExecutionOutcome {
    /** EndSym was reached at call depth 0. */
    COMPLETED,
    /** The message address was invalid; nothing was executed. */
    EMPTY,
    /** The step watchdog stopped a runaway message. */
    RUNAWAY,
    /** Execution was stopped from outside. */
    CANCELLED,
    /** The message file could not be read. */
    STORE_ERROR
}
