package org.parable.runtime.model;

/**
 * Why a {@link CallFrame} was pushed.
 */
public enum FrameKind {
    /** A subroutine call; EndSym in the callee returns to the caller. */
    CALL,
    /** A matched case body; EndSym in the body resumes after the case block. */
    CASE
}
