package org.parable.runtime.model;

/**
 * Summary of one message execution.
 *
 * @param outcome            how the execution ended
 * @param steps              dispatch steps taken
 * @param emittedCharacters  characters passed to the host
 * @param finalDepth         call-stack depth when execution stopped
 */
public record ExecutionResult(ExecutionOutcome outcome, int steps, int emittedCharacters, int finalDepth) {

    /**
     * @return true if execution ended for any reason other than reaching EndSym or an empty message
     */
    public boolean isAbnormal() {
        return outcome != ExecutionOutcome.COMPLETED && outcome != ExecutionOutcome.EMPTY;
    }
}
