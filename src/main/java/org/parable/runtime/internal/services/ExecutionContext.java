package org.parable.runtime.internal.services;

import org.parable.runtime.model.CallStack;
import org.parable.runtime.model.ExecutionState;
import org.parable.runtime.model.MessageCursor;
import org.parable.runtime.spi.IOpcodeHost;

/**
 * The mutable state of one virtual machine instance: the cursor, the call stack, the test flag
 * and the execution state. Every dispatch helper works on a context instead of shared fields,
 * so independent machines never interfere with each other.
 */
public class ExecutionContext {

    private final MessageCursor cursor;
    private final CallStack callStack;
    private final IOpcodeHost host;
    private boolean testFlag;
    private ExecutionState state = ExecutionState.ENDED;

    /**
     * Creates a new execution context.
     * @param cursor The cursor over the message being executed.
     * @param callStack The call stack for calls and case bodies.
     * @param host The host that gives opcodes their effect.
     */
    public ExecutionContext(MessageCursor cursor, CallStack callStack, IOpcodeHost host) {
        this.cursor = cursor;
        this.callStack = callStack;
        this.host = host;
    }

    public MessageCursor getCursor() {
        return cursor;
    }

    public CallStack getCallStack() {
        return callStack;
    }

    public IOpcodeHost getHost() {
        return host;
    }

    public boolean isTestFlag() {
        return testFlag;
    }

    public void setTestFlag(boolean testFlag) {
        this.testFlag = testFlag;
    }

    public ExecutionState getState() {
        return state;
    }

    public void setState(ExecutionState state) {
        this.state = state;
    }
}
