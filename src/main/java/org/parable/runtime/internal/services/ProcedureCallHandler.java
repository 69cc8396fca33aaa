package org.parable.runtime.internal.services;

import org.parable.runtime.model.CallFrame;
import org.parable.runtime.model.CallStack;
import org.parable.runtime.model.ExecutionState;
import org.parable.runtime.model.FrameKind;
import org.parable.runtime.model.MessageCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the call operation and the return path of EndSym.
 * A call saves the caller's cursor on the call stack and opens the target message;
 * EndSym at a depth above zero pops the frame and resumes the caller.
 */
public class ProcedureCallHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ProcedureCallHandler.class);

    private final ExecutionContext context;

    /**
     * Constructs a new ProcedureCallHandler.
     * @param context The execution context of the machine.
     */
    public ProcedureCallHandler(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Calls the message at the given address. When the call stack is full the call is ignored
     * and execution continues after the call operand. A call to an invalid address returns
     * to the caller immediately.
     *
     * @param targetAddress the absolute address of the called message
     * @return true if the call was entered
     */
    public boolean executeCall(int targetAddress) {
        MessageCursor cursor = context.getCursor();
        CallStack callStack = context.getCallStack();

        context.setState(ExecutionState.AWAITING_CALL);
        try {
            if (!callStack.push(cursor.snapshot(FrameKind.CALL))) {
                LOG.warn("Call stack overflow at depth {}: call to message {} from message {} position {} ignored",
                    callStack.depth(), targetAddress, cursor.getAddress(), cursor.getPosition());
                return false;
            }
            LOG.debug("Call message {} at depth {}", targetAddress, callStack.depth());
            if (!cursor.open(targetAddress)) {
                LOG.warn("Call to invalid message address {} ignored", targetAddress);
                cursor.restore(callStack.pop());
                return false;
            }
            return true;
        } finally {
            context.setState(ExecutionState.RUNNING);
        }
    }

    /**
     * Pops the innermost frame and resumes there.
     *
     * @return the frame that was resumed
     * @throws java.util.NoSuchElementException if the call stack is empty
     */
    public CallFrame executeReturn() {
        CallFrame frame = context.getCallStack().pop();
        LOG.debug("Return ({}) to message {} position {}", frame.kind(), frame.address(), frame.position());
        context.getCursor().restore(frame);
        return frame;
    }
}
