package org.parable.runtime;

import org.parable.runtime.codec.ControlCode;
import org.parable.runtime.codec.SymbolCodec;
import org.parable.runtime.config.VmOptions;
import org.parable.runtime.internal.services.CaseDispatcher;
import org.parable.runtime.internal.services.ExecutionContext;
import org.parable.runtime.internal.services.ProcedureCallHandler;
import org.parable.runtime.model.CallStack;
import org.parable.runtime.model.ExecutionOutcome;
import org.parable.runtime.model.ExecutionResult;
import org.parable.runtime.model.ExecutionState;
import org.parable.runtime.model.MessageCursor;
import org.parable.runtime.model.Opcode;
import org.parable.runtime.model.OpcodeCategory;
import org.parable.runtime.spi.IOpcodeHost;
import org.parable.runtime.store.MessageStoreException;
import org.parable.runtime.store.PagedMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Interpreter for message procedures.
 * <p>
 * A message is a stream of 6-bit symbols. Symbols that decode to text are passed to the
 * {@link IOpcodeHost}; symbols that decode to a {@link ControlCode} start a control operation
 * that may read further operands from the same stream. Control flow is position-addressed:
 * jumps move the cursor to symbol positions, not to instruction boundaries.
 * <p>
 * Execution of one message, nested calls included, runs to completion inside
 * {@link #executeMessage()}. Calls use an explicit, bounded frame stack. A step watchdog stops
 * malformed messages that would otherwise loop forever.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final VmOptions options;
    private final ExecutionContext context;
    private final ProcedureCallHandler callHandler;
    private final CaseDispatcher caseDispatcher;

    private volatile boolean stillRunning = true;
    private boolean suppressText;
    private boolean lastOpenFailed = true;

    /**
     * Creates a machine with default options.
     *
     * @param store the message store
     * @param host  the host giving opcodes their effect
     */
    public VirtualMachine(PagedMessageStore store, IOpcodeHost host) {
        this(store, host, VmOptions.DEFAULTS);
    }

    /**
     * Creates a machine.
     *
     * @param store   the message store
     * @param host    the host giving opcodes their effect
     * @param options call depth, step limit and text suppression
     */
    public VirtualMachine(PagedMessageStore store, IOpcodeHost host, VmOptions options) {
        this.options = options;
        this.context = new ExecutionContext(new MessageCursor(store), new CallStack(options.maxCallDepth()), host);
        this.callHandler = new ProcedureCallHandler(context);
        this.caseDispatcher = new CaseDispatcher(context);
        this.suppressText = options.suppressText();
    }

    /**
     * Opens the message at the given address. Any frames left from a previous message are
     * discarded. An invalid address produces an empty message that ends immediately.
     *
     * @param address the chunk address of the message
     * @return false if the address is invalid
     */
    public boolean openMessage(int address) {
        context.getCallStack().clear();
        boolean opened;
        try {
            opened = context.getCursor().open(address);
        } catch (MessageStoreException e) {
            LOG.error("Failed to open message {}: {}", address, e.getMessage());
            context.getCursor().markEnded();
            opened = false;
        }
        if (!opened) {
            LOG.warn("Message address {} is invalid, treating it as an empty message", address);
        }
        lastOpenFailed = !opened;
        context.setState(opened ? ExecutionState.RUNNING : ExecutionState.ENDED);
        return opened;
    }

    /**
     * Executes the open message until EndSym at depth 0, the step watchdog, a stop request
     * or a store failure. An exception thrown by a host callback propagates unchanged, but the
     * message is ended and its frames are discarded first.
     *
     * @return how execution ended
     */
    public ExecutionResult executeMessage() {
        MessageCursor cursor = context.getCursor();
        IOpcodeHost host = context.getHost();

        if (context.getState() == ExecutionState.ENDED) {
            return new ExecutionResult(lastOpenFailed ? ExecutionOutcome.EMPTY : ExecutionOutcome.COMPLETED,
                0, 0, context.getCallStack().depth());
        }

        LOG.debug("Executing message {} (declared length {})", cursor.getAddress(), cursor.getDeclaredLength());
        ExecutionOutcome outcome = ExecutionOutcome.COMPLETED;
        int steps = 0;
        int emitted = 0;
        boolean finished = false;

        try {
            while (context.getState() != ExecutionState.ENDED) {
                if (!stillRunning) {
                    LOG.debug("Execution of message {} cancelled at position {}", cursor.getAddress(), cursor.getPosition());
                    outcome = ExecutionOutcome.CANCELLED;
                    break;
                }
                if (steps >= options.maxSteps()) {
                    LOG.warn("Runaway message stopped after {} steps at message {} position {}",
                        steps, cursor.getAddress(), cursor.getPosition());
                    outcome = ExecutionOutcome.RUNAWAY;
                    break;
                }
                steps++;

                char ch = cursor.nextCharacter();
                Optional<ControlCode> control = ControlCode.fromChar(ch);
                if (control.isPresent()) {
                    dispatch(control.get());
                } else if (ch == SymbolCodec.NUL) {
                    LOG.trace("Skipping unassigned symbol at position {}", cursor.getPosition() - 1);
                } else if (suppressText) {
                    LOG.trace("Suppressed text '{}' at position {}", ch, cursor.getPosition() - 1);
                } else {
                    host.emit(ch);
                    emitted++;
                }
            }
            finished = true;
        } catch (MessageStoreException e) {
            LOG.error("Message {} aborted: {}", cursor.getAddress(), e.getMessage());
            outcome = ExecutionOutcome.STORE_ERROR;
            finished = true;
        } finally {
            context.setState(ExecutionState.ENDED);
            cursor.markEnded();
            if (!finished) {
                // A host callback threw. The run is over either way.
                context.getCallStack().clear();
            }
        }

        LOG.debug("Message execution ended: {} after {} steps, {} characters", outcome, steps, emitted);
        return new ExecutionResult(outcome, steps, emitted, context.getCallStack().depth());
    }

    /**
     * Opens and executes a message.
     *
     * @param address the chunk address of the message
     * @return how execution ended
     */
    public ExecutionResult displayMessage(int address) {
        openMessage(address);
        return executeMessage();
    }

    private void dispatch(ControlCode code) {
        MessageCursor cursor = context.getCursor();
        switch (code) {
            case END:
                if (context.getCallStack().isEmpty()) {
                    context.setState(ExecutionState.ENDED);
                } else {
                    callHandler.executeReturn();
                }
                break;
            case JUMP: {
                int offset = cursor.readOperand();
                cursor.jumpRelative(offset);
                break;
            }
            case JUMP_IF_FALSE: {
                int offset = cursor.readOperand();
                if (!context.isTestFlag()) {
                    cursor.jumpRelative(offset);
                }
                break;
            }
            case CASE:
                caseDispatcher.execute();
                break;
            case ACTION:
                executeOpcode(OpcodeCategory.ACTION, false);
                break;
            case ACTION_REF:
                executeOpcode(OpcodeCategory.ACTION, true);
                break;
            case TEST:
                executeOpcode(OpcodeCategory.TEST, false);
                break;
            case TEST_REF:
                executeOpcode(OpcodeCategory.TEST, true);
                break;
            case EDIT:
                executeOpcode(OpcodeCategory.EDIT, false);
                break;
            case EDIT_REF:
                executeOpcode(OpcodeCategory.EDIT, true);
                break;
            case CALL:
                callHandler.executeCall(cursor.readOperand());
                break;
            default:
                throw new IllegalStateException("Unhandled control code: " + code);
        }
    }

    private void executeOpcode(OpcodeCategory category, boolean withReference) {
        MessageCursor cursor = context.getCursor();
        int symbol = cursor.nextSymbol();
        int reference = withReference ? cursor.readOperand() : 0;
        Opcode opcode = new Opcode(category, category.codeOf(symbol), withReference, reference);

        if (!opcode.isKnown()) {
            LOG.warn("Unknown {} opcode {} (symbol {}) in message {} at position {} ignored",
                category, opcode.code(), symbol, cursor.getAddress(), cursor.getPosition());
            return;
        }

        LOG.trace("Opcode {}", opcode);
        IOpcodeHost host = context.getHost();
        switch (category) {
            case ACTION:
                host.invokeAction(opcode);
                break;
            case TEST:
                context.setTestFlag(host.invokeTest(opcode));
                break;
            case EDIT:
                host.invokeEdit(opcode);
                break;
            default:
                throw new IllegalStateException("Unhandled opcode category: " + category);
        }
    }

    /**
     * Requests that execution stop. The request is observed once per dispatch step and stays in
     * effect until {@link #clearStopRequest()}.
     */
    public void stop() {
        this.stillRunning = false;
    }

    /**
     * Withdraws a stop request.
     */
    public void clearStopRequest() {
        this.stillRunning = true;
    }

    public boolean isStillRunning() {
        return stillRunning;
    }

    public ExecutionState getState() {
        return context.getState();
    }

    public int getCallDepth() {
        return context.getCallStack().depth();
    }

    public boolean isTestFlag() {
        return context.isTestFlag();
    }

    public void setTestFlag(boolean testFlag) {
        context.setTestFlag(testFlag);
    }

    public boolean isSuppressText() {
        return suppressText;
    }

    /**
     * Controls whether ordinary characters reach the host. Control operations run either way.
     *
     * @param suppressText true to consume text without emitting it
     */
    public void setSuppressText(boolean suppressText) {
        this.suppressText = suppressText;
    }

    /**
     * @return the cursor of the message being executed
     */
    public MessageCursor getCursor() {
        return context.getCursor();
    }

    public VmOptions getOptions() {
        return options;
    }
}
