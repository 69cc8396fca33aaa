package org.parable.runtime.host;

import org.parable.runtime.model.Opcode;
import org.parable.runtime.model.Operation;
import org.parable.runtime.spi.IOpcodeHost;
import org.parable.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntUnaryOperator;
import java.util.function.IntSupplier;

/**
 * An {@link IOpcodeHost} assembled from per-operation handlers. Operations without a handler
 * are logged and ignored; an unhandled test evaluates to false.
 * <p>
 * Text goes to an {@link Appendable}; case dispatch draws on an {@link IRandomProvider},
 * a verb-code supplier and a reference resolver.
 */
public class RegistryOpcodeHost implements IOpcodeHost {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryOpcodeHost.class);

    private final Appendable output;
    private final IRandomProvider random;
    private final Map<Operation, IActionHandler> actions = new EnumMap<>(Operation.class);
    private final Map<Operation, ITestHandler> tests = new EnumMap<>(Operation.class);
    private final Map<Operation, IEditHandler> edits = new EnumMap<>(Operation.class);
    private IntSupplier verbCode = () -> 0;
    private IntUnaryOperator referenceResolver = reference -> 0;

    /**
     * Creates a host.
     *
     * @param output destination of emitted text
     * @param random random source for random case blocks
     */
    public RegistryOpcodeHost(Appendable output, IRandomProvider random) {
        this.output = output;
        this.random = random;
    }

    /**
     * Registers the effect of an action operation.
     *
     * @param operation the operation
     * @param handler   its effect
     * @return this host
     */
    public RegistryOpcodeHost onAction(Operation operation, IActionHandler handler) {
        actions.put(operation, handler);
        return this;
    }

    /**
     * Registers the predicate of a test operation.
     *
     * @param operation the operation
     * @param handler   its predicate
     * @return this host
     */
    public RegistryOpcodeHost onTest(Operation operation, ITestHandler handler) {
        tests.put(operation, handler);
        return this;
    }

    /**
     * Registers the effect of an edit operation.
     *
     * @param operation the operation
     * @param handler   its effect
     * @return this host
     */
    public RegistryOpcodeHost onEdit(Operation operation, IEditHandler handler) {
        edits.put(operation, handler);
        return this;
    }

    /**
     * @param verbCode supplies the verb code of the current player command
     * @return this host
     */
    public RegistryOpcodeHost withVerbCode(IntSupplier verbCode) {
        this.verbCode = verbCode;
        return this;
    }

    /**
     * @param referenceResolver resolves by-reference case values
     * @return this host
     */
    public RegistryOpcodeHost withReferenceResolver(IntUnaryOperator referenceResolver) {
        this.referenceResolver = referenceResolver;
        return this;
    }

    @Override
    public void emit(char ch) {
        try {
            output.append(ch);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write message output", e);
        }
    }

    @Override
    public void invokeAction(Opcode opcode) {
        IActionHandler handler = opcode.operation().map(actions::get).orElse(null);
        if (handler == null) {
            LOG.debug("No action handler for {}", opcode);
            return;
        }
        handler.perform(opcode);
    }

    @Override
    public boolean invokeTest(Opcode opcode) {
        ITestHandler handler = opcode.operation().map(tests::get).orElse(null);
        if (handler == null) {
            LOG.debug("No test handler for {}, evaluating to false", opcode);
            return false;
        }
        return handler.evaluate(opcode);
    }

    @Override
    public void invokeEdit(Opcode opcode) {
        IEditHandler handler = opcode.operation().map(edits::get).orElse(null);
        if (handler == null) {
            LOG.debug("No edit handler for {}", opcode);
            return;
        }
        handler.apply(opcode);
    }

    @Override
    public int resolveCaseReference(int reference) {
        return referenceResolver.applyAsInt(reference);
    }

    @Override
    public int currentVerbCode() {
        return verbCode.getAsInt();
    }

    @Override
    public int randomInt(int bound) {
        return random.nextInt(bound);
    }
}
