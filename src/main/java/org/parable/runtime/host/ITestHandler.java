package org.parable.runtime.host;

import org.parable.runtime.model.Opcode;

/**
 * Predicate of a test operation.
 */
@FunctionalInterface
public interface ITestHandler {
    boolean evaluate(Opcode opcode);
}
