package org.parable.runtime.host;

import org.parable.runtime.model.Opcode;

/**
 * Effect of an edit operation.
 */
@FunctionalInterface
public interface IEditHandler {
    void apply(Opcode opcode);
}
