package org.parable.runtime.host;

import org.parable.runtime.model.Opcode;

/**
 * Effect of an action operation.
 */
@FunctionalInterface
public interface IActionHandler {
    void perform(Opcode opcode);
}
