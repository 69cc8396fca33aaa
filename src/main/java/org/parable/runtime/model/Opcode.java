package org.parable.runtime.model;

import org.parable.runtime.Config;

import java.util.Optional;

/**
 * A decoded opcode invocation.
 *
 * @param category     the opcode family
 * @param code         the operation code, already offset into the family's code space
 * @param hasReference whether a reference operand was present in the stream
 * @param reference    the 12-bit reference operand, 0 when absent
 */
public record Opcode(OpcodeCategory category, int code, boolean hasReference, int reference) {

    /**
     * @return true if the code names an operation known to the engine
     */
    public boolean isKnown() {
        return code >= 0 && code < Config.OPERATION_COUNT;
    }

    /**
     * @return the named operation, if the code is known
     */
    public Optional<Operation> operation() {
        return Operation.fromCode(code);
    }

    @Override
    public String toString() {
        String name = operation().map(Enum::name).orElse("UNKNOWN(" + code + ")");
        return hasReference ? category + ":" + name + "[" + reference + "]" : category + ":" + name;
    }
}
