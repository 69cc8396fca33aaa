package org.parable.runtime.spi;

import org.parable.runtime.model.Opcode;

/**
 * The collaborator that gives opcodes their effect. The virtual machine only decodes and
 * dispatches; everything that touches the game world or the screen happens here.
 * <p>
 * Implementations must not block: the machine calls them synchronously from its dispatch loop.
 */
public interface IOpcodeHost {

    /**
     * Appends a decoded character to the output.
     *
     * @param ch the character
     */
    void emit(char ch);

    /**
     * Performs an action opcode.
     *
     * @param opcode the decoded opcode, in the action code space
     */
    void invokeAction(Opcode opcode);

    /**
     * Evaluates a test opcode.
     *
     * @param opcode the decoded opcode, in the test code space
     * @return the new value of the test flag
     */
    boolean invokeTest(Opcode opcode);

    /**
     * Performs an edit opcode.
     *
     * @param opcode the decoded opcode, in the edit code space
     */
    void invokeEdit(Opcode opcode);

    /**
     * Resolves the comparison value of a by-reference case block.
     *
     * @param reference the 12-bit reference stored in the block
     * @return the value the case entries are matched against
     */
    int resolveCaseReference(int reference);

    /**
     * @return the verb code of the current player command
     */
    int currentVerbCode();

    /**
     * @param bound exclusive upper bound, greater than 0
     * @return a random integer in [0, bound)
     */
    int randomInt(int bound);
}
