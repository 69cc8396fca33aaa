package org.parable.runtime.model;

/**
 * The three opcode families of a message procedure. Each family has its own code space:
 * the symbol following the control character is added to the family's base to form the
 * operation code.
 */
public enum OpcodeCategory {
    /** World-state and output side effects. */
    ACTION(50),
    /** Predicates; the result is stored in the test flag. */
    TEST(87),
    /** State mutation and reference/display operations. */
    EDIT(135);

    private final int codeBase;

    OpcodeCategory(int codeBase) {
        this.codeBase = codeBase;
    }

    public int codeBase() {
        return codeBase;
    }

    /**
     * @param symbol the opcode symbol read from the stream
     * @return the operation code in this family's code space
     */
    public int codeOf(int symbol) {
        return codeBase + symbol;
    }
}
