package org.parable.runtime.codec;

import java.util.Optional;

/**
 * The control characters of a message procedure. Each one is the decoded form of a
 * dedicated symbol and introduces a control operation instead of printable text.
 */
public enum ControlCode {
    /** Unconditional forward jump, followed by a 12-bit offset. */
    JUMP('^'),
    /** Forward jump taken only when the test flag is false, followed by a 12-bit offset. */
    JUMP_IF_FALSE('|'),
    /** Case dispatch block. */
    CASE('*'),
    /** Action opcode without reference. */
    ACTION('('),
    /** Action opcode followed by a 12-bit reference. */
    ACTION_REF('+'),
    /** Test opcode without reference; the result becomes the test flag. */
    TEST('$'),
    /** Test opcode followed by a 12-bit reference. */
    TEST_REF('&'),
    /** Edit opcode without reference. */
    EDIT('%'),
    /** Edit opcode followed by a 12-bit reference. */
    EDIT_REF('='),
    /** Subroutine call, followed by a 12-bit message address. */
    CALL('\\'),
    /** End of message, or return from a call or case body. */
    END('@');

    private static final ControlCode[] BY_CHAR = new ControlCode[128];

    static {
        for (ControlCode code : values()) {
            BY_CHAR[code.marker] = code;
        }
    }

    private final char marker;

    ControlCode(char marker) {
        this.marker = marker;
    }

    /**
     * @return the character this control code decodes to.
     */
    public char marker() {
        return marker;
    }

    /**
     * @return the symbol value that encodes this control code.
     */
    public int symbol() {
        return SymbolCodec.encode(marker);
    }

    /**
     * Looks up the control code for a decoded character.
     *
     * @param ch the decoded character
     * @return the control code, or empty for printable text
     */
    public static Optional<ControlCode> fromChar(char ch) {
        if (ch >= BY_CHAR.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CHAR[ch]);
    }
}
