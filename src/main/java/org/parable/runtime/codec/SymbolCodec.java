package org.parable.runtime.codec;

import org.parable.runtime.Config;

/**
 * Bidirectional mapping between 6-bit symbols and characters.
 * <p>
 * Letters are not stored in alphabetical order: letter {@code 'a'+j} lives at symbol
 * {@code (j * 7) mod 26}. Both directions are total. Unassigned symbols decode to
 * {@link #NUL}, and characters without a symbol encode to {@link #END_SYMBOL}.
 * Encoding folds uppercase letters onto the lowercase symbols.
 */
public final class SymbolCodec {

    /**
     * The number of distinct symbols.
     */
    public static final int SYMBOL_COUNT = 1 << Config.SYMBOL_BITS;

    /**
     * The symbol value of EndSym.
     */
    public static final int END_SYMBOL = 33;

    /**
     * The marker returned for symbols without an assigned character.
     */
    public static final char NUL = '\0';

    private static final int LETTER_STRIDE = 7;
    private static final int FIRST_DIGIT_SYMBOL = 52;

    private static final char[] SYMBOL_TO_CHAR = new char[SYMBOL_COUNT];
    private static final int[] CHAR_TO_SYMBOL = new int[128];

    static {
        for (int j = 0; j < 26; j++) {
            SYMBOL_TO_CHAR[(j * LETTER_STRIDE) % 26] = (char) ('a' + j);
        }

        final char[] fixed = {
            ' ', '^', '|', '*', '(', '$', '%', '@', '#', '.', ',', '-',
            '?', '"', ';', '\'', '!', ':', '&', '=', '+', '\\'
        };
        System.arraycopy(fixed, 0, SYMBOL_TO_CHAR, 26, fixed.length);

        // 48..51 stay NUL
        for (int d = 0; d < 10; d++) {
            SYMBOL_TO_CHAR[FIRST_DIGIT_SYMBOL + d] = (char) ('0' + d);
        }
        // 62..63 stay NUL

        java.util.Arrays.fill(CHAR_TO_SYMBOL, END_SYMBOL);
        for (int nip = 0; nip < SYMBOL_COUNT; nip++) {
            char ch = SYMBOL_TO_CHAR[nip];
            if (ch != NUL) {
                CHAR_TO_SYMBOL[ch] = nip;
            }
        }
        for (int j = 0; j < 26; j++) {
            CHAR_TO_SYMBOL['A' + j] = CHAR_TO_SYMBOL['a' + j];
        }
    }

    private SymbolCodec() {}

    /**
     * Decodes a symbol. Only the low six bits of the argument are used.
     *
     * @param nip the symbol value
     * @return the character, or {@link #NUL} for unassigned symbols
     */
    public static char decode(int nip) {
        return SYMBOL_TO_CHAR[nip & Config.SYMBOL_MASK];
    }

    /**
     * Encodes a character.
     *
     * @param ch the character
     * @return its symbol, or {@link #END_SYMBOL} if it has none
     */
    public static int encode(char ch) {
        if (ch >= CHAR_TO_SYMBOL.length) {
            return END_SYMBOL;
        }
        return CHAR_TO_SYMBOL[ch];
    }

    /**
     * Encodes every character of a string.
     *
     * @param text the text to encode
     * @return one symbol per character
     */
    public static int[] encode(CharSequence text) {
        int[] symbols = new int[text.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = encode(text.charAt(i));
        }
        return symbols;
    }

    /**
     * @param nip the symbol value
     * @return true if the symbol has an assigned character (control markers included)
     */
    public static boolean isAssigned(int nip) {
        return decode(nip) != NUL;
    }

    /**
     * @param nip the symbol value
     * @return true if the symbol decodes to text rather than a control code or NUL
     */
    public static boolean isPrintable(int nip) {
        char ch = decode(nip);
        return ch != NUL && ControlCode.fromChar(ch).isEmpty();
    }
}
