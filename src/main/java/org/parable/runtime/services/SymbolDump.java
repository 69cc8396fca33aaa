package org.parable.runtime.services;

/**
 * A raw symbol and its decoded character.
 *
 * @param position  the symbol position within the message
 * @param symbol    the 6-bit symbol value
 * @param character the decoded character, NUL for unassigned symbols
 */
public record SymbolDump(int position, int symbol, char character) {

    @Override
    public String toString() {
        String shown = character == '\0' ? "NUL" : "'" + character + "'";
        return String.format("%4d  %2d  %s", position, symbol, shown);
    }
}
