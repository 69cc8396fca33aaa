package org.parable.runtime.services;

import java.util.List;

/**
 * One decoded element of a message.
 *
 * @param position the symbol position of the element within its message
 * @param kind     what the element is
 * @param mnemonic the control code name, or {@code TEXT}
 * @param operands the operand values read after the control symbol
 * @param text     the text run, or the operation name for opcodes; empty otherwise
 */
public record DisassembledItem(int position, ItemKind kind, String mnemonic, List<Integer> operands, String text) {

    public enum ItemKind {
        TEXT,
        CONTROL,
        OPCODE,
        CASE_ENTRY
    }

    public DisassembledItem {
        operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%4d  ", position));
        if (kind == ItemKind.TEXT) {
            return sb.append('"').append(text).append('"').toString();
        }
        if (kind == ItemKind.CASE_ENTRY) {
            sb.append("  ");
        }
        sb.append(mnemonic);
        if (!text.isEmpty()) {
            sb.append(' ').append(text);
        }
        for (Integer operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }
}
