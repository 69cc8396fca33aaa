package org.parable.compiler;

import org.parable.runtime.Config;
import org.parable.runtime.codec.ControlCode;
import org.parable.runtime.codec.SymbolCodec;
import org.parable.runtime.model.CaseKind;
import org.parable.runtime.model.OpcodeCategory;
import org.parable.runtime.model.Operation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the symbol stream of a message procedure.
 * <p>
 * Jumps refer to labels and are resolved when the stream is produced; since jump operands
 * are forward offsets, a label must not precede the jump that targets it. Case blocks are laid
 * out with their entry bodies inline, with skip operands and the block size computed from the
 * bodies.
 * <pre>
 *   int[] symbols = new MessageAssembler()
 *       .test(Operation.DARK)
 *       .jumpIfFalse("lit")
 *       .text("it is dark.")
 *       .jump("done")
 *       .label("lit")
 *       .text("you see a lamp.")
 *       .label("done")
 *       .end()
 *       .toSymbols();
 * </pre>
 */
public final class MessageAssembler {

    private static final int MAX_OPERAND = (1 << (2 * Config.SYMBOL_BITS)) - 1;

    private final boolean withHeader;
    private final List<Integer> symbols = new ArrayList<>();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<Fixup> fixups = new ArrayList<>();
    private Integer declaredLength;

    private record Fixup(int operandPosition, String label) {}

    /**
     * Creates an assembler for a complete message, starting with the two-symbol header.
     */
    public MessageAssembler() {
        this(true);
    }

    private MessageAssembler(boolean withHeader) {
        this.withHeader = withHeader;
        if (withHeader) {
            symbols.add(0);
            symbols.add(0);
        }
    }

    /**
     * Creates an assembler for a headerless fragment, such as a case entry body.
     *
     * @return a new fragment assembler
     */
    public static MessageAssembler fragment() {
        return new MessageAssembler(false);
    }

    /**
     * Appends text. Letters are folded to lower case; control markers and characters without
     * a symbol are rejected.
     *
     * @param text the text
     * @return this assembler
     */
    public MessageAssembler text(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            int symbol = SymbolCodec.encode(ch);
            if (!SymbolCodec.isPrintable(symbol)) {
                throw new AssemblyException("Character '" + ch + "' at index " + i + " cannot be used as text");
            }
            symbols.add(symbol);
        }
        return this;
    }

    /**
     * Appends a raw symbol.
     *
     * @param symbol the symbol value in [0, 63]
     * @return this assembler
     */
    public MessageAssembler symbol(int symbol) {
        if (symbol < 0 || symbol > Config.SYMBOL_MASK) {
            throw new AssemblyException("Symbol out of range: " + symbol);
        }
        symbols.add(symbol);
        return this;
    }

    /**
     * Appends a 12-bit operand as two symbols, most significant first.
     *
     * @param value the value in [0, 4095]
     * @return this assembler
     */
    public MessageAssembler operand(int value) {
        if (value < 0 || value > MAX_OPERAND) {
            throw new AssemblyException("Operand out of range: " + value);
        }
        symbols.add(value >> Config.SYMBOL_BITS);
        symbols.add(value & Config.SYMBOL_MASK);
        return this;
    }

    /**
     * Appends EndSym.
     *
     * @return this assembler
     */
    public MessageAssembler end() {
        return control(ControlCode.END);
    }

    /**
     * Defines a label at the current position.
     *
     * @param name the label name
     * @return this assembler
     */
    public MessageAssembler label(String name) {
        if (labels.putIfAbsent(name, symbols.size()) != null) {
            throw new AssemblyException("Duplicate label: " + name);
        }
        return this;
    }

    public MessageAssembler jump(String label) {
        return jumpTo(ControlCode.JUMP, label);
    }

    public MessageAssembler jumpIfFalse(String label) {
        return jumpTo(ControlCode.JUMP_IF_FALSE, label);
    }

    public MessageAssembler action(Operation operation) {
        return opcode(ControlCode.ACTION, OpcodeCategory.ACTION, operation.code());
    }

    public MessageAssembler action(Operation operation, int reference) {
        return opcode(ControlCode.ACTION_REF, OpcodeCategory.ACTION, operation.code()).operand(reference);
    }

    public MessageAssembler test(Operation operation) {
        return opcode(ControlCode.TEST, OpcodeCategory.TEST, operation.code());
    }

    public MessageAssembler test(Operation operation, int reference) {
        return opcode(ControlCode.TEST_REF, OpcodeCategory.TEST, operation.code()).operand(reference);
    }

    public MessageAssembler edit(Operation operation) {
        return opcode(ControlCode.EDIT, OpcodeCategory.EDIT, operation.code());
    }

    public MessageAssembler edit(Operation operation, int reference) {
        return opcode(ControlCode.EDIT_REF, OpcodeCategory.EDIT, operation.code()).operand(reference);
    }

    /**
     * Appends an opcode by raw symbol, without checking that it names a known operation.
     *
     * @param code   the opcode control code
     * @param symbol the opcode symbol
     * @return this assembler
     */
    public MessageAssembler rawOpcode(ControlCode code, int symbol) {
        return control(code).symbol(symbol);
    }

    /**
     * Appends a call to the message at the given address.
     *
     * @param address the called message's address
     * @return this assembler
     */
    public MessageAssembler call(int address) {
        return control(ControlCode.CALL).operand(address);
    }

    /**
     * Appends a case block whose match value needs no reference.
     *
     * @param kind    the case kind
     * @param entries the entries in dispatch order
     * @return this assembler
     */
    public MessageAssembler caseBlock(CaseKind kind, CaseEntry... entries) {
        if (kind == CaseKind.BY_REFERENCE) {
            throw new AssemblyException("A by-reference case block needs a reference");
        }
        return caseBlock(kind, 0, entries);
    }

    /**
     * Appends a case block. A body normally ends with EndSym, which resumes execution after the
     * block; a body without one runs on into the next entry header.
     *
     * @param kind      the case kind
     * @param reference the reference for {@link CaseKind#BY_REFERENCE}, ignored otherwise
     * @param entries   the entries in dispatch order
     * @return this assembler
     */
    public MessageAssembler caseBlock(CaseKind kind, int reference, CaseEntry... entries) {
        if (entries.length > Config.SYMBOL_MASK) {
            throw new AssemblyException("A case block holds at most " + Config.SYMBOL_MASK + " entries");
        }
        List<int[]> bodies = new ArrayList<>();
        int totalSize = 0;
        for (CaseEntry entry : entries) {
            int[] body = entry.body().toSymbols();
            bodies.add(body);
            totalSize += 3 + body.length;
        }

        control(ControlCode.CASE).symbol(kind.tag());
        if (kind == CaseKind.BY_REFERENCE) {
            operand(reference);
        }
        symbol(entries.length).operand(totalSize);
        for (int i = 0; i < entries.length; i++) {
            int[] body = bodies.get(i);
            symbol(entries[i].value()).operand(body.length);
            for (int s : body) {
                symbols.add(s);
            }
        }
        return this;
    }

    /**
     * Overrides the informational length written into the header. By default the header holds
     * the number of content symbols.
     *
     * @param length the declared length
     * @return this assembler
     */
    public MessageAssembler declaredLength(int length) {
        if (!withHeader) {
            throw new AssemblyException("A fragment has no header");
        }
        this.declaredLength = length;
        return this;
    }

    /**
     * @return the current length of the stream in symbols, header included
     */
    public int size() {
        return symbols.size();
    }

    /**
     * Resolves all labels and returns the stream.
     *
     * @return the symbols of the message
     */
    public int[] toSymbols() {
        int[] out = new int[symbols.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = symbols.get(i);
        }
        for (Fixup fixup : fixups) {
            Integer target = labels.get(fixup.label());
            if (target == null) {
                throw new AssemblyException("Undefined label: " + fixup.label());
            }
            int offset = target - (fixup.operandPosition() + 2);
            if (offset < 0) {
                throw new AssemblyException("Label '" + fixup.label() + "' lies before its jump; jumps only go forward");
            }
            writeOperand(out, fixup.operandPosition(), offset);
        }
        if (withHeader) {
            int length = declaredLength != null ? declaredLength : Math.min(out.length - 2, MAX_OPERAND);
            writeOperand(out, 0, length);
        }
        return out;
    }

    private MessageAssembler jumpTo(ControlCode code, String label) {
        control(code);
        fixups.add(new Fixup(symbols.size(), label));
        symbols.add(0);
        symbols.add(0);
        return this;
    }

    private MessageAssembler opcode(ControlCode code, OpcodeCategory category, int operationCode) {
        int symbol = operationCode - category.codeBase();
        if (symbol < 0 || symbol > Config.SYMBOL_MASK) {
            throw new AssemblyException("Operation " + operationCode + " is outside the " + category + " code space");
        }
        return control(code).symbol(symbol);
    }

    private MessageAssembler control(ControlCode code) {
        symbols.add(code.symbol());
        return this;
    }

    private static void writeOperand(int[] out, int position, int value) {
        if (value < 0 || value > MAX_OPERAND) {
            throw new AssemblyException("Operand out of range: " + value);
        }
        out[position] = value >> Config.SYMBOL_BITS;
        out[position + 1] = value & Config.SYMBOL_MASK;
    }
}
