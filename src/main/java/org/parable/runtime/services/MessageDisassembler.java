package org.parable.runtime.services;

import org.parable.runtime.Config;
import org.parable.runtime.codec.ControlCode;
import org.parable.runtime.codec.SymbolCodec;
import org.parable.runtime.model.CaseKind;
import org.parable.runtime.model.MessageCursor;
import org.parable.runtime.model.Opcode;
import org.parable.runtime.model.OpcodeCategory;
import org.parable.runtime.services.DisassembledItem.ItemKind;
import org.parable.runtime.store.PagedMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes messages into a readable listing without executing them.
 * <p>
 * The listing is linear: case entry bodies are decoded in place, and decoding continues past
 * an EndSym as long as a jump or case block targets a later position. It stops at the first
 * EndSym beyond every known target, or after {@link Config#MAX_STEPS_PER_MESSAGE} symbols.
 */
public class MessageDisassembler {

    private static final Logger LOG = LoggerFactory.getLogger(MessageDisassembler.class);

    private final PagedMessageStore store;

    public MessageDisassembler(PagedMessageStore store) {
        this.store = store;
    }

    /**
     * Disassembles the message at the given address.
     *
     * @param address the chunk address of the message
     * @return the decoded items, empty if the address is invalid
     */
    public List<DisassembledItem> disassemble(int address) {
        List<DisassembledItem> items = new ArrayList<>();
        MessageCursor cursor = new MessageCursor(store);
        if (!cursor.open(address)) {
            return items;
        }
        Walk walk = new Walk(cursor, items);
        if (!walk.decodeRange(Config.MAX_STEPS_PER_MESSAGE, true)) {
            LOG.warn("Disassembly of message {} stopped after {} symbols without a final EndSym", address, cursor.getPosition());
        }
        return items;
    }

    /**
     * Reads raw symbols of a message, header included.
     *
     * @param address the chunk address of the message
     * @param start   the first symbol position
     * @param count   the number of symbols
     * @return the symbols with their decoded characters
     */
    public List<SymbolDump> dumpSymbols(int address, int start, int count) {
        if (address <= 0 || start < 0 || count < 0) {
            throw new IllegalArgumentException("Invalid dump range: address " + address + ", start " + start + ", count " + count);
        }
        List<SymbolDump> dump = new ArrayList<>(count);
        long base = (long) address * store.getGeometry().symbolsPerChunk();
        for (int i = start; i < start + count; i++) {
            int symbol = store.readSymbol(base + i);
            dump.add(new SymbolDump(i, symbol, SymbolCodec.decode(symbol)));
        }
        return dump;
    }

    private final class Walk {

        private final MessageCursor cursor;
        private final List<DisassembledItem> items;
        private final StringBuilder run = new StringBuilder();
        private int runStart = -1;
        private int furthestTarget;

        Walk(MessageCursor cursor, List<DisassembledItem> items) {
            this.cursor = cursor;
            this.items = items;
        }

        /**
         * Decodes symbols up to {@code end}. At top level, returns true once a final EndSym is
         * reached; nested ranges always run to their end.
         */
        boolean decodeRange(int end, boolean topLevel) {
            while (cursor.getPosition() < end) {
                int position = cursor.getPosition();
                char ch = cursor.nextCharacter();
                Optional<ControlCode> control = ControlCode.fromChar(ch);

                if (control.isEmpty()) {
                    if (ch != SymbolCodec.NUL) {
                        if (runStart < 0) {
                            runStart = position;
                        }
                        run.append(ch);
                    }
                    continue;
                }
                flushText();

                ControlCode code = control.get();
                switch (code) {
                    case END:
                        items.add(control(position, code, List.of()));
                        if (topLevel && cursor.getPosition() > furthestTarget) {
                            return true;
                        }
                        break;
                    case JUMP:
                    case JUMP_IF_FALSE: {
                        int offset = cursor.readOperand();
                        furthestTarget = Math.max(furthestTarget, cursor.getPosition() + offset);
                        items.add(control(position, code, List.of(offset)));
                        break;
                    }
                    case CALL:
                        items.add(control(position, code, List.of(cursor.readOperand())));
                        break;
                    case CASE:
                        decodeCase(position);
                        break;
                    default:
                        items.add(decodeOpcode(cursor, position, code));
                        break;
                }
            }
            flushText();
            return false;
        }

        private void decodeCase(int position) {
            int tag = cursor.nextSymbol();
            Optional<CaseKind> kind = CaseKind.fromTag(tag);
            List<Integer> operands = new ArrayList<>();
            operands.add(tag);
            if (kind.isPresent() && kind.get() == CaseKind.BY_REFERENCE) {
                operands.add(cursor.readOperand());
            }
            int count = cursor.nextSymbol();
            int totalSize = cursor.readOperand();
            operands.add(count);
            operands.add(totalSize);
            int blockEnd = cursor.getPosition() + totalSize;
            furthestTarget = Math.max(furthestTarget, blockEnd);
            items.add(new DisassembledItem(position, ItemKind.CONTROL, ControlCode.CASE.name(), operands,
                kind.map(Enum::name).orElse("UNKNOWN(" + tag + ")")));

            for (int i = 0; i < count && cursor.getPosition() < blockEnd; i++) {
                int entryPosition = cursor.getPosition();
                int value = cursor.nextSymbol();
                int skip = cursor.readOperand();
                items.add(new DisassembledItem(entryPosition, ItemKind.CASE_ENTRY, "ENTRY", List.of(value, skip), ""));
                int bodyEnd = Math.min(cursor.getPosition() + skip, blockEnd);
                decodeRange(bodyEnd, false);
                cursor.jumpAbsolute(bodyEnd);
            }
            cursor.jumpAbsolute(blockEnd);
        }

        private void flushText() {
            if (runStart >= 0) {
                items.add(new DisassembledItem(runStart, ItemKind.TEXT, "TEXT", List.of(), run.toString()));
                run.setLength(0);
                runStart = -1;
            }
        }
    }

    private DisassembledItem decodeOpcode(MessageCursor cursor, int position, ControlCode code) {
        OpcodeCategory category;
        boolean withReference;
        switch (code) {
            case ACTION: category = OpcodeCategory.ACTION; withReference = false; break;
            case ACTION_REF: category = OpcodeCategory.ACTION; withReference = true; break;
            case TEST: category = OpcodeCategory.TEST; withReference = false; break;
            case TEST_REF: category = OpcodeCategory.TEST; withReference = true; break;
            case EDIT: category = OpcodeCategory.EDIT; withReference = false; break;
            case EDIT_REF: category = OpcodeCategory.EDIT; withReference = true; break;
            default: throw new IllegalStateException("Not an opcode control code: " + code);
        }
        int symbol = cursor.nextSymbol();
        int reference = withReference ? cursor.readOperand() : 0;
        Opcode opcode = new Opcode(category, category.codeOf(symbol), withReference, reference);
        List<Integer> operands = withReference ? List.of(opcode.code(), reference) : List.of(opcode.code());
        String name = opcode.operation().map(Enum::name).orElse("UNKNOWN(" + opcode.code() + ")");
        return new DisassembledItem(position, ItemKind.OPCODE, code.name(), operands, name);
    }

    private static DisassembledItem control(int position, ControlCode code, List<Integer> operands) {
        return new DisassembledItem(position, ItemKind.CONTROL, code.name(), operands, "");
    }
}
