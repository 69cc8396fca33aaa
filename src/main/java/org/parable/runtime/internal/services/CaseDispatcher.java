package org.parable.runtime.internal.services;

import org.parable.runtime.model.CaseKind;
import org.parable.runtime.model.FrameKind;
import org.parable.runtime.model.MessageCursor;
import org.parable.runtime.spi.IOpcodeHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Executes a case block. The block layout, after the case control character, is:
 * <pre>
 *   kind            1 symbol
 *   reference       2 symbols, only for {@link CaseKind#BY_REFERENCE}
 *   entry count     1 symbol
 *   total size      2 symbols, measured from the end of this field to the end of the block
 *   entries         count x [ value: 1 symbol, skip: 2 symbols, body: skip symbols ]
 * </pre>
 * Entry bodies are stored inline between the entry headers. A matching entry leaves the
 * cursor at the start of its body; a non-matching entry is skipped by its skip operand.
 * Value 0 matches any match value, except in random blocks, which match by entry index.
 */
public class CaseDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CaseDispatcher.class);

    private final ExecutionContext context;

    /**
     * Constructs a new CaseDispatcher.
     * @param context The execution context of the machine.
     */
    public CaseDispatcher(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Reads the case block at the cursor and positions the cursor at the body of the matching
     * entry, or after the block when no entry matches. A matched body gets a case frame so that
     * an EndSym inside the body resumes after the block.
     *
     * @return the index of the matched entry, or -1 if none matched
     */
    public int execute() {
        MessageCursor cursor = context.getCursor();
        IOpcodeHost host = context.getHost();

        int tag = cursor.nextSymbol();
        Optional<CaseKind> kindOpt = CaseKind.fromTag(tag);
        CaseKind kind = kindOpt.orElse(null);
        int reference = kind == CaseKind.BY_REFERENCE ? cursor.readOperand() : 0;
        int entryCount = cursor.nextSymbol();
        int totalSize = cursor.readOperand();
        int blockEnd = cursor.getPosition() + totalSize;

        int matchValue = 0;
        if (kind == null) {
            LOG.warn("Unknown case kind {} in message {} at position {}", tag, cursor.getAddress(), cursor.getPosition());
        } else {
            switch (kind) {
                case RANDOM:
                    matchValue = entryCount > 0 ? host.randomInt(entryCount) : 0;
                    break;
                case BY_WORD:
                case BY_SYNONYM:
                    matchValue = host.currentVerbCode();
                    break;
                case BY_REFERENCE:
                    matchValue = host.resolveCaseReference(reference);
                    break;
                default:
                    break;
            }
        }
        LOG.debug("Case kind={} entries={} match={} size={} end={}", kind, entryCount, matchValue, totalSize, blockEnd);

        for (int i = 0; i < entryCount; i++) {
            int value = cursor.nextSymbol();
            int skip = cursor.readOperand();
            boolean matches = kind == CaseKind.RANDOM
                ? i == matchValue
                : value == 0 || value == matchValue;
            if (matches) {
                LOG.debug("Case entry {} (value {}) matched, body at position {}", i, value, cursor.getPosition());
                if (!context.getCallStack().push(cursor.snapshotAt(FrameKind.CASE, blockEnd))) {
                    LOG.warn("Call stack full at case body in message {}; EndSym in the body will not resume after the block",
                        cursor.getAddress());
                }
                return i;
            }
            cursor.jumpRelative(skip);
        }

        cursor.jumpAbsolute(blockEnd);
        return -1;
    }
}
