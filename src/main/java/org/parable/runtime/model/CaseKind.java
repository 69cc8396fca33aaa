package org.parable.runtime.model;

import java.util.Optional;

/**
 * How a case block computes the value its entries are matched against.
 */
public enum CaseKind {
    /** A random index in [0, entry count). Entries match by position, not by value. */
    RANDOM,
    /** The verb code of the current player command. */
    BY_WORD,
    /** The verb code of the current player command, matched against synonym entries. */
    BY_SYNONYM,
    /** A value resolved by the host from a 12-bit reference stored in the block. */
    BY_REFERENCE;

    /**
     * @param tag the case-kind symbol read from the stream
     * @return the kind, or empty for an unknown tag
     */
    public static Optional<CaseKind> fromTag(int tag) {
        CaseKind[] kinds = values();
        if (tag < 0 || tag >= kinds.length) {
            return Optional.empty();
        }
        return Optional.of(kinds[tag]);
    }

    /**
     * @return the symbol that encodes this kind
     */
    public int tag() {
        return ordinal();
    }
}
