package org.parable.runtime.model;

import java.util.Optional;

/**
 * The operation codes of the engine. Ordinals are the codes stored in message files and must
 * not be reordered. Which family reaches an operation depends on the family's code base, see
 * {@link OpcodeCategory}.
 */
public enum Operation {
    // Data and definition (0-25)
    SIZE, VALUE, PROPS, MAP, CAST, END, PLIST, STATE, DESCR, ALOCK, MHAVE,
    MOOD, CHG, FBD, PROB, CCARRY, DIR, ROUTE, VOCAB, TRANS, RESTR, PDROP,
    CMD, EOF, UNLKD, CURB,

    // Character responses (26-49)
    CURSE, TAKE, DROP, WEAR, SHED, TOSS, TRASH,
    WELCOME, MOVE, ENTRY, OPN_IT, CLS_IT, LK_IT,
    UNLK_IT, MRDR, PUT_IT, POUR_IT, BLUFF, TOUR,
    RRIDE, TRADE, GREET, GIFT, SECRET,

    // Player verbs (50-72), the action code space
    TK_OFF, DRP, PK_UP, PT_ON, THROW, POUR, RLOC,
    LOCK, UNLOCK, NX_STOP, OFFER, SAVE, QUIT, RESTART, RIDE,
    GIVE, GRAB, SWAP, OPEN, CLOSE, PUT, KILL, GRANT,

    // Editing (73-86)
    TICK, EVENT, SET, SSP, RSM, SW, ADV,
    RECEDE, CHZ, ATTR, ASG, MOV, PRINT, RST,

    // Comparison and arithmetic (87-98), the test code space
    LESS, EQ, LEQ, INCR, DECR, ADD, SUB,
    DARK, LIT, FOG, OWNS, CAN,

    // Boolean tests (99-114)
    ON, IN, FULL, LOCKED, OPENED, CVRD, CLOSED,
    SUP, BOX, VSL, LAMP, CORPSE, DOOR, LQD,
    HIDDEN, STUFF,

    // Queries (115-134)
    DEND, HERE, WEARS, HAS, KEY, HPASS, VKEY, CANT,
    RAND, ASK, ANY, WORD, SYN, NEW, HOLDS, IS, FAIR,
    CARRY, TAIL, ON_TOUR,

    // References and display (135-165), the edit code space
    PASS, XREG,
    VERB, IT, TARG, VCL, PERSON, OBJ, SUN,
    CTNTS, CTNR, LOC, PLACE, THING, OTHER, CAB,
    PRV, VLOC, PPRV,
    TIME, DAY, DSC, A, INV, FLEET, ROLE,
    CAP, CNTR, FORCE, SPK, NO;

    private static final Operation[] BY_CODE = values();

    /**
     * @return the numeric code of this operation
     */
    public int code() {
        return ordinal();
    }

    /**
     * @param code a numeric operation code
     * @return the operation, or empty if the code is unknown
     */
    public static Optional<Operation> fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }
}
