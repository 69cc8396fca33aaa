package org.parable.runtime;

/**
 * Provides the built-in defaults for the message store and the virtual machine.
 * These values match the layout of the shipped message files. Every one of them
 * can be overridden through HOCON configuration, see
 * {@link org.parable.runtime.config.VmOptions}. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    // Message file layout

    /**
     * The size of one page of the message file in bytes.
     */
    public static final int PAGE_SIZE = 512;

    /**
     * The number of bytes at the start of every page that carry no chunk data.
     */
    public static final int PAGE_HEADER_SIZE = 2;

    /**
     * The sentinel value written into the page header bytes.
     */
    public static final int PAGE_HEADER_SENTINEL = 0xE5;

    /**
     * The number of bytes in one chunk (one record of the message file).
     */
    public static final int CHUNK_WIDTH = 6;

    /**
     * The number of 6-bit symbols packed into one chunk.
     */
    public static final int SYMBOLS_PER_CHUNK = 8;

    /**
     * The number of bits per symbol.
     */
    public static final int SYMBOL_BITS = 6;

    /**
     * Mask selecting the bits of a single symbol.
     */
    public static final int SYMBOL_MASK = (1 << SYMBOL_BITS) - 1;

    /**
     * The maximum number of pages held in the page cache at the same time.
     */
    public static final int PAGE_CACHE_CAPACITY = 200;

    // Virtual machine

    /**
     * The maximum depth of the call stack. Case frames count against the same limit.
     */
    public static final int CALL_STACK_MAX_DEPTH = 32;

    /**
     * The maximum number of dispatch steps for one execution of a message.
     */
    public static final int MAX_STEPS_PER_MESSAGE = 5000;

    /**
     * The number of symbols in a message header (the informational length).
     */
    public static final int MESSAGE_HEADER_SYMBOLS = 2;

    /**
     * The number of operation codes known to the engine. Codes at or above this value are unknown.
     */
    public static final int OPERATION_COUNT = 166;

    /**
     * The default seed for the random source used by case dispatch.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;
}
