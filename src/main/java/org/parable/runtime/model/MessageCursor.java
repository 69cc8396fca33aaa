package org.parable.runtime.model;

import org.parable.runtime.Config;
import org.parable.runtime.codec.ControlCode;
import org.parable.runtime.codec.SymbolCodec;
import org.parable.runtime.store.Chunk;
import org.parable.runtime.store.PagedMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A read position inside a message. The message starts at a chunk address; the position
 * counts symbols from that chunk, the two header symbols included. The cursor resolves its
 * position to a chunk of the {@link PagedMessageStore} whenever it moves into another chunk,
 * so reads cross chunk and page boundaries transparently.
 */
public class MessageCursor {

    private static final Logger LOG = LoggerFactory.getLogger(MessageCursor.class);

    private final PagedMessageStore store;
    private final int symbolsPerChunk;

    private int address;
    private int position;
    private int declaredLength;
    private boolean endOfMessage = true;

    private int loadedRecord = -1;
    private Chunk loadedChunk;

    public MessageCursor(PagedMessageStore store) {
        this.store = store;
        this.symbolsPerChunk = store.getGeometry().symbolsPerChunk();
    }

    /**
     * Opens the message at the given address and skips its two-symbol length header.
     * An address that is not positive or lies outside the message file yields an empty,
     * already ended message.
     *
     * @param address the chunk address of the message
     * @return false if the address is invalid
     */
    public boolean open(int address) {
        this.address = address;
        this.position = 0;
        this.declaredLength = 0;
        this.loadedRecord = -1;
        this.loadedChunk = null;
        if (address <= 0 || !store.containsRecord(address)) {
            LOG.debug("Cannot open message at invalid address {}", address);
            this.endOfMessage = true;
            return false;
        }
        this.endOfMessage = false;
        this.declaredLength = readOperand();
        return true;
    }

    /**
     * Returns the symbol at the current position and advances by one.
     *
     * @return the symbol, or 0 once the message has ended
     */
    public int nextSymbol() {
        if (endOfMessage) {
            return 0;
        }
        int record = address + position / symbolsPerChunk;
        if (record != loadedRecord) {
            loadedChunk = store.readChunk(record);
            loadedRecord = record;
        }
        int symbol = loadedChunk.symbolAt(position % symbolsPerChunk);
        position++;
        return symbol;
    }

    /**
     * @return the decoded next symbol, or the EndSym marker once the message has ended
     */
    public char nextCharacter() {
        int symbol = nextSymbol();
        if (endOfMessage) {
            return ControlCode.END.marker();
        }
        return SymbolCodec.decode(symbol);
    }

    /**
     * Reads a 12-bit operand from two symbols, most significant first.
     *
     * @return the operand value in [0, 4095]
     */
    public int readOperand() {
        int hi = nextSymbol();
        int lo = nextSymbol();
        return (hi << Config.SYMBOL_BITS) | lo;
    }

    /**
     * Moves the position by {@code delta} symbols. A target before the start of the message
     * is clamped to 0.
     *
     * @param delta the signed distance
     */
    public void jumpRelative(int delta) {
        int target = position + delta;
        if (target < 0) {
            LOG.warn("Jump by {} from position {} of message {} would go negative, clamping to 0", delta, position, address);
            target = 0;
        }
        position = target;
    }

    /**
     * Moves to an absolute position within the message. A negative target is clamped to 0.
     *
     * @param target the position
     */
    public void jumpAbsolute(int target) {
        if (target < 0) {
            LOG.warn("Jump to negative position {} in message {}, clamping to 0", target, address);
            target = 0;
        }
        position = target;
    }

    /**
     * Captures the current location.
     *
     * @param kind the frame kind
     * @return a frame that resumes here
     */
    public CallFrame snapshot(FrameKind kind) {
        return new CallFrame(kind, address, position, declaredLength);
    }

    /**
     * Captures a location in the current message other than the current position.
     *
     * @param kind     the frame kind
     * @param resumeAt the position to resume at
     * @return a frame that resumes at {@code resumeAt}
     */
    public CallFrame snapshotAt(FrameKind kind, int resumeAt) {
        return new CallFrame(kind, address, resumeAt, declaredLength);
    }

    /**
     * Resumes at a saved location.
     *
     * @param frame the saved location
     */
    public void restore(CallFrame frame) {
        this.address = frame.address();
        this.position = frame.position();
        this.declaredLength = frame.declaredLength();
        this.endOfMessage = false;
    }

    /**
     * Ends the message; further reads return EndSym.
     */
    public void markEnded() {
        this.endOfMessage = true;
    }

    public boolean isEndOfMessage() {
        return endOfMessage;
    }

    public int getAddress() {
        return address;
    }

    public int getPosition() {
        return position;
    }

    public int getDeclaredLength() {
        return declaredLength;
    }

    /**
     * @return the absolute symbol index of the current position in the message file
     */
    public long getAbsoluteSymbolIndex() {
        return (long) address * symbolsPerChunk + position;
    }
}
