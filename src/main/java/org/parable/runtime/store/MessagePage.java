package org.parable.runtime.store;

import java.util.Arrays;

/**
 * One page of the message file as loaded into the cache. Pages are immutable.
 */
public final class MessagePage {

    private final int pageNumber;
    private final byte[] data;

    MessagePage(int pageNumber, byte[] data) {
        this.pageNumber = pageNumber;
        this.data = data;
    }

    public int pageNumber() {
        return pageNumber;
    }

    public int size() {
        return data.length;
    }

    /**
     * @param offset byte offset within the page
     * @return the unsigned byte value
     */
    public int byteAt(int offset) {
        return data[offset] & 0xFF;
    }

    /**
     * Copies a range of the page.
     *
     * @param offset start offset
     * @param length number of bytes
     * @return a fresh array
     */
    public byte[] copyRange(int offset, int length) {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    /**
     * @return a copy of the whole page
     */
    public byte[] toByteArray() {
        return data.clone();
    }
}
