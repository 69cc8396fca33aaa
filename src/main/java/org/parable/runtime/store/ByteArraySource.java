package org.parable.runtime.store;

import java.util.Arrays;

/**
 * An in-memory {@link IByteSource}. The bytes are copied on construction.
 */
public final class ByteArraySource implements IByteSource {

    private final byte[] data;

    public ByteArraySource(byte[] data) {
        this.data = Arrays.copyOf(data, data.length);
    }

    @Override
    public int read(long position, byte[] buffer, int offset, int length) {
        if (position < 0 || position >= data.length) {
            return 0;
        }
        int count = (int) Math.min(length, data.length - position);
        System.arraycopy(data, (int) position, buffer, offset, count);
        return count;
    }

    @Override
    public long size() {
        return data.length;
    }
}
