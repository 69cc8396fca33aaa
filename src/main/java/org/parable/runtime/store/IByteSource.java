package org.parable.runtime.store;

import java.io.Closeable;
import java.io.IOException;

/**
 * A random-access source of bytes backing a {@link PagedMessageStore}.
 */
public interface IByteSource extends Closeable {

    /**
     * Reads up to {@code length} bytes starting at {@code position}.
     *
     * @param position the absolute byte position
     * @param buffer   the destination buffer
     * @param offset   the offset in the destination buffer
     * @param length   the maximum number of bytes to read
     * @return the number of bytes actually read, 0 at or beyond the end of the source
     * @throws IOException if the underlying source fails
     */
    int read(long position, byte[] buffer, int offset, int length) throws IOException;

    /**
     * @return the total number of bytes in the source
     * @throws IOException if the size cannot be determined
     */
    long size() throws IOException;

    @Override
    default void close() throws IOException {
        // Nothing to release by default.
    }
}
