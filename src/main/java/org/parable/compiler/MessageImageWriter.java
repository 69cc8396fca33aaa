package org.parable.compiler;

import org.parable.runtime.Config;
import org.parable.runtime.store.Chunk;
import org.parable.runtime.store.StoreGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.TreeMap;

/**
 * Lays message symbol streams out as a paged message file. Each message starts on a chunk
 * boundary; its address is the index of that chunk. Address 0 is never used, since the
 * machine treats it as invalid. Every page starts with the header sentinel bytes.
 */
public class MessageImageWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MessageImageWriter.class);

    private final StoreGeometry geometry;
    private final TreeMap<Integer, int[]> messages = new TreeMap<>();
    private int nextFreeRecord = 1;

    public MessageImageWriter() {
        this(StoreGeometry.DEFAULT);
    }

    public MessageImageWriter(StoreGeometry geometry) {
        this.geometry = geometry;
    }

    /**
     * Places a message after the last placed message.
     *
     * @param symbols the message symbols
     * @return the address of the message
     */
    public int append(int[] symbols) {
        int address = nextFreeRecord;
        place(address, symbols);
        return address;
    }

    /**
     * Places a message at a fixed address.
     *
     * @param address the chunk address, at least 1
     * @param symbols the message symbols
     * @return this writer
     * @throws AssemblyException if the address is invalid or the message overlaps another one
     */
    public MessageImageWriter place(int address, int[] symbols) {
        if (address <= 0) {
            throw new AssemblyException("Message address must be positive, got " + address);
        }
        int records = recordsFor(symbols.length);
        var before = messages.floorEntry(address);
        if (before != null && before.getKey() + recordsFor(before.getValue().length) > address) {
            throw new AssemblyException("Message at " + address + " overlaps message at " + before.getKey());
        }
        var after = messages.ceilingEntry(address);
        if (after != null && address + records > after.getKey()) {
            throw new AssemblyException("Message at " + address + " overlaps message at " + after.getKey());
        }
        messages.put(address, symbols.clone());
        nextFreeRecord = Math.max(nextFreeRecord, address + records);
        return this;
    }

    /**
     * Produces the message file.
     *
     * @return the image bytes, a whole number of pages
     */
    public byte[] toByteArray() {
        int recordCount = messages.isEmpty() ? 1 : messages.lastKey() + recordsFor(messages.lastEntry().getValue().length);
        int pageCount = (recordCount + geometry.chunksPerPage() - 1) / geometry.chunksPerPage();
        byte[] image = new byte[pageCount * geometry.pageSize()];

        for (int page = 0; page < pageCount; page++) {
            Arrays.fill(image, page * geometry.pageSize(), page * geometry.pageSize() + geometry.pageHeaderSize(),
                (byte) Config.PAGE_HEADER_SENTINEL);
        }

        int perChunk = geometry.symbolsPerChunk();
        messages.forEach((address, symbols) -> {
            for (int i = 0; i < symbols.length; i += perChunk) {
                int[] slice = Arrays.copyOfRange(symbols, i, Math.min(i + perChunk, symbols.length));
                int record = address + i / perChunk;
                byte[] chunk = Chunk.pack(geometry.chunkWidth(), slice).toByteArray();
                int offset = geometry.pageOf(record) * geometry.pageSize() + geometry.offsetInPage(record);
                System.arraycopy(chunk, 0, image, offset, chunk.length);
            }
        });
        return image;
    }

    /**
     * Writes the message file.
     *
     * @param path the destination
     * @throws IOException if the file cannot be written
     */
    public void writeTo(Path path) throws IOException {
        byte[] image = toByteArray();
        Files.write(path, image);
        LOG.info("Wrote {} messages ({} bytes) to {}", messages.size(), image.length, path);
    }

    private int recordsFor(int symbolCount) {
        return Math.max(1, (symbolCount + geometry.symbolsPerChunk() - 1) / geometry.symbolsPerChunk());
    }
}
