package org.parable.runtime.store;

import org.parable.runtime.Config;

/**
 * Describes the physical layout of a message file: fixed-size pages, each starting with
 * a header that is skipped, followed by a whole number of fixed-size chunks of packed
 * 6-bit symbols.
 *
 * @param pageSize        bytes per page
 * @param pageHeaderSize  bytes skipped at the start of each page
 * @param chunkWidth      bytes per chunk
 * @param symbolsPerChunk symbols packed into one chunk
 */
public record StoreGeometry(int pageSize, int pageHeaderSize, int chunkWidth, int symbolsPerChunk) {

    /**
     * The layout of the shipped message files: 512-byte pages, a 2-byte header and
     * 85 chunks of 8 symbols in 6 bytes.
     */
    public static final StoreGeometry DEFAULT = new StoreGeometry(
        Config.PAGE_SIZE, Config.PAGE_HEADER_SIZE, Config.CHUNK_WIDTH, Config.SYMBOLS_PER_CHUNK);

    public StoreGeometry {
        if (chunkWidth <= 0 || symbolsPerChunk <= 0) {
            throw new IllegalArgumentException("Chunk width and symbols per chunk must be positive");
        }
        if (chunkWidth * 8 != symbolsPerChunk * Config.SYMBOL_BITS) {
            throw new IllegalArgumentException(String.format(
                "A chunk of %d bytes cannot hold exactly %d symbols of %d bits",
                chunkWidth, symbolsPerChunk, Config.SYMBOL_BITS));
        }
        if (pageHeaderSize < 0 || pageSize - pageHeaderSize < chunkWidth) {
            throw new IllegalArgumentException(String.format(
                "Page of %d bytes with a %d-byte header holds no chunk of %d bytes",
                pageSize, pageHeaderSize, chunkWidth));
        }
    }

    /**
     * @return the number of whole chunks in one page
     */
    public int chunksPerPage() {
        return (pageSize - pageHeaderSize) / chunkWidth;
    }

    /**
     * @param recordIndex the global chunk index
     * @return the page that holds the chunk
     */
    public int pageOf(int recordIndex) {
        return recordIndex / chunksPerPage();
    }

    /**
     * @param recordIndex the global chunk index
     * @return the byte offset of the chunk inside its page
     */
    public int offsetInPage(int recordIndex) {
        return pageHeaderSize + (recordIndex % chunksPerPage()) * chunkWidth;
    }
}
