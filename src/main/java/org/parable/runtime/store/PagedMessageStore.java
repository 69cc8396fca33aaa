package org.parable.runtime.store;

import org.parable.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Virtual-memory view over a message file. Pages are loaded on first reference and kept in a
 * bounded cache keyed by page number; when the cache is full the least recently used page is
 * evicted. Pages never change once loaded, so an evicted page reloads with identical content.
 * <p>
 * The store is meant to be used from one logical thread of control and does no locking.
 */
public class PagedMessageStore {

    private static final Logger LOG = LoggerFactory.getLogger(PagedMessageStore.class);

    private final IByteSource source;
    private final StoreGeometry geometry;
    private final int capacity;
    private final LinkedHashMap<Integer, MessagePage> pages;

    private long hits;
    private long misses;
    private long evictions;
    private long shortReads;

    /**
     * Creates a store with the default geometry and cache capacity.
     *
     * @param source the backing message file
     */
    public PagedMessageStore(IByteSource source) {
        this(source, StoreGeometry.DEFAULT, Config.PAGE_CACHE_CAPACITY);
    }

    /**
     * Creates a store.
     *
     * @param source   the backing message file
     * @param geometry the page and chunk layout
     * @param capacity the maximum number of cached pages
     */
    public PagedMessageStore(IByteSource source, StoreGeometry geometry, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Page cache capacity must be positive, got " + capacity);
        }
        this.source = source;
        this.geometry = geometry;
        this.capacity = capacity;
        this.pages = new LinkedHashMap<>(Math.min(capacity, 256), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, MessagePage> eldest) {
                if (size() > PagedMessageStore.this.capacity) {
                    evictions++;
                    LOG.trace("Evicting page {} from message cache", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Returns a page, loading it from the backing source on a cache miss. A short read is
     * zero-filled to the full page size.
     *
     * @param pageNumber the page number
     * @return the page
     * @throws IllegalArgumentException if the page number is negative
     * @throws MessageStoreException    if the backing source fails
     */
    public MessagePage getPage(int pageNumber) {
        if (pageNumber < 0) {
            throw new IllegalArgumentException("Negative page number: " + pageNumber);
        }
        MessagePage page = pages.get(pageNumber);
        if (page != null) {
            hits++;
            return page;
        }
        misses++;
        page = loadPage(pageNumber);
        pages.put(pageNumber, page);
        return page;
    }

    /**
     * Reads one chunk by its global record index.
     *
     * @param recordIndex the chunk index
     * @return a copy of the chunk
     */
    public Chunk readChunk(int recordIndex) {
        if (recordIndex < 0) {
            throw new IllegalArgumentException("Negative record index: " + recordIndex);
        }
        MessagePage page = getPage(geometry.pageOf(recordIndex));
        return new Chunk(page.copyRange(geometry.offsetInPage(recordIndex), geometry.chunkWidth()));
    }

    /**
     * Reads a single symbol by its absolute symbol index.
     *
     * @param symbolIndex the absolute symbol index ({@code record * symbolsPerChunk + offset})
     * @return the symbol value
     */
    public int readSymbol(long symbolIndex) {
        int record = (int) (symbolIndex / geometry.symbolsPerChunk());
        int index = (int) (symbolIndex % geometry.symbolsPerChunk());
        return readChunk(record).symbolAt(index);
    }

    /**
     * @param recordIndex the chunk index
     * @return true if the chunk lies within the backing source
     */
    public boolean containsRecord(int recordIndex) {
        if (recordIndex < 0) {
            return false;
        }
        try {
            long pageStart = (long) geometry.pageOf(recordIndex) * geometry.pageSize();
            return pageStart + geometry.offsetInPage(recordIndex) < source.size();
        } catch (IOException e) {
            throw new MessageStoreException("Unable to determine size of message source " + source, e);
        }
    }

    public StoreGeometry getGeometry() {
        return geometry;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the number of pages currently held in the cache
     */
    public int getCachedPageCount() {
        return pages.size();
    }

    /**
     * @param pageNumber the page number
     * @return true if the page is currently cached
     */
    public boolean isCached(int pageNumber) {
        return pages.containsKey(pageNumber);
    }

    /**
     * Returns cache statistics.
     *
     * @return metric name to value
     */
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("hits", hits);
        metrics.put("misses", misses);
        metrics.put("evictions", evictions);
        metrics.put("short_reads", shortReads);
        metrics.put("cached_pages", pages.size());
        metrics.put("capacity", capacity);
        return metrics;
    }

    private MessagePage loadPage(int pageNumber) {
        int pageSize = geometry.pageSize();
        byte[] data = new byte[pageSize];
        long position = (long) pageNumber * pageSize;
        int total = 0;
        try {
            while (total < pageSize) {
                int n = source.read(position + total, data, total, pageSize - total);
                if (n <= 0) {
                    break;
                }
                total += n;
            }
        } catch (IOException e) {
            throw new MessageStoreException("Failed to read page " + pageNumber + " from " + source, e);
        }
        if (total < pageSize) {
            // The array is already zeroed past the bytes that were read.
            shortReads++;
            LOG.debug("Short read for page {}: {} of {} bytes, zero-filled", pageNumber, total, pageSize);
        }
        LOG.trace("Loaded page {} into message cache", pageNumber);
        return new MessagePage(pageNumber, data);
    }
}
