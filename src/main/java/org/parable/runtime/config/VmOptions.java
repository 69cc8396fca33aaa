package org.parable.runtime.config;

import com.typesafe.config.ConfigFactory;
import org.parable.runtime.Config;
import org.parable.runtime.store.StoreGeometry;

/**
 * Typed view of the {@code parable} configuration tree.
 * <p>
 * Configuration structure (all keys optional, defaults from {@link Config}):
 * <pre>
 * parable {
 *   store {
 *     page-size = 512
 *     page-header-size = 2
 *     chunk-width = 6
 *     symbols-per-chunk = 8
 *     cache-capacity = 200
 *   }
 *   vm {
 *     max-call-depth = 32
 *     max-steps = 5000
 *     suppress-text = false
 *   }
 *   random.seed = 42
 * }
 * </pre>
 *
 * @param geometry      the message file layout
 * @param cacheCapacity the page cache capacity
 * @param maxCallDepth  the call-stack limit
 * @param maxSteps      the per-message step watchdog
 * @param suppressText  whether text output starts suppressed
 * @param randomSeed    the seed for the default random provider
 */
public record VmOptions(
    StoreGeometry geometry,
    int cacheCapacity,
    int maxCallDepth,
    int maxSteps,
    boolean suppressText,
    long randomSeed
) {

    private static final String ROOT_PATH = "parable";

    /**
     * The built-in defaults.
     */
    public static final VmOptions DEFAULTS = new VmOptions(
        StoreGeometry.DEFAULT,
        Config.PAGE_CACHE_CAPACITY,
        Config.CALL_STACK_MAX_DEPTH,
        Config.MAX_STEPS_PER_MESSAGE,
        false,
        Config.DEFAULT_RANDOM_SEED);

    public VmOptions {
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cache-capacity must be positive, got " + cacheCapacity);
        }
        if (maxCallDepth < 0) {
            throw new IllegalArgumentException("max-call-depth must not be negative, got " + maxCallDepth);
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max-steps must be positive, got " + maxSteps);
        }
    }

    /**
     * Reads options from a configuration. The configuration may either be the application root
     * (containing a {@code parable} object) or the {@code parable} object itself.
     *
     * @param config the configuration
     * @return the options, with missing keys taken from {@link #DEFAULTS}
     */
    public static VmOptions fromConfig(com.typesafe.config.Config config) {
        com.typesafe.config.Config options = config.hasPath(ROOT_PATH)
            ? config.getConfig(ROOT_PATH)
            : config;
        com.typesafe.config.Config store = options.hasPath("store") ? options.getConfig("store") : ConfigFactory.empty();
        com.typesafe.config.Config vm = options.hasPath("vm") ? options.getConfig("vm") : ConfigFactory.empty();

        StoreGeometry geometry = new StoreGeometry(
            getInt(store, "page-size", Config.PAGE_SIZE),
            getInt(store, "page-header-size", Config.PAGE_HEADER_SIZE),
            getInt(store, "chunk-width", Config.CHUNK_WIDTH),
            getInt(store, "symbols-per-chunk", Config.SYMBOLS_PER_CHUNK));

        return new VmOptions(
            geometry,
            getInt(store, "cache-capacity", Config.PAGE_CACHE_CAPACITY),
            getInt(vm, "max-call-depth", Config.CALL_STACK_MAX_DEPTH),
            getInt(vm, "max-steps", Config.MAX_STEPS_PER_MESSAGE),
            vm.hasPath("suppress-text") && vm.getBoolean("suppress-text"),
            options.hasPath("random.seed") ? options.getLong("random.seed") : Config.DEFAULT_RANDOM_SEED);
    }

    private static int getInt(com.typesafe.config.Config config, String path, int defaultValue) {
        return config.hasPath(path) ? config.getInt(path) : defaultValue;
    }
}
