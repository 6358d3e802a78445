package io.github.cyfko.texml.core.cache;

import io.github.cyfko.texml.core.config.MathMLOptions;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Bounded LRU cache of compiled MathML.
 * <p>
 * Entries are keyed by the source, the output options and the version of the macro registry
 * the source was compiled against. Redefining any macro changes the version, so an entry can
 * never be served for a registry whose content differs from the one it was computed with.
 * Stale entries are not removed eagerly; they age out.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Guarded by a {@link ReadWriteLock}. Lookups take the write lock because they reorder the
 * access list; {@link #size()} and {@link #contains} only read.
 * </p>
 *
 * <pre>{@code
 * CompilationCache cache = new CompilationCache(512);
 * CompilationCache.Key key = new CompilationCache.Key("x^2", MathMLOptions.defaults(), registry.version());
 * cache.get(key).orElseGet(() -> { String xml = ...; cache.put(key, xml); return xml; });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CompilationCache {
    private static final Logger LOGGER = Logger.getLogger(CompilationCache.class.getName());

    /**
     * @param source          LaTeX source as given by the caller
     * @param options         generator options
     * @param registryVersion {@code MacroRegistry.version()} at compile time
     */
    public record Key(String source, MathMLOptions options, long registryVersion) {
        public Key {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(options, "options");
        }
    }

    private final int maxSize;
    private final Map<Key, String> entries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param maxSize maximum number of entries
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public CompilationCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, String> eldest) {
                boolean evict = size() > CompilationCache.this.maxSize;
                if (evict) {
                    LOGGER.fine(() -> "Evicted cached compilation of: " + eldest.getKey().source());
                }
                return evict;
            }
        };
    }

    /**
     * Looks up an entry and marks it as most recently used.
     *
     * @param key the lookup key
     * @return the cached MathML, or empty
     */
    public Optional<String> get(Key key) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores an entry, evicting the least recently used one when full.
     */
    public void put(Key key, String mathml) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(mathml, "mathml");
        lock.writeLock().lock();
        try {
            entries.put(key, mathml);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(Key key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return a one-line summary, e.g. {@code CompilationCache[size=12, maxSize=512, utilization=2.3%]}
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format(Locale.ROOT, "CompilationCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                    entries.size(), maxSize, (entries.size() * 100.0) / maxSize);
        } finally {
            lock.readLock().unlock();
        }
    }
}
