package io.github.cyfko.texml.core.config;

/**
 * Memoisation settings for compiled MathML.
 * <p>
 * Documentation generators tend to compile the same fragments again and again
 * ({@code x}, {@code n}, {@code \alpha}, ...). When enabled, the compiler keeps the output of
 * the most recently used fragments in a bounded LRU cache.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();  // enabled, 512 entries
 * CachePolicy.strict();    // enabled, 64 entries
 * CachePolicy.relaxed();   // enabled, 4096 entries
 * CachePolicy.none();      // disabled
 *
 * CachePolicy.builder().cacheSize(2048).build();
 * }</pre>
 *
 * @param cacheEnabled whether compiled output is memoised
 * @param cacheSize    maximum number of cached fragments
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return enabled, 512 entries
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 512);
    }

    /**
     * Small footprint for services compiling untrusted input.
     *
     * @return enabled, 64 entries
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 64);
    }

    /**
     * Large footprint for batch builds of big documents.
     *
     * @return enabled, 4096 entries
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 4096);
    }

    /**
     * @return caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean _cacheEnabled = true;
        private int _cacheSize = 512;

        private Builder() {}

        public CachePolicy build() {
            return new CachePolicy(_cacheEnabled, _cacheSize);
        }

        public Builder cacheEnabled(boolean cacheEnabled) { this._cacheEnabled = cacheEnabled; return this; }
        public Builder cacheSize(int cacheSize) { this._cacheSize = cacheSize; return this; }
    }
}
