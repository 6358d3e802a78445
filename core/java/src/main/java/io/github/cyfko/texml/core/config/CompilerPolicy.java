package io.github.cyfko.texml.core.config;

/**
 * Resource limits applied to every compilation, protecting services that compile
 * untrusted LaTeX against oversized or pathological input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxInputLength</strong>: maximum number of chars of a fragment</li>
 *   <li><strong>maxExpansionDepth</strong>: maximum nesting of macro expansions; a macro whose
 *   body calls itself fails once this depth is reached instead of overflowing the stack</li>
 *   <li><strong>maxNestingDepth</strong>: maximum nesting of groups, arguments and environments</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * CompilerPolicy policy = CompilerPolicy.defaults();
 *
 * // Strict (for public endpoints)
 * CompilerPolicy policy = CompilerPolicy.strict();
 *
 * // Relaxed (for trusted batch builds)
 * CompilerPolicy policy = CompilerPolicy.relaxed();
 *
 * // Custom
 * CompilerPolicy policy = CompilerPolicy.builder()
 *     .maxInputLength(50_000)
 *     .build();
 * }</pre>
 *
 * @param policyName        name reported in logs
 * @param maxInputLength    maximum source length in chars
 * @param maxExpansionDepth maximum nested macro expansions
 * @param maxNestingDepth   maximum nested groups
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompilerPolicy(
        String policyName,
        int maxInputLength,
        int maxExpansionDepth,
        int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public CompilerPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
        if (maxExpansionDepth <= 0) {
            throw new IllegalArgumentException("maxExpansionDepth must be positive, got: " + maxExpansionDepth);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * <ul>
     *   <li>Max Input Length: 20000 chars</li>
     *   <li>Max Expansion Depth: 100</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return default configuration
     */
    public static CompilerPolicy defaults() {
        return new CompilerPolicy(PolicyName.DEFAULT_POLICY.name(), 20_000, 100, 256);
    }

    /**
     * <ul>
     *   <li>Max Input Length: 2000 chars</li>
     *   <li>Max Expansion Depth: 16</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static CompilerPolicy strict() {
        return new CompilerPolicy(PolicyName.STRICT_POLICY.name(), 2_000, 16, 64);
    }

    /**
     * <ul>
     *   <li>Max Input Length: 200000 chars</li>
     *   <li>Max Expansion Depth: 1000</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static CompilerPolicy relaxed() {
        return new CompilerPolicy(PolicyName.RELAXED_POLICY.name(), 200_000, 1000, 1024);
    }

    /**
     * Builder parameters start from the default preset values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxInputLength = 20_000;
        private int _maxExpansionDepth = 100;
        private int _maxNestingDepth = 256;

        private Builder() {}

        public CompilerPolicy build() {
            return new CompilerPolicy(_policyName, _maxInputLength, _maxExpansionDepth, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxInputLength(int maxInputLength) { this._maxInputLength = maxInputLength; return this; }
        public Builder maxExpansionDepth(int maxExpansionDepth) { this._maxExpansionDepth = maxExpansionDepth; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
