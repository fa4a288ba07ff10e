package io.github.cyfko.celldl.core.config;

/**
 * Limits and switches applied by {@link io.github.cyfko.celldl.core.impl.DefaultCellDlParser}.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li><strong>maxSourceLength</strong>: longest source text accepted, in characters</li>
 *   <li><strong>recoveryEnabled</strong>: whether the strict entry points keep parsing after the
 *       first syntax error to report every error, or stop at the first one. The tolerant entry
 *       point always recovers.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (editor and build usage)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (untrusted input, first error only)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (large generated models)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxSourceLength(50_000)
 *     .build();
 * }</pre>
 *
 * @param policyName      name of the policy, for logs
 * @param maxSourceLength longest source text accepted
 * @param recoveryEnabled whether strict parsing reports every error
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxSourceLength,
    boolean recoveryEnabled
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length is not positive
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("maxSourceLength must be positive, got: " + maxSourceLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Source Length: 1 000 000 characters</li>
     *   <li>Recovery: ENABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 1_000_000, true);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Source Length: 100 000 characters</li>
     *   <li>Recovery: DISABLED, strict parsing stops at the first error</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 100_000, false);
    }

    /**
     * Relaxed configuration for large trusted models.
     * <ul>
     *   <li>Max Source Length: 10 000 000 characters</li>
     *   <li>Recovery: ENABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10_000_000, true);
    }

    /**
     * Creates a custom configuration, initialised like {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxSourceLength = 1_000_000;
        private boolean _recoveryEnabled = true;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxSourceLength, _recoveryEnabled);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSourceLength(int maxSourceLength) { this._maxSourceLength = maxSourceLength; return this; }
        public Builder recoveryEnabled(boolean recoveryEnabled) { this._recoveryEnabled = recoveryEnabled; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
