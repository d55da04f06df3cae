package io.minterm.core;

/**
 * Immutable configuration for minterm classifier construction.
 * <p>
 * Use the builder to create custom configurations:
 * <pre>
 * ClassifierConfiguration config = ClassifierConfiguration.builder()
 *     .asciiTableEnabled(false)
 *     .validateRanges(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.minterm.classifier.MintermClassifier
 */
public final class ClassifierConfiguration {

    private static final ClassifierConfiguration DEFAULTS = builder().build();

    // Table sizing
    private final boolean asciiTableEnabled;

    // Construction-time checks
    private final boolean validateRanges;

    private ClassifierConfiguration(Builder builder) {
        this.asciiTableEnabled = builder.asciiTableEnabled;
        this.validateRanges = builder.validateRanges;
    }

    /**
     * Create a new builder for ClassifierConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared configuration with every option at its default.
     *
     * @return the default configuration
     */
    public static ClassifierConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if the 128-entry table may be used when no explicit minterm
     * claims a code of 128 or above.
     *
     * @return true if the ASCII table is allowed (default: true)
     */
    public boolean asciiTableEnabled() {
        return asciiTableEnabled;
    }

    /**
     * Check if range ordering and cross-minterm overlap are verified while the
     * table is filled.
     *
     * @return true if ranges are validated (default: true)
     */
    public boolean validateRanges() {
        return validateRanges;
    }

    @Override
    public String toString() {
        return "ClassifierConfiguration{asciiTableEnabled=" + asciiTableEnabled
                + ", validateRanges=" + validateRanges + "}";
    }

    /**
     * Builder for ClassifierConfiguration.
     */
    public static class Builder {
        private boolean asciiTableEnabled = true;
        private boolean validateRanges = true;

        private Builder() {
        }

        /**
         * Enable or disable the 128-entry table.
         * When disabled, every multi-minterm classifier allocates the full
         * 65536-entry table.
         *
         * @param asciiTableEnabled true to allow the ASCII table (default: true)
         * @return this builder for method chaining
         */
        public Builder asciiTableEnabled(boolean asciiTableEnabled) {
            this.asciiTableEnabled = asciiTableEnabled;
            return this;
        }

        /**
         * Enable or disable range validation during construction.
         * Disabling skips the ordering and per-slot overlap checks; the
         * minterm 0 check is always performed. Unchecked ranges may arrive in
         * any order and the table shape still covers the highest of them;
         * where they overlap, the higher minterm ID wins.
         *
         * @param validateRanges true to validate ranges (default: true)
         * @return this builder for method chaining
         */
        public Builder validateRanges(boolean validateRanges) {
            this.validateRanges = validateRanges;
            return this;
        }

        /**
         * Build the immutable ClassifierConfiguration.
         *
         * @return a new ClassifierConfiguration instance
         */
        public ClassifierConfiguration build() {
            return new ClassifierConfiguration(this);
        }
    }
}
