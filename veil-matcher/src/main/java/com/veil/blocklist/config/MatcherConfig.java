package com.veil.blocklist.config;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Sizing and limits for {@link com.veil.blocklist.matcher.PatternMatcher}.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via an environment variable or, when the
 * variable is unset, a system property of the same name:
 * <pre>
 * MATCHER_MAX_PATTERNS=100000
 * MATCHER_EXPECTED_PATTERNS=50000
 * MATCHER_FALSE_POSITIVE_RATE=0.01
 * MATCHER_BLOOM_FILTER_BITS=1048576
 * MATCHER_HASH_FUNCTIONS=7
 * MATCHER_MAX_PATTERN_LENGTH=512
 * </pre>
 * Values that do not parse are logged and ignored.
 *
 * <p>The Bloom filter is sized from {@code expectedPatterns} and
 * {@code falsePositiveRate} unless {@code bloomFilterBits} is set, in which
 * case {@code hashFunctions} positions are used per key.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * MatcherConfig config = MatcherConfig.builder()
 *     .maxPatterns(50_000)
 *     .falsePositiveRate(0.001)
 *     .build();
 * }</pre>
 */
public final class MatcherConfig {
    private static final Logger logger = Logger.getLogger(MatcherConfig.class.getName());

    static final String ENV_MAX_PATTERNS = "MATCHER_MAX_PATTERNS";
    static final String ENV_EXPECTED_PATTERNS = "MATCHER_EXPECTED_PATTERNS";
    static final String ENV_FALSE_POSITIVE_RATE = "MATCHER_FALSE_POSITIVE_RATE";
    static final String ENV_BLOOM_FILTER_BITS = "MATCHER_BLOOM_FILTER_BITS";
    static final String ENV_HASH_FUNCTIONS = "MATCHER_HASH_FUNCTIONS";
    static final String ENV_MAX_PATTERN_LENGTH = "MATCHER_MAX_PATTERN_LENGTH";

    public static final int DEFAULT_MAX_PATTERNS = 100_000;
    public static final int DEFAULT_EXPECTED_PATTERNS = 100_000;
    public static final double DEFAULT_FALSE_POSITIVE_RATE = 0.01;
    public static final int DEFAULT_HASH_FUNCTIONS = 7;
    public static final int DEFAULT_MAX_PATTERN_LENGTH = 512;

    private final int maxPatterns;
    private final int expectedPatterns;
    private final double falsePositiveRate;
    private final int bloomFilterBits;
    private final int hashFunctions;
    private final int maxPatternLength;

    private MatcherConfig(Builder builder) {
        this.maxPatterns = builder.maxPatterns;
        this.expectedPatterns = builder.expectedPatterns;
        this.falsePositiveRate = builder.falsePositiveRate;
        this.bloomFilterBits = builder.bloomFilterBits;
        this.hashFunctions = builder.hashFunctions;
        this.maxPatternLength = builder.maxPatternLength;
        validate();
    }

    /**
     * Built-in defaults, ignoring the environment.
     */
    public static MatcherConfig defaults() {
        return new Builder(false).build();
    }

    /**
     * Built-in defaults with environment overrides applied.
     */
    public static MatcherConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Builder seeded from the environment; explicit setter calls win.
     */
    public static Builder builder() {
        return new Builder(true);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.maxPatterns = maxPatterns;
        builder.expectedPatterns = expectedPatterns;
        builder.falsePositiveRate = falsePositiveRate;
        builder.bloomFilterBits = bloomFilterBits;
        builder.hashFunctions = hashFunctions;
        builder.maxPatternLength = maxPatternLength;
        return builder;
    }

    private void validate() {
        if (maxPatterns <= 0) {
            throw new IllegalArgumentException("maxPatterns must be positive: " + maxPatterns);
        }
        if (expectedPatterns <= 0) {
            throw new IllegalArgumentException("expectedPatterns must be positive: " + expectedPatterns);
        }
        if (!(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw new IllegalArgumentException("falsePositiveRate must be in (0, 1): " + falsePositiveRate);
        }
        if (bloomFilterBits < 0) {
            throw new IllegalArgumentException("bloomFilterBits must not be negative: " + bloomFilterBits);
        }
        if (hashFunctions <= 0) {
            throw new IllegalArgumentException("hashFunctions must be positive: " + hashFunctions);
        }
        if (maxPatternLength <= 0) {
            throw new IllegalArgumentException("maxPatternLength must be positive: " + maxPatternLength);
        }
        logger.fine("Matcher configuration validated: " + this);
    }

    public int getMaxPatterns() { return maxPatterns; }
    public int getExpectedPatterns() { return expectedPatterns; }
    public double getFalsePositiveRate() { return falsePositiveRate; }
    public int getHashFunctions() { return hashFunctions; }
    public int getMaxPatternLength() { return maxPatternLength; }

    /**
     * @return explicit filter size, or empty when sized from the expected count
     */
    public Optional<Integer> getBloomFilterBits() {
        return bloomFilterBits > 0 ? Optional.of(bloomFilterBits) : Optional.empty();
    }

    @Override
    public String toString() {
        return "MatcherConfig{maxPatterns=" + maxPatterns
                + ", expectedPatterns=" + expectedPatterns
                + ", falsePositiveRate=" + falsePositiveRate
                + ", bloomFilterBits=" + (bloomFilterBits > 0 ? bloomFilterBits : "auto")
                + ", hashFunctions=" + hashFunctions
                + ", maxPatternLength=" + maxPatternLength + "}";
    }

    public static final class Builder {

        private int maxPatterns = DEFAULT_MAX_PATTERNS;
        private int expectedPatterns = DEFAULT_EXPECTED_PATTERNS;
        private double falsePositiveRate = DEFAULT_FALSE_POSITIVE_RATE;
        private int bloomFilterBits = 0;
        private int hashFunctions = DEFAULT_HASH_FUNCTIONS;
        private int maxPatternLength = DEFAULT_MAX_PATTERN_LENGTH;

        private Builder(boolean applyEnvironment) {
            if (applyEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvInt(ENV_MAX_PATTERNS).ifPresent(val -> this.maxPatterns = val);
            getEnvInt(ENV_EXPECTED_PATTERNS).ifPresent(val -> this.expectedPatterns = val);
            getEnvDouble(ENV_FALSE_POSITIVE_RATE).ifPresent(val -> this.falsePositiveRate = val);
            getEnvInt(ENV_BLOOM_FILTER_BITS).ifPresent(val -> this.bloomFilterBits = val);
            getEnvInt(ENV_HASH_FUNCTIONS).ifPresent(val -> this.hashFunctions = val);
            getEnvInt(ENV_MAX_PATTERN_LENGTH).ifPresent(val -> this.maxPatternLength = val);
        }

        public Builder maxPatterns(int maxPatterns) {
            this.maxPatterns = maxPatterns;
            return this;
        }

        public Builder expectedPatterns(int expectedPatterns) {
            this.expectedPatterns = expectedPatterns;
            return this;
        }

        public Builder falsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
            return this;
        }

        /**
         * Fixes the filter size; {@code 0} restores sizing from the expected count.
         */
        public Builder bloomFilterBits(int bloomFilterBits) {
            this.bloomFilterBits = bloomFilterBits;
            return this;
        }

        public Builder hashFunctions(int hashFunctions) {
            this.hashFunctions = hashFunctions;
            return this;
        }

        public Builder maxPatternLength(int maxPatternLength) {
            this.maxPatternLength = maxPatternLength;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded override: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Double> getEnvDouble(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Double.parseDouble(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid double value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
