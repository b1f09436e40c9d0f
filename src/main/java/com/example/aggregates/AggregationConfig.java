package com.example.aggregates;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Options for one aggregation run. Instances are immutable; use {@link #builder()} or
 * {@link #fromMap(Map)}.
 */
public class AggregationConfig {

    public static final String REPORTING_LENGTH = "reporting_length";
    public static final String REPORTING_THRESHOLD = "reporting_threshold";
    public static final String REPORTING_PRECISION = "reporting_precision";
    public static final String PARALLEL_JOBS = "parallel_jobs";
    public static final String SENSITIVE_ZEROS = "sensitive_zeros";
    public static final String MAX_COMBOS_PER_LENGTH = "max_combos_per_length";

    public static final int DEFAULT_REPORTING_LENGTH = 3;
    public static final int DEFAULT_REPORTING_THRESHOLD = 10;
    public static final int DEFAULT_REPORTING_PRECISION = 10;
    public static final long DEFAULT_MAX_COMBOS_PER_LENGTH = 100_000_000L;

    private final int reportingLength;
    private final int reportingThreshold;
    private final int reportingPrecision;
    private final int parallelJobs;
    private final Set<String> sensitiveZeros;
    private final long maxCombosPerLength;

    private AggregationConfig(Builder builder) {
        this.reportingLength = builder.reportingLength;
        this.reportingThreshold = builder.reportingThreshold;
        this.reportingPrecision = builder.reportingPrecision;
        this.parallelJobs = builder.parallelJobs;
        this.sensitiveZeros = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sensitiveZeros));
        this.maxCombosPerLength = builder.maxCombosPerLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the recognized options from an orchestrator's option map. Numbers may be given
     * as {@link Number}s or numeric strings; {@code sensitive_zeros} as a collection or a
     * comma-separated string. Options for other stages are ignored.
     *
     * @throws IllegalArgumentException if an option is malformed or out of range
     */
    public static AggregationConfig fromMap(Map<String, ?> options) {
        Builder builder = builder();
        if (options.containsKey(REPORTING_LENGTH)) {
            builder.reportingLength(intOption(options, REPORTING_LENGTH));
        }
        if (options.containsKey(REPORTING_THRESHOLD)) {
            builder.reportingThreshold(intOption(options, REPORTING_THRESHOLD));
        }
        if (options.containsKey(REPORTING_PRECISION)) {
            builder.reportingPrecision(intOption(options, REPORTING_PRECISION));
        }
        if (options.containsKey(PARALLEL_JOBS)) {
            builder.parallelJobs(intOption(options, PARALLEL_JOBS));
        }
        if (options.containsKey(MAX_COMBOS_PER_LENGTH)) {
            builder.maxCombosPerLength(longOption(options, MAX_COMBOS_PER_LENGTH));
        }
        Object zeros = options.get(SENSITIVE_ZEROS);
        if (zeros instanceof Collection) {
            for (Object column : (Collection<?>) zeros) {
                builder.sensitiveZero(String.valueOf(column));
            }
        } else if (zeros instanceof String) {
            Arrays.stream(((String) zeros).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(builder::sensitiveZero);
        } else if (zeros != null) {
            throw new IllegalArgumentException("Option " + SENSITIVE_ZEROS + " must be a list or a comma-separated string");
        }
        return builder.build();
    }

    private static int intOption(Map<String, ?> options, String key) {
        long value = longOption(options, key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Option " + key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static long longOption(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Option " + key + " is not an integer: " + value, e);
            }
        }
        throw new IllegalArgumentException("Option " + key + " is not an integer: " + value);
    }

    /** Longest combo length to count; -1 means the widest record. */
    public int getReportingLength() {
        return reportingLength;
    }

    public int getReportingThreshold() {
        return reportingThreshold;
    }

    public int getReportingPrecision() {
        return reportingPrecision;
    }

    public int getParallelJobs() {
        return parallelJobs;
    }

    public Set<String> getSensitiveZeros() {
        return sensitiveZeros;
    }

    public long getMaxCombosPerLength() {
        return maxCombosPerLength;
    }

    @Override
    public String toString() {
        return "AggregationConfig{" +
               REPORTING_LENGTH + "=" + reportingLength +
               ", " + REPORTING_THRESHOLD + "=" + reportingThreshold +
               ", " + REPORTING_PRECISION + "=" + reportingPrecision +
               ", " + PARALLEL_JOBS + "=" + parallelJobs +
               ", " + SENSITIVE_ZEROS + "=" + sensitiveZeros +
               ", " + MAX_COMBOS_PER_LENGTH + "=" + maxCombosPerLength +
               '}';
    }

    public static class Builder {
        private int reportingLength = DEFAULT_REPORTING_LENGTH;
        private int reportingThreshold = DEFAULT_REPORTING_THRESHOLD;
        private int reportingPrecision = DEFAULT_REPORTING_PRECISION;
        private int parallelJobs = 1;
        private final Set<String> sensitiveZeros = new LinkedHashSet<>();
        private long maxCombosPerLength = DEFAULT_MAX_COMBOS_PER_LENGTH;

        public Builder reportingLength(int reportingLength) {
            this.reportingLength = reportingLength;
            return this;
        }

        public Builder reportingThreshold(int reportingThreshold) {
            this.reportingThreshold = reportingThreshold;
            return this;
        }

        public Builder reportingPrecision(int reportingPrecision) {
            this.reportingPrecision = reportingPrecision;
            return this;
        }

        public Builder parallelJobs(int parallelJobs) {
            this.parallelJobs = parallelJobs;
            return this;
        }

        public Builder sensitiveZero(String column) {
            this.sensitiveZeros.add(column);
            return this;
        }

        public Builder sensitiveZeros(Collection<String> columns) {
            this.sensitiveZeros.addAll(columns);
            return this;
        }

        /** A value of 0 or below disables the combo budget. */
        public Builder maxCombosPerLength(long maxCombosPerLength) {
            this.maxCombosPerLength = maxCombosPerLength;
            return this;
        }

        /**
         * @throws IllegalArgumentException if an option is out of range
         */
        public AggregationConfig build() {
            if (reportingLength == 0 || reportingLength < -1) {
                throw new IllegalArgumentException(REPORTING_LENGTH + " must be positive or -1: " + reportingLength);
            }
            if (reportingThreshold < 0) {
                throw new IllegalArgumentException(REPORTING_THRESHOLD + " must not be negative: " + reportingThreshold);
            }
            if (reportingPrecision < 1) {
                throw new IllegalArgumentException(REPORTING_PRECISION + " must be at least 1: " + reportingPrecision);
            }
            return new AggregationConfig(this);
        }
    }
}
