/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.extraction;

import java.util.Properties;

/**
 * Thresholds and execution settings applied uniformly to one extraction run.
 *
 * <p>Thresholds are deliberately not range-checked: an out-of-range value
 * (for example {@code minSupport = 2.0}) yields an empty policy set instead
 * of an error.
 *
 * @param minSupport        minimum support a rule needs (default 0.05)
 * @param minConfidence     minimum confidence a rule needs (default 0.6)
 * @param minLift           minimum lift a rule needs (default 1.0)
 * @param parallelism       number of counting workers (default 1, sequential)
 * @param parallelThreshold minimum number of logs before counting is split across workers
 */
public record ExtractionConfig(
        double minSupport,
        double minConfidence,
        double minLift,
        int parallelism,
        int parallelThreshold) {

    public static final double DEFAULT_MIN_SUPPORT = 0.05;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
    public static final double DEFAULT_MIN_LIFT = 1.0;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 10_000;

    public static final String MIN_SUPPORT_PROPERTY = "policyminer.min-support";
    public static final String MIN_CONFIDENCE_PROPERTY = "policyminer.min-confidence";
    public static final String MIN_LIFT_PROPERTY = "policyminer.min-lift";
    public static final String PARALLELISM_PROPERTY = "policyminer.parallelism";

    public ExtractionConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be >= 1, got: " + parallelThreshold);
        }
    }

    public static ExtractionConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a sequential configuration with the given thresholds.
     */
    public static ExtractionConfig of(double minSupport, double minConfidence, double minLift) {
        return builder()
                .minSupport(minSupport)
                .minConfidence(minConfidence)
                .minLift(minLift)
                .build();
    }

    /**
     * Reads {@code policyminer.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static ExtractionConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(MIN_SUPPORT_PROPERTY)) != null) {
            builder.minSupport(parseDouble(MIN_SUPPORT_PROPERTY, value));
        }
        if ((value = properties.getProperty(MIN_CONFIDENCE_PROPERTY)) != null) {
            builder.minConfidence(parseDouble(MIN_CONFIDENCE_PROPERTY, value));
        }
        if ((value = properties.getProperty(MIN_LIFT_PROPERTY)) != null) {
            builder.minLift(parseDouble(MIN_LIFT_PROPERTY, value));
        }
        if ((value = properties.getProperty(PARALLELISM_PROPERTY)) != null) {
            try {
                builder.parallelism(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PARALLELISM_PROPERTY + " is not an integer: " + value, e);
            }
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .minSupport(minSupport)
                .minConfidence(minConfidence)
                .minLift(minLift)
                .parallelism(parallelism)
                .parallelThreshold(parallelThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    /**
     * Builder for ExtractionConfig
     */
    public static final class Builder {
        private double minSupport = DEFAULT_MIN_SUPPORT;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private double minLift = DEFAULT_MIN_LIFT;
        private int parallelism = DEFAULT_PARALLELISM;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

        private Builder() {
        }

        public Builder minSupport(double minSupport) {
            this.minSupport = minSupport;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder minLift(double minLift) {
            this.minLift = minLift;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(minSupport, minConfidence, minLift, parallelism, parallelThreshold);
        }
    }
}
