package com.buildsentinel.core.model;

import com.buildsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, totally ordered from {@link #LOW} to {@link #CRITICAL}.
 *
 * <p>
 * {@link #fromZScore(double)} is the single place where a z-score is turned
 * into a severity. Upstream producers should call it rather than applying
 * their own thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** z-score above which an anomaly is at least {@link #MEDIUM}. */
    public static final double MEDIUM_Z_THRESHOLD = 2.5;

    /** z-score above which an anomaly is at least {@link #HIGH}. */
    public static final double HIGH_Z_THRESHOLD = 4.0;

    /** z-score above which an anomaly is {@link #CRITICAL}. */
    public static final double CRITICAL_Z_THRESHOLD = 5.0;

    /**
     * Derive a severity from the largest absolute z-score of an anomaly.
     *
     * @param zScore maximum z-score; the sign is ignored
     * @return derived severity
     */
    public static Severity fromZScore(double zScore) {
        double z = Math.abs(zScore);
        if (z > CRITICAL_Z_THRESHOLD) {
            return CRITICAL;
        }
        if (z > HIGH_Z_THRESHOLD) {
            return HIGH;
        }
        if (z > MEDIUM_Z_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Parse a severity name, ignoring case and surrounding whitespace.
     *
     * @param value severity name such as {@code "high"}
     * @return the matching severity
     * @throws ValidationException if {@code value} is blank or unknown
     */
    @JsonCreator
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high, critical", e);
        }
    }

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity is strictly lower than {@code other}
     */
    public boolean isBelow(Severity other) {
        return compareTo(other) < 0;
    }

    /**
     * @return lowercase wire name, e.g. {@code "critical"}
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
