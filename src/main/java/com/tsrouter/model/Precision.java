package com.tsrouter.model;

import com.tsrouter.exception.MalformedInputException;

/**
 * Timestamp precision accepted on the write endpoint. Timestamps are always
 * stored and forwarded in nanoseconds.
 */
public enum Precision {
    NANOSECONDS(1L, "n", "ns"),
    MICROSECONDS(1_000L, "u", "us"),
    MILLISECONDS(1_000_000L, "ms"),
    SECONDS(1_000_000_000L, "s"),
    MINUTES(60_000_000_000L, "m"),
    HOURS(3_600_000_000_000L, "h");

    private final long multiplier;
    private final String[] names;

    Precision(long multiplier, String... names) {
        this.multiplier = multiplier;
        this.names = names;
    }

    public long getMultiplier() {
        return multiplier;
    }

    /**
     * Converts a timestamp expressed in this precision to nanoseconds.
     */
    public long toNanos(long value) {
        try {
            return Math.multiplyExact(value, multiplier);
        } catch (ArithmeticException e) {
            throw new MalformedInputException("timestamp out of range: " + value + " " + names[0]);
        }
    }

    /**
     * Resolves the precision query parameter; null or empty means nanoseconds.
     */
    public static Precision fromParameter(String value) {
        if (value == null || value.isEmpty()) {
            return NANOSECONDS;
        }
        for (Precision precision : values()) {
            for (String name : precision.names) {
                if (name.equals(value)) {
                    return precision;
                }
            }
        }
        throw new MalformedInputException("unknown precision: " + value);
    }
}
