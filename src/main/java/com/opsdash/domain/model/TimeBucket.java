package com.opsdash.domain.model;

/**
 * Granularity of access frequency analysis; {@link #unit()} is a {@code date_trunc} field.
 */
public enum TimeBucket {
    HOUR("hour"),
    DAY("day"),
    WEEK("week");

    private final String unit;

    TimeBucket(String unit) {
        this.unit = unit;
    }

    public String unit() {
        return unit;
    }

    /**
     * Unknown or missing values fall back to hourly buckets.
     */
    public static TimeBucket parse(String value) {
        if (value == null) {
            return HOUR;
        }
        for (TimeBucket bucket : values()) {
            if (bucket.unit.equalsIgnoreCase(value.trim())) {
                return bucket;
            }
        }
        return HOUR;
    }
}
