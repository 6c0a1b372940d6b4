package com.opsdash.domain.model;

/**
 * Event severity. {@link #rank()} is stored next to the name so events can be ordered by it.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isCritical() {
        return rank >= HIGH.rank;
    }

    public String dbValue() {
        return name().toLowerCase();
    }

    public static Severity fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
