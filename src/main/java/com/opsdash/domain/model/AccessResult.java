package com.opsdash.domain.model;

public enum AccessResult {
    GRANTED,
    DENIED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static AccessResult fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
