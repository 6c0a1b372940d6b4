package com.opsdash.domain.model;

public enum AccessType {
    ENTRY,
    EXIT;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static AccessType fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
