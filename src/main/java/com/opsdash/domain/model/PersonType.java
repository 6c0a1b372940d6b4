package com.opsdash.domain.model;

public enum PersonType {
    RESIDENT,
    VISITOR,
    DELIVERY,
    STAFF;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static PersonType fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
