package com.opsdash.pagination.keyset;

import java.util.Objects;

public record CursorField(String name, KeyType type) {

    public CursorField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static CursorField of(String name, KeyType type) {
        return new CursorField(name, type);
    }
}
