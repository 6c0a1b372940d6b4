package com.opsdash.pagination.keyset;

public enum SortDirection {
    ASC,
    DESC;

    public SortDirection flip() {
        return this == ASC ? DESC : ASC;
    }
}
