package com.opsdash.pagination.params;

public enum Direction {
    NEXT("next"),
    PREV("prev");

    private final String wireName;

    Direction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Only the exact strings {@code next} and {@code prev} are recognised; anything else,
     * including null, means {@code NEXT}.
     */
    public static Direction parse(String value) {
        return PREV.wireName.equals(value) ? PREV : NEXT;
    }
}
