package com.opsdash.pagination.cursor;

/**
 * Sealed type for the ways a client supplied cursor can be rejected.
 * Both variants are client errors; callers show them with the same message so
 * the exact failing step is never revealed.
 */
public sealed interface CursorError {

    String PUBLIC_MESSAGE = "Invalid pagination cursor";

    record Invalid() implements CursorError {
        public static final Invalid INSTANCE = new Invalid();

        @Override
        public String message() {
            return PUBLIC_MESSAGE;
        }

        @Override
        public String code() {
            return "INVALID_CURSOR";
        }

        @Override
        public String reason() {
            return "invalid";
        }
    }

    record Expired(long ageMillis) implements CursorError {
        @Override
        public String message() {
            return PUBLIC_MESSAGE;
        }

        @Override
        public String code() {
            return "INVALID_CURSOR";
        }

        @Override
        public String reason() {
            return "expired";
        }
    }

    String message();

    String code();

    /**
     * Internal classification, used for metrics and logs only.
     */
    String reason();
}
