package com.opsdash.domain.error;

/**
 * Sealed type representing expected business errors when recording an access.
 */
public sealed interface RecordAccessError {

    /**
     * Wraps a domain validation error that occurred during access log creation.
     */
    record ValidationFailed(ValidationError error) implements RecordAccessError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
