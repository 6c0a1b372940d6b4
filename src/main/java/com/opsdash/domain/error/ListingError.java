package com.opsdash.domain.error;

import com.opsdash.pagination.cursor.CursorError;

/**
 * Expected failures of a paginated listing: a rejected cursor or a rejected filter.
 */
public sealed interface ListingError {

    record InvalidCursor(CursorError error) implements ListingError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    /**
     * Wraps a filter validation error detected before any query ran.
     */
    record InvalidFilter(ValidationError error) implements ListingError {
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
