package com.opsdash.domain.error;

import java.time.Instant;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Access log validation errors
    sealed interface AccessLogError extends ValidationError {

        record MissingBuilding() implements AccessLogError {
            public static final MissingBuilding INSTANCE = new MissingBuilding();
            @Override
            public String message() {
                return "Building ID is required";
            }

            @Override
            public String code() {
                return "BUILDING_REQUIRED";
            }
        }

        record MissingPersonDocument() implements AccessLogError {
            public static final MissingPersonDocument INSTANCE = new MissingPersonDocument();
            @Override
            public String message() {
                return "Person document is required";
            }

            @Override
            public String code() {
                return "PERSON_DOCUMENT_REQUIRED";
            }
        }

        record DocumentTooLong(int length, int maxLength) implements AccessLogError {
            @Override
            public String message() {
                return "Person document exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "PERSON_DOCUMENT_TOO_LONG";
            }
        }

        record NegativeProcessingTime(int value) implements AccessLogError {
            @Override
            public String message() {
                return "Processing time cannot be negative: " + value;
            }

            @Override
            public String code() {
                return "PROCESSING_TIME_NEGATIVE";
            }
        }
    }

    // Listing filter errors
    sealed interface FilterError extends ValidationError {

        record InvalidTimeRange(Instant from, Instant to) implements FilterError {
            @Override
            public String message() {
                return "Time range start " + from + " is after its end " + to;
            }

            @Override
            public String code() {
                return "INVALID_TIME_RANGE";
            }
        }

        record InvalidWindow(long hours, long maxHours) implements FilterError {
            @Override
            public String message() {
                return "Window must be between 1 and " + maxHours + " hours (was " + hours + ")";
            }

            @Override
            public String code() {
                return "INVALID_WINDOW";
            }
        }
    }
}
