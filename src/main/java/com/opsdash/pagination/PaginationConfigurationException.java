package com.opsdash.pagination;

/**
 * Thrown while wiring a paginator or codec with settings that can never work
 * (short secret, empty ordering, unknown cursor field...).
 * Raised at construction time so a bad deployment fails on startup instead of mid-traffic.
 */
public class PaginationConfigurationException extends RuntimeException {

    public PaginationConfigurationException(String message) {
        super(message);
    }

    public PaginationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
