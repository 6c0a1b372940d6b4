package com.opsdash.adapter.in.web;

import com.opsdash.domain.error.ListingError;

/**
 * A request rejected while reading its parameters, rendered as a 400 with {@link #getCode()}.
 */
public class InvalidRequestException extends RuntimeException {

    private final String code;

    public InvalidRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static InvalidRequestException of(ListingError error) {
        return new InvalidRequestException(error.code(), error.message());
    }

    public String getCode() {
        return code;
    }
}
