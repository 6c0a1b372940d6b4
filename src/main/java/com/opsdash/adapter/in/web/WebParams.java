package com.opsdash.adapter.in.web;

import java.util.Arrays;
import java.util.Locale;

/**
 * Lenient parsing of optional enum query parameters: case-insensitive, blank means absent.
 */
final class WebParams {

    private WebParams() {}

    static <E extends Enum<E>> E optionalEnum(String value, Class<E> type, String parameter) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(type.getEnumConstants())
            .filter(constant -> constant.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new InvalidRequestException("VALIDATION_ERROR",
                "Invalid value for parameter '" + parameter + "': " + value));
    }
}
