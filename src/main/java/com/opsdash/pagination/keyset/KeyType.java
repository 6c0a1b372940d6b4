package com.opsdash.pagination.keyset;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Value type of a cursor field. Converts between the two shapes a key value takes:
 * what the row holds (JDBC or domain types) and what the cursor JSON holds.
 */
public enum KeyType {

    STRING {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof CharSequence text) {
                return text.toString();
            }
            throw unsupported(raw);
        }
    },

    LONG {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (raw instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
            throw unsupported(raw);
        }
    },

    DECIMAL {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof BigDecimal decimal) {
                return decimal;
            }
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return BigDecimal.valueOf(((Number) raw).longValue());
            }
            if (raw instanceof Double || raw instanceof Float || raw instanceof BigInteger) {
                return new BigDecimal(raw.toString());
            }
            throw unsupported(raw);
        }
    },

    INSTANT {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof Instant instant) {
                return instant;
            }
            if (raw instanceof Timestamp timestamp) {
                return timestamp.toInstant();
            }
            if (raw instanceof OffsetDateTime dateTime) {
                return dateTime.toInstant();
            }
            if (raw instanceof ZonedDateTime dateTime) {
                return dateTime.toInstant();
            }
            if (raw instanceof LocalDateTime dateTime) {
                return dateTime.toInstant(ZoneOffset.UTC);
            }
            if (raw instanceof java.util.Date date) {
                return Instant.ofEpochMilli(date.getTime());
            }
            if (raw instanceof String text) {
                try {
                    return Instant.parse(text);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Not an ISO-8601 instant: " + text, e);
                }
            }
            throw unsupported(raw);
        }

        @Override
        public Object toJson(Object canonical) {
            return canonical == null ? null : canonical.toString();
        }
    },

    UUID {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof java.util.UUID uuid) {
                return uuid;
            }
            if (raw instanceof String text) {
                return java.util.UUID.fromString(text);
            }
            throw unsupported(raw);
        }

        @Override
        public Object toJson(Object canonical) {
            return canonical == null ? null : canonical.toString();
        }
    },

    BOOLEAN {
        @Override
        Object canonical(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            throw unsupported(raw);
        }
    };

    abstract Object canonical(Object raw);

    /**
     * Converts a value read from a row into this type's canonical Java form.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object normalize(Object raw) {
        return raw == null ? null : canonical(raw);
    }

    /**
     * Converts a JSON scalar taken from a decoded cursor into the canonical form.
     *
     * @throws IllegalArgumentException if the cursor value does not fit this type
     */
    public Object fromJson(Object json) {
        if (json == null) {
            return null;
        }
        if (this == STRING && !(json instanceof String)) {
            throw unsupported(json);
        }
        try {
            return canonical(json);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Cursor value out of range: " + json, e);
        }
    }

    public Object toJson(Object canonical) {
        return canonical;
    }

    IllegalArgumentException unsupported(Object raw) {
        return new IllegalArgumentException(
            "Value of type " + raw.getClass().getName() + " cannot be used as a " + name() + " key");
    }
}
