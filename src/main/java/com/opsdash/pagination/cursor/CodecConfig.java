package com.opsdash.pagination.cursor;

import com.opsdash.pagination.PaginationConfigurationException;

import java.time.Clock;
import java.time.Duration;

/**
 * Immutable settings for {@link CursorCodec}. Built once at startup and handed to the codec.
 */
public record CodecConfig(String secret, Duration ttl, Clock clock) {

    public static final int MIN_SECRET_LENGTH = 32;
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    public CodecConfig {
        if (secret == null || secret.isBlank()) {
            throw new PaginationConfigurationException("Cursor encryption secret is not configured");
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new PaginationConfigurationException(
                "Cursor encryption secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new PaginationConfigurationException("Cursor TTL must be positive");
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
    }

    public static CodecConfig of(String secret) {
        return new CodecConfig(secret, DEFAULT_TTL, Clock.systemUTC());
    }

    // Keep the secret out of logs and actuator dumps.
    @Override
    public String toString() {
        return "CodecConfig[ttl=" + ttl + ", clock=" + clock + "]";
    }
}
