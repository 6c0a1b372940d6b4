package com.opsdash.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 * Implementations must be time-ordered (UUIDv7) so ids break ties in time order.
 */
public interface IdGenerator {

    UUID generate();
}
