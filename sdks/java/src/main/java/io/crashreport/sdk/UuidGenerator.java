package io.crashreport.sdk;

import java.util.UUID;

/** Produces event IDs: 32 hex characters without separators. */
@FunctionalInterface
public interface UuidGenerator {

    String generate();

    /** Random (version 4) UUIDs with the dashes removed. */
    static UuidGenerator randomWithoutDashes() {
        return () -> UUID.randomUUID().toString().replace("-", "");
    }
}
