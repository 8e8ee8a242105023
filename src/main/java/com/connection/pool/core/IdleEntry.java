package com.connection.pool.core;

import java.time.Instant;
import java.util.Comparator;

/**
 * A handle waiting in the idle registry.
 *
 * @param returnedAt when the handle was returned (or created), minus a sub-millisecond jitter
 * @param handle     the idle handle
 */
record IdleEntry(Instant returnedAt, ConnectionHandle handle) {

    /**
     * Oldest-returned first; the handle id only breaks exact ties.
     */
    static final Comparator<IdleEntry> OLDEST_FIRST = Comparator
            .comparing(IdleEntry::returnedAt)
            .thenComparingLong(entry -> entry.handle().id());
}
