package com.connection.pool.core;

import java.time.Instant;

/**
 * Checkout metadata for a handle in the in-use registry.
 *
 * @param createdAt    connect time for a new handle, or the idle timestamp it was taken with;
 *                     used for staleness on checkin
 * @param handle       the checked-out handle
 * @param checkedOutAt time of this checkout; used by {@link ConnectionPool#closeStale}
 */
record InUseEntry(Instant createdAt, ConnectionHandle handle, Instant checkedOutAt) {
}
