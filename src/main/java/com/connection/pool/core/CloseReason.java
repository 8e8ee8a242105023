package com.connection.pool.core;

/**
 * Why the pool closed or discarded a connection.
 */
public enum CloseReason {
    /** Found dead when taken from the idle set. */
    DEAD,
    /** Older than the stale timeout. */
    STALE,
    /** The backend refused to reuse it on checkin. */
    REFUSED,
    /** Discarded by the caller through {@link ConnectionPool#manualClose}. */
    MANUAL,
    /** Closed by {@link ConnectionPool#closeIdle()}. */
    IDLE,
    /** Checked out for too long and reclaimed by {@link ConnectionPool#closeStale}. */
    LEAKED,
    /** Closed by {@link ConnectionPool#closeAll()}. */
    SHUTDOWN
}
