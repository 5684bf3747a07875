package com.payguard.agent.error;

/**
 * Failure taxonomy for engine operations.
 * Every kind is recoverable by retrying at the next verification cycle.
 */
public enum ErrorKind {
    /** A sensor or platform field could not be read; the snapshot degrades to partial. */
    COLLECTION_ERROR,
    /** No baseline to compare against; classified as NONE but reported separately. */
    COMPARISON_INCONCLUSIVE,
    /** Backend unreachable or answered with a non-success status. */
    NETWORK_FAILURE,
    /** A platform privilege call (lock, feature disable, wipe) failed or timed out. */
    PRIVILEGE_ACTION_FAILURE,
    /** The state store could not be read or written. */
    PERSISTENCE_FAILURE,
    /** The requested operation is not valid for the current state. */
    INVALID_STATE
}
