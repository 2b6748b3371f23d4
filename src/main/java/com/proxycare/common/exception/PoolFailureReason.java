package com.proxycare.common.exception;

public enum PoolFailureReason {
    /** No eligible proxy right now. Callers retry later. */
    EXHAUSTED,
    /** Reported status code is not in the catalog. */
    UNKNOWN_STATUS,
    /** The backing store could not be reached. */
    UNAVAILABLE
}
