package com.proxycare.pool.application.health;

public enum BlockReason {
    HEALTHY,
    TRANSPORT_FAILURE,
    REPEATED_FAILURES,
    FAILURE_RATIO
}
