package com.proxycare.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

@Getter
public class PoolFailureException extends RuntimeException {

    private final PoolFailureReason reason;
    private final String errorCode;
    private final Map<String, Object> details;

    public PoolFailureException(String message, PoolFailureReason reason, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null) ? PoolFailureReason.UNAVAILABLE : reason;
        this.errorCode = this.reason.name();
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public PoolFailureException(String message, PoolFailureReason reason, Map<String, Object> details) {
        this(message, reason, details, null);
    }

    public PoolFailureException(String message, PoolFailureReason reason) {
        this(message, reason, null, null);
    }

    public boolean isRetryable() {
        return reason != PoolFailureReason.UNKNOWN_STATUS;
    }
}
