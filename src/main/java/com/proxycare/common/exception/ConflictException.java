package com.proxycare.common.exception;

import java.util.Collections;
import java.util.Map;

/**
 * A compare-and-set on a proxy row lost: the proxy is still cooling down, was blocked,
 * or another caller assigned it first. Selection retries the next candidate on this.
 */
public class ConflictException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public ConflictException(String message) {
        this(message, null);
    }

    public ConflictException(String message, Map<String, Object> details) {
        super(message);
        this.errorCode = "CONFLICT";
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
