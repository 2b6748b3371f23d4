package com.proxycare.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class NotFoundException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public NotFoundException(String message) {
        this(message, "NOT_FOUND", null);
    }

    public NotFoundException(String message, Map<String, Object> details) {
        this(message, "NOT_FOUND", details);
    }

    public NotFoundException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? "NOT_FOUND" : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    /**
     * "Proxy not found" with {@code entity} and {@code id} in the details.
     */
    public static NotFoundException of(String entity, Object id) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entity", entity);
        details.put("id", id);
        return new NotFoundException(entity + " not found", details);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
