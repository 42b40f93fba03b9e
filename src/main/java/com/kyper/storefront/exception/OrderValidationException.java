package com.kyper.storefront.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when an order payload is malformed or incomplete.
 * Raised before any database interaction: no connection is acquired.
 *
 * @author Storefront Team
 */
public class OrderValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public OrderValidationException(Map<String, String> fieldErrors) {
        super("Invalid order: " + fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public OrderValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
