package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing API call.
 *
 * {@code details} is omitted when empty. Known keys:
 * - fieldErrors: wire field name to message, for 400 validation failures
 * - reason: order failure code (INSUFFICIENT_STOCK, CONSTRAINT_VIOLATION,
 *   POOL_EXHAUSTED or INFRASTRUCTURE)
 *
 * @author Storefront Team
 */
public class ErrorResponse {

    private Instant timestamp;
    private Integer status;
    private String error;
    private String message;
    private String path;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse() {
        this.timestamp = Instant.now();
    }

    private ErrorResponse(HttpStatus status, String error, String message, String path) {
        this();
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path);
    }

    /**
     * Attach per-field validation messages, keeping their order.
     */
    public ErrorResponse withFieldErrors(Map<String, String> fieldErrors) {
        this.details.put("fieldErrors", new LinkedHashMap<>(fieldErrors));
        return this;
    }

    public ErrorResponse withReason(String reason) {
        this.details.put("reason", reason);
        return this;
    }

    public ErrorResponse withDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Integer getStatus() {
        return status;
    }

    public void setStatus(Integer status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }
}
