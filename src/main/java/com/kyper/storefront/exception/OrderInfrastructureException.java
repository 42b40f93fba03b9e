package com.kyper.storefront.exception;

/**
 * Exception thrown for connection loss, statement or commit failure, and
 * transaction timeout. Opaque to the client; not retried here.
 *
 * @author Storefront Team
 */
public class OrderInfrastructureException extends OrderSubmissionException {

    public OrderInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return "INFRASTRUCTURE";
    }
}
