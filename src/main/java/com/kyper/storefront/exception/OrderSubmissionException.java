package com.kyper.storefront.exception;

/**
 * Base class for failures that happen once the order transaction has been opened
 * (or while trying to open it). The transaction is always rolled back and the
 * connection returned to the pool before one of these reaches the caller.
 *
 * @author Storefront Team
 */
public abstract class OrderSubmissionException extends RuntimeException {

    protected OrderSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable code used for metrics tags and error details.
     *
     * @return failure reason code
     */
    public abstract String getReason();
}
