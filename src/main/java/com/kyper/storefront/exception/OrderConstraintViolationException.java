package com.kyper.storefront.exception;

/**
 * Exception thrown when the database rejects the order because it references
 * something that does not exist (unknown user or product) or violates a
 * constraint. Client-correctable; nothing of the order was persisted.
 *
 * @author Storefront Team
 */
public class OrderConstraintViolationException extends OrderSubmissionException {

    public OrderConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public OrderConstraintViolationException(String message) {
        super(message, null);
    }

    @Override
    public String getReason() {
        return "CONSTRAINT_VIOLATION";
    }
}
