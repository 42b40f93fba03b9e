package com.kyper.storefront.exception;

/**
 * Exception thrown when no database connection became available within the
 * pool's acquisition timeout. Transient: the caller may retry with backoff.
 *
 * @author Storefront Team
 */
public class PoolExhaustedException extends OrderSubmissionException {

    public PoolExhaustedException(Throwable cause) {
        super("No database connection available", cause);
    }

    @Override
    public String getReason() {
        return "POOL_EXHAUSTED";
    }
}
