package com.kyper.storefront.exception;

/**
 * Exception thrown when registering with an email that is already in use.
 *
 * @author Storefront Team
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException() {
        super("Email already exists");
    }

    public DuplicateEmailException(Throwable cause) {
        super("Email already exists", cause);
    }
}
