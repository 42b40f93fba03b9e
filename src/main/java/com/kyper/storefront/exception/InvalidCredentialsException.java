package com.kyper.storefront.exception;

/**
 * Exception thrown when a login email/password pair does not match.
 *
 * @author Storefront Team
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
