package com.linked.exception;

/**
 * Raised for any credential or token mismatch. The message never says which part was wrong.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException() {
        super("unauthorized");
    }
}
