package com.linked.auth;

public class InvalidTokenException extends RuntimeException {

    public enum Reason {
        INVALID_SIGNATURE,
        EXPIRED,
        MALFORMED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, Throwable cause) {
        super("invalid session token: " + reason.name().toLowerCase(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
