package com.linked.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a single {@link AuthStrategy} attempt.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthResult {

    public enum Outcome {
        GRANTED,
        NOT_APPLICABLE,
        DENIED
    }

    private static final AuthResult NOT_APPLICABLE = new AuthResult(Outcome.NOT_APPLICABLE, null);
    private static final AuthResult DENIED = new AuthResult(Outcome.DENIED, null);

    private final Outcome outcome;

    /** Authenticated username; only set when granted. */
    private final String subject;

    public static AuthResult granted(String subject) {
        return new AuthResult(Outcome.GRANTED, subject);
    }

    public static AuthResult notApplicable() {
        return NOT_APPLICABLE;
    }

    public static AuthResult denied() {
        return DENIED;
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }
}
