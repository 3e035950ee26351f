package com.linked.auth;

public class MalformedCredentialsException extends RuntimeException {

    public MalformedCredentialsException() {
        super("credentials must be in the form user:pass");
    }
}
