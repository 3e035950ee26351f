package com.linked.auth;

import lombok.Value;

import java.time.Instant;

@Value
public class SessionClaims {
    String subject;
    Instant issuedAt;
    Instant expiresAt;
}
