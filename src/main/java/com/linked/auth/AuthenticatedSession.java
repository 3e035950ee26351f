package com.linked.auth;

import lombok.Value;
import org.springframework.http.ResponseCookie;

/**
 * Identity established for a request plus the cookie that should be written back to the client.
 */
@Value
public class AuthenticatedSession {
    String subject;
    ResponseCookie cookie;
}
