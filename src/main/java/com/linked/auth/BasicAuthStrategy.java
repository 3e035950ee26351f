package com.linked.auth;

import com.linked.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Accepts {@code Authorization: Basic} credentials and issues a fresh session cookie so later
 * requests can take the cookie path.
 */
@Slf4j
@RequiredArgsConstructor
public class BasicAuthStrategy implements AuthStrategy {

    private static final String PREFIX = "Basic ";

    private final Authenticator authenticator;

    @Override
    public AuthResult attempt(HttpServletRequest request, HttpServletResponse response) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return AuthResult.notApplicable();
        }

        Credentials credentials;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.substring(PREFIX.length()).trim());
            credentials = CredentialVerifier.parse(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | MalformedCredentialsException e) {
            log.debug("unreadable basic auth header");
            return AuthResult.notApplicable();
        }

        AuthenticatedSession session;
        try {
            session = authenticator.authenticate(credentials, request.isSecure());
        } catch (UnauthorizedException e) {
            return AuthResult.notApplicable();
        }

        response.addHeader(HttpHeaders.SET_COOKIE, session.getCookie().toString());
        return AuthResult.granted(session.getSubject());
    }
}
