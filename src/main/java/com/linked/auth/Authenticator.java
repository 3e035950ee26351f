package com.linked.auth;

import com.linked.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;

/**
 * Turns credentials into session cookies and session cookies back into identities.
 *
 * <p>Sessions slide: every successful {@link #validateAndRefresh} re-signs the token with a fresh
 * expiry window, so a session only lapses after a full TTL without use.
 */
@Slf4j
public class Authenticator {

    public static final String COOKIE_NAME = "auth_token";

    private final CredentialVerifier credentialVerifier;
    private final TokenService tokenService;

    public Authenticator(CredentialVerifier credentialVerifier, TokenService tokenService) {
        this.credentialVerifier = credentialVerifier;
        this.tokenService = tokenService;
    }

    /**
     * @param secure whether the inbound connection is itself encrypted; the cookie is never forced
     *               to {@code Secure} over plain HTTP
     * @throws UnauthorizedException on any mismatch, without saying which field was wrong
     */
    public AuthenticatedSession authenticate(Credentials credentials, boolean secure) {
        if (!credentialVerifier.check(credentials)) {
            log.debug("credential check failed");
            throw new UnauthorizedException();
        }
        String subject = credentials.getUsername();
        return new AuthenticatedSession(subject, sessionCookie(tokenService.sign(subject), secure));
    }

    /**
     * @throws InvalidTokenException unchanged from {@link TokenService#verify}; nothing is refreshed
     */
    public AuthenticatedSession validateAndRefresh(String token, boolean secure) {
        SessionClaims claims = tokenService.verify(token);
        String refreshed = tokenService.sign(claims.getSubject());
        return new AuthenticatedSession(claims.getSubject(), sessionCookie(refreshed, secure));
    }

    public ResponseCookie sessionCookie(String token, boolean secure) {
        return ResponseCookie.from(COOKIE_NAME, token)
                .path("/")
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .maxAge(tokenService.getTtl())
                .build();
    }

    public static ResponseCookie expiredCookie() {
        return ResponseCookie.from(COOKIE_NAME, "")
                .path("/")
                .httpOnly(true)
                .sameSite("Lax")
                .maxAge(0)
                .build();
    }
}
