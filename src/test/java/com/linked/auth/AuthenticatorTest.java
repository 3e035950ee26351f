package com.linked.auth;

import com.linked.MutableClock;
import com.linked.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticatorTest {

    private static final Instant START = Instant.parse("2026-01-10T08:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final TokenService tokenService = new TokenService("secret", Duration.ofDays(30), clock);
    private final Authenticator authenticator =
            new Authenticator(new CredentialVerifier(new Credentials("admin", "pw")), tokenService);

    @Test
    void validCredentialsProduceSessionCookie() {
        AuthenticatedSession session = authenticator.authenticate(new Credentials("admin", "pw"), false);

        ResponseCookie cookie = session.getCookie();
        assertEquals("admin", session.getSubject());
        assertEquals(Authenticator.COOKIE_NAME, cookie.getName());
        assertTrue(cookie.isHttpOnly());
        assertFalse(cookie.isSecure());
        assertEquals("Lax", cookie.getSameSite());
        assertEquals(Duration.ofDays(30), cookie.getMaxAge());
        assertEquals("admin", tokenService.verify(cookie.getValue()).getSubject());
    }

    @Test
    void cookieIsSecureOnlyOverEncryptedConnection() {
        AuthenticatedSession session = authenticator.authenticate(new Credentials("admin", "pw"), true);

        assertTrue(session.getCookie().isSecure());
    }

    @Test
    void wrongUserAndWrongPasswordFailTheSameWay() {
        UnauthorizedException badUser = assertThrows(UnauthorizedException.class,
                () -> authenticator.authenticate(new Credentials("root", "pw"), false));
        UnauthorizedException badPassword = assertThrows(UnauthorizedException.class,
                () -> authenticator.authenticate(new Credentials("admin", "nope"), false));

        assertEquals(badUser.getMessage(), badPassword.getMessage());
    }

    @Test
    void validateAndRefreshSlidesTheExpiry() {
        String token = authenticator.authenticate(new Credentials("admin", "pw"), false).getCookie().getValue();
        clock.advance(Duration.ofDays(20));

        AuthenticatedSession refreshed = authenticator.validateAndRefresh(token, false);

        assertEquals("admin", refreshed.getSubject());
        SessionClaims claims = tokenService.verify(refreshed.getCookie().getValue());
        assertEquals(START.plus(Duration.ofDays(50)), claims.getExpiresAt());
    }

    @Test
    void abandonedSessionExpires() {
        String token = authenticator.authenticate(new Credentials("admin", "pw"), false).getCookie().getValue();
        clock.advance(Duration.ofDays(31));

        InvalidTokenException e = assertThrows(InvalidTokenException.class,
                () -> authenticator.validateAndRefresh(token, false));
        assertEquals(InvalidTokenException.Reason.EXPIRED, e.getReason());
    }

    @Test
    void expiredCookieClearsTheSession() {
        ResponseCookie cookie = Authenticator.expiredCookie();

        assertEquals(Authenticator.COOKIE_NAME, cookie.getName());
        assertEquals("", cookie.getValue());
        assertEquals(Duration.ZERO, cookie.getMaxAge());
    }
}
