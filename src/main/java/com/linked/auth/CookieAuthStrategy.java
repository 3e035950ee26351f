package com.linked.auth;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * Accepts a valid {@code auth_token} cookie and re-issues it with a renewed expiry.
 * Missing, expired or tampered cookies are not applicable, never a denial, so the next
 * strategy still gets a chance.
 */
@Slf4j
@RequiredArgsConstructor
public class CookieAuthStrategy implements AuthStrategy {

    private final Authenticator authenticator;

    @Override
    public AuthResult attempt(HttpServletRequest request, HttpServletResponse response) {
        Cookie cookie = WebUtils.getCookie(request, Authenticator.COOKIE_NAME);
        if (cookie == null || !StringUtils.hasText(cookie.getValue())) {
            return AuthResult.notApplicable();
        }

        AuthenticatedSession session;
        try {
            session = authenticator.validateAndRefresh(cookie.getValue(), request.isSecure());
        } catch (InvalidTokenException e) {
            log.debug("ignoring session cookie: {}", e.getReason());
            return AuthResult.notApplicable();
        }

        response.addHeader(HttpHeaders.SET_COOKIE, session.getCookie().toString());
        return AuthResult.granted(session.getSubject());
    }
}
