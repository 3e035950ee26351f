package com.linked.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * One way of establishing who is calling. Strategies may write cookies to the response but
 * must not commit it.
 */
public interface AuthStrategy {

    /**
     * Returns {@link AuthResult#notApplicable()} when the request carries nothing this strategy
     * understands or what it carries does not check out, so later strategies still run. Return
     * {@link AuthResult#denied()} only to refuse the request outright, for example a credential
     * known to be revoked; the cookie and basic-auth strategies never do.
     */
    AuthResult attempt(HttpServletRequest request, HttpServletResponse response);
}
