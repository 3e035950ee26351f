package com.linked.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Scheme and authority the client used to reach us, for building absolute short URLs.
 */
public final class RequestOrigin {

    private RequestOrigin() {}

    public static String of(HttpServletRequest request) {
        String scheme = request.isSecure() ? "https" : "http";
        String forwardedProto = request.getHeader("X-Forwarded-Proto");
        if (StringUtils.hasText(forwardedProto)) {
            scheme = forwardedProto.trim();
        }

        String host = request.getHeader(HttpHeaders.HOST);
        if (!StringUtils.hasText(host)) {
            host = request.getServerName();
            int port = request.getServerPort();
            if (port > 0 && port != 80 && port != 443) {
                host = host + ":" + port;
            }
        }
        return scheme + "://" + host;
    }
}
