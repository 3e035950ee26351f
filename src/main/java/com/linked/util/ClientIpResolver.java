package com.linked.util;

import com.google.common.net.InetAddresses;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Picks the visitor address recorded with a click: {@code X-Forwarded-For} (its first hop),
 * then {@code X-Real-IP}, then the socket peer. A header only counts if it holds a literal IP;
 * nothing here does a DNS lookup.
 */
public final class ClientIpResolver {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";

    private ClientIpResolver() {}

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(X_FORWARDED_FOR);
        if (forwarded != null) {
            String first = forwarded.split(",", 2)[0].trim();
            if (InetAddresses.isInetAddress(first)) {
                return first;
            }
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (realIp != null && InetAddresses.isInetAddress(realIp.trim())) {
            return realIp.trim();
        }

        return request.getRemoteAddr();
    }
}
