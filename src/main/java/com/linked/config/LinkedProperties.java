package com.linked.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Process-wide settings, bound once at start-up from {@code linked.*} properties
 * (which fall back to the {@code DB_PATH}, {@code ADMIN_CREDENTIALS} and {@code JWT_SECRET}
 * environment variables, see {@code application.properties}).
 */
@Data
@ConfigurationProperties(prefix = "linked")
public class LinkedProperties {

    private String dbPath = "linked.db";

    /** {@code user:pass}; blank means the built-in development pair. */
    private String adminCredentials;

    /** Blank means the admin credentials string doubles as the signing secret. */
    private String jwtSecret;

    private Duration sessionTtl = Duration.ofDays(30);
}
