package com.linked.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linked.auth.AuthFilter;
import com.linked.auth.Authenticator;
import com.linked.auth.BasicAuthStrategy;
import com.linked.auth.CookieAuthStrategy;
import com.linked.auth.CredentialVerifier;
import com.linked.auth.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class AuthConfiguration {

    static final String DEFAULT_ADMIN_CREDENTIALS = "admin:admin";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialVerifier credentialVerifier(LinkedProperties properties) {
        if (!StringUtils.hasText(properties.getAdminCredentials())) {
            log.warn("using default admin credentials - set ADMIN_CREDENTIALS for production");
        }
        return new CredentialVerifier(CredentialVerifier.parse(adminCredentials(properties)));
    }

    @Bean
    public TokenService tokenService(LinkedProperties properties, Clock clock) {
        String secret = properties.getJwtSecret();
        if (!StringUtils.hasText(secret)) {
            log.warn("using ADMIN_CREDENTIALS as JWT_SECRET - set JWT_SECRET for production");
            secret = adminCredentials(properties);
        }
        return new TokenService(secret, properties.getSessionTtl(), clock);
    }

    @Bean
    public Authenticator authenticator(CredentialVerifier credentialVerifier, TokenService tokenService) {
        return new Authenticator(credentialVerifier, tokenService);
    }

    /**
     * Cookie first so a browser session never pays for a credential check; basic auth second so
     * scripts and clients holding a stale cookie still get in.
     */
    @Bean
    public FilterRegistrationBean<AuthFilter> authFilter(Authenticator authenticator, ObjectMapper objectMapper) {
        AuthFilter filter = new AuthFilter(
                List.of(new CookieAuthStrategy(authenticator), new BasicAuthStrategy(authenticator)),
                objectMapper);

        FilterRegistrationBean<AuthFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(filter);
        registration.addUrlPatterns("/api/*", "/dashboard");
        registration.setOrder(0);
        return registration;
    }

    private static String adminCredentials(LinkedProperties properties) {
        return StringUtils.hasText(properties.getAdminCredentials())
                ? properties.getAdminCredentials()
                : DEFAULT_ADMIN_CREDENTIALS;
    }
}
