package com.linked.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Guards protected routes with an ordered list of {@link AuthStrategy strategies}.
 *
 * <p>The first strategy that grants wins and the request proceeds with the subject stored under
 * {@link #SUBJECT_ATTRIBUTE}. A denial stops the chain at once. When every strategy is not
 * applicable the request is rejected: API calls get a JSON 401, page requests are sent to the
 * login page.
 */
@Slf4j
public class AuthFilter implements Filter {

    public static final String SUBJECT_ATTRIBUTE = AuthFilter.class.getName() + ".subject";

    private static final String API_PREFIX = "/api/";
    private static final String LOGIN_PAGE = "/";

    private final List<AuthStrategy> strategies;
    private final ObjectMapper objectMapper;

    public AuthFilter(List<AuthStrategy> strategies, ObjectMapper objectMapper) {
        this.strategies = List.copyOf(strategies);
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest request = (HttpServletRequest) servletRequest;
        HttpServletResponse response = (HttpServletResponse) servletResponse;

        AuthResult result = authenticate(request, response);
        if (result.isGranted()) {
            request.setAttribute(SUBJECT_ATTRIBUTE, result.getSubject());
            chain.doFilter(request, response);
            return;
        }

        log.warn("unauthorized {} {}", request.getMethod(), request.getRequestURI());
        reject(request, response);
    }

    AuthResult authenticate(HttpServletRequest request, HttpServletResponse response) {
        for (AuthStrategy strategy : strategies) {
            AuthResult result = strategy.attempt(request, response);
            if (result.getOutcome() != AuthResult.Outcome.NOT_APPLICABLE) {
                return result;
            }
        }
        return AuthResult.denied();
    }

    private void reject(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (!path.startsWith(API_PREFIX)) {
            response.setStatus(HttpStatus.TEMPORARY_REDIRECT.value());
            response.setHeader(HttpHeaders.LOCATION, request.getContextPath() + LOGIN_PAGE);
            return;
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"linked\"");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of("error", "unauthorized"));
    }
}
