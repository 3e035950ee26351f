package com.linked.controller;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Login page, dashboard (behind the auth filter) and health check.
 */
@RestController
public class PageController {

    private static final Resource LOGIN_PAGE = new ClassPathResource("web/login.html");
    private static final Resource DASHBOARD_PAGE = new ClassPathResource("web/index.html");

    @GetMapping("/")
    public ResponseEntity<Resource> loginPage() {
        return html(LOGIN_PAGE);
    }

    @GetMapping("/dashboard")
    public ResponseEntity<Resource> dashboard() {
        return html(DASHBOARD_PAGE);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    private static ResponseEntity<Resource> html(Resource page) {
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(page);
    }
}
