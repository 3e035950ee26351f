package com.linked.controller;

import com.linked.auth.AuthenticatedSession;
import com.linked.auth.Authenticator;
import com.linked.auth.Credentials;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
public class AuthController {

    @Autowired
    private Authenticator authenticator;

    @PostMapping("/login")
    public ResponseEntity<Void> login(@RequestBody Credentials credentials, HttpServletRequest request) {
        AuthenticatedSession session = authenticator.authenticate(credentials, request.isSecure());
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, session.getCookie().toString())
                .build();
    }

    @GetMapping("/logout")
    public ResponseEntity<Void> logout() {
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.SET_COOKIE, Authenticator.expiredCookie().toString())
                .location(URI.create("/"))
                .build();
    }
}
