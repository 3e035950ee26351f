package com.linked.controller;

import com.linked.model.Link;
import com.linked.service.LinkService;
import com.linked.util.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public redirect route. Literal routes ({@code /health}, {@code /login}, ...) take precedence
 * over this pattern.
 */
@Slf4j
@RestController
public class RedirectController {

    @Autowired
    private LinkService linkService;

    @GetMapping("/{slug}")
    public ResponseEntity<Void> redirect(@PathVariable String slug, HttpServletRequest request) {
        Link link = linkService.resolve(slug);

        String ipAddress = ClientIpResolver.resolve(request);
        log.info("redirecting {} for {}", slug, ipAddress);
        linkService.recordClick(link, request.getHeader(HttpHeaders.USER_AGENT), ipAddress);

        // stored URLs may hold characters java.net.URI rejects (|, ^, spaces), so pass the text through
        return ResponseEntity.status(HttpStatus.PERMANENT_REDIRECT)
                .header(HttpHeaders.LOCATION, link.getUrl())
                .build();
    }
}
