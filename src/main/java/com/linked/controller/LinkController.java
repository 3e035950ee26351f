package com.linked.controller;

import com.linked.model.CreateLinkRequest;
import com.linked.model.CreateLinkResponse;
import com.linked.model.Link;
import com.linked.model.LinkResponse;
import com.linked.model.ListLinksResponse;
import com.linked.service.LinkService;
import com.linked.util.RequestOrigin;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/links")
public class LinkController {

    @Autowired
    private LinkService linkService;

    @PostMapping
    public ResponseEntity<CreateLinkResponse> createLink(@Valid @RequestBody CreateLinkRequest request,
                                                         HttpServletRequest servletRequest) {
        Link link = linkService.createLink(request.getSlug(), request.getUrl());
        LinkResponse body = LinkResponse.from(link, RequestOrigin.of(servletRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateLinkResponse(body));
    }

    @GetMapping
    public ResponseEntity<ListLinksResponse> listLinks(HttpServletRequest servletRequest) {
        String origin = RequestOrigin.of(servletRequest);
        List<LinkResponse> links = linkService.listLinks().stream()
                .map(link -> LinkResponse.from(link, origin))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new ListLinksResponse(links));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteLink(@PathVariable long id) {
        linkService.deleteLink(id);
        return ResponseEntity.noContent().build();
    }
}
