package com.linked.service;

import com.linked.exception.NotFoundException;
import com.linked.exception.ValidationException;
import com.linked.model.Link;
import com.linked.repo.ClickRepository;
import com.linked.repo.LinkRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class LinkService {

    /** Paths served by literal routes; a link under one of these could never be reached. */
    static final Set<String> RESERVED_SLUGS = Set.of("login", "logout", "health", "dashboard");

    private static final int MAX_RESOLVE_ATTEMPTS = 3;

    private final LinkRepository linkRepository;
    private final ClickRepository clickRepository;
    private final LinkCacheService linkCacheService;

    public LinkService(LinkRepository linkRepository,
                       ClickRepository clickRepository,
                       LinkCacheService linkCacheService) {
        this.linkRepository = linkRepository;
        this.clickRepository = clickRepository;
        this.linkCacheService = linkCacheService;
    }

    public Link createLink(String slug, String url) {
        if (!StringUtils.hasText(url)) {
            throw new ValidationException("url is required");
        }
        if (slug != null && RESERVED_SLUGS.contains(slug)) {
            throw new ValidationException("slug is reserved");
        }
        Link link = linkRepository.create(slug, url);
        log.info("created link {} -> {}", link.getSlug(), link.getUrl());
        return link;
    }

    public List<Link> listLinks() {
        return linkRepository.listAll();
    }

    public void deleteLink(long id) {
        linkRepository.delete(id);
        linkCacheService.evictAll();
        log.info("deleted link {}", id);
    }

    public Link resolve(String slug) {
        for (int attempt = 0; attempt < MAX_RESOLVE_ATTEMPTS; attempt++) {
            long generation = linkCacheService.getGeneration();
            Link link = linkCacheService.getBySlug(slug);
            if (linkCacheService.getGeneration() == generation) {
                if (link == null) {
                    throw new NotFoundException("link not found");
                }
                return link;
            }
            // a delete finished during the lookup, so what was just cached may be gone
            linkCacheService.evict(slug);
        }
        return linkRepository.findBySlug(slug)
                .orElseThrow(() -> new NotFoundException("link not found"));
    }

    /**
     * Best effort: a failed write is logged and dropped so the redirect still goes out.
     */
    public void recordClick(Link link, String userAgent, String ipAddress) {
        try {
            clickRepository.record(link.getId(), userAgent, ipAddress);
        } catch (RuntimeException e) {
            log.error("failed to record click for {}", link.getSlug(), e);
        }
    }
}
