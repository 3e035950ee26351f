package com.linked.service;

import com.linked.model.Link;
import com.linked.repo.LinkRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Slug lookups for the redirect path. Misses are not cached, so a slug created after a failed
 * lookup resolves straight away.
 *
 * <p>{@link #getGeneration()} moves on every {@link #evictAll()}, before the cache is cleared. A
 * caller that sees it change across a lookup knows a delete may have raced the cache put.
 */
@Service
public class LinkCacheService {

    public static final String CACHE_NAME = "linksBySlug";

    @Autowired
    private LinkRepository linkRepository;

    private final AtomicLong generation = new AtomicLong();

    @Cacheable(
            value = CACHE_NAME,
            key = "#slug",
            unless = "#result == null"
    )
    public Link getBySlug(String slug) {
        return linkRepository.findBySlug(slug).orElse(null);
    }

    // links are only looked up by slug here, and a delete only knows the id
    @CacheEvict(value = CACHE_NAME, allEntries = true)
    public void evictAll() {
        generation.incrementAndGet();
    }

    @CacheEvict(value = CACHE_NAME, key = "#slug")
    public void evict(String slug) {
    }

    public long getGeneration() {
        return generation.get();
    }
}
