package com.linked.model;

import lombok.Value;

import java.time.Instant;

/**
 * Click aggregate for one link, computed on demand. A link nobody clicked has
 * {@code totalClicks == 0} and a {@code null} {@code lastClickedAt}.
 */
@Value
public class LinkStats {
    long totalClicks;
    Instant lastClickedAt;
}
