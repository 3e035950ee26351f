package com.linked.model;

import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
public class Link {
    long id;
    String slug;
    String url;
    Instant createdAt;

    /** Only populated by listings; {@code null} otherwise. */
    @With
    LinkStats stats;
}
