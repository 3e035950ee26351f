package com.linked.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linked.util.TimeFormats;
import lombok.Data;

@Data
public class LinkResponse {

    private long id;
    private String slug;
    private String url;

    @JsonProperty("short_url")
    private String shortUrl;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Stats stats;

    @Data
    public static class Stats {
        private long clicks;

        @JsonProperty("last_clicked_at")
        private String lastClickedAt;
    }

    public static LinkResponse from(Link link, String origin) {
        LinkResponse response = new LinkResponse();
        response.setId(link.getId());
        response.setSlug(link.getSlug());
        response.setUrl(link.getUrl());
        response.setShortUrl(origin + "/" + link.getSlug());
        response.setCreatedAt(TimeFormats.toWire(link.getCreatedAt()));
        if (link.getStats() != null) {
            Stats stats = new Stats();
            stats.setClicks(link.getStats().getTotalClicks());
            stats.setLastClickedAt(TimeFormats.toWire(link.getStats().getLastClickedAt()));
            response.setStats(stats);
        }
        return response;
    }
}
