package com.linked.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class CreateLinkRequest {

    @NotBlank(message = "url is required")
    @Pattern(
            regexp = "^(http|https)://.+$",
            message = "url must be a valid URL starting with http or https"
    )
    private String url;

    // empty or absent means generate one
    @Pattern(
            regexp = "^([a-zA-Z0-9_-]{5,})?$",
            message = "slug must be at least 5 characters of letters, numbers, hyphens or underscores"
    )
    private String slug;
}
