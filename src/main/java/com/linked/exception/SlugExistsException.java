package com.linked.exception;

public class SlugExistsException extends RuntimeException {

    private final String slug;

    public SlugExistsException(String slug, Throwable cause) {
        super("slug already exists", cause);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
