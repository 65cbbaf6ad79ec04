package com.example.acfeed;

/**
 * A "next page" link exists but its target is not a usable URL.
 */
public class PaginationException extends FeedException {

    private final String href;

    public PaginationException(String message, String href, Throwable cause) {
        super(message, cause);
        this.href = href;
    }

    public String getHref() {
        return href;
    }
}
