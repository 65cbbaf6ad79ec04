package com.example.acfeed;

import java.net.URI;

public class PageNamingException extends FeedException {

    public enum Reason {
        /** The URL has no scheme/host/port tuple (data:, mailto:, file: ...). */
        OPAQUE_ORIGIN
    }

    private final URI url;
    private final Reason reason;

    public PageNamingException(URI url, Reason reason, String message) {
        super(message);
        this.url = url;
        this.reason = reason;
    }

    public URI getUrl() {
        return url;
    }

    public Reason getReason() {
        return reason;
    }
}
