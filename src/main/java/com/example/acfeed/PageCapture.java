package com.example.acfeed;

import java.net.URI;

/**
 * One rendered listing page as it is written to disk. {@code fileName} is always
 * {@link PageNamer#nameFor(URI)} of {@code sourceUrl}.
 */
public final class PageCapture {

    private final URI sourceUrl;
    private final String fileName;
    private final byte[] rawBytes;

    public PageCapture(URI sourceUrl, String fileName, byte[] rawBytes) {
        this.sourceUrl = sourceUrl;
        this.fileName = fileName;
        this.rawBytes = rawBytes;
    }

    public URI getSourceUrl() {
        return sourceUrl;
    }

    public String getFileName() {
        return fileName;
    }

    public byte[] getRawBytes() {
        return rawBytes;
    }
}
