package com.example.acfeed;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a crawl that reached the last listing page.
 */
public final class CrawlReport {

    private final int visitedPages;
    private final List<Path> savedCaptures;
    private final List<URI> skippedPages;

    /**
     * @param visitedPages  pages the browser navigated to
     * @param savedCaptures capture files written, in pagination order
     * @param skippedPages  visited pages whose URL could not be turned into a file name
     */
    public CrawlReport(int visitedPages, List<Path> savedCaptures, List<URI> skippedPages) {
        this.visitedPages = visitedPages;
        this.savedCaptures = List.copyOf(savedCaptures);
        this.skippedPages = List.copyOf(skippedPages);
    }

    public int getVisitedPages() {
        return visitedPages;
    }

    public List<Path> getSavedCaptures() {
        return savedCaptures;
    }

    public List<URI> getSkippedPages() {
        return skippedPages;
    }
}
