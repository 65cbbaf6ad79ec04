package com.example.acfeed;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory browser: serves fixed HTML per URL and answers selectors with jsoup.
 */
class FakeBrowserSession implements BrowserSession {

    private final Map<String, String> pages = new LinkedHashMap<>();
    private final Map<String, String> redirects = new LinkedHashMap<>();
    final List<String> visited = new ArrayList<>();
    int opened;
    boolean closed;

    private String currentUrl;
    private String currentHtml;
    private Document currentDocument;

    FakeBrowserSession page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    /** Navigating to {@code from} ends up on {@code to}, as after an HTTP redirect. */
    FakeBrowserSession redirect(String from, String to) {
        redirects.put(from, to);
        return this;
    }

    BrowserSessionFactory factory() {
        return () -> {
            opened++;
            return this;
        };
    }

    static String listingPage(String nextHref, String body) {
        String next = nextHref == null ? "" : "<link rel=\"next\" href=\"" + nextHref + "\">";
        return "<html><head><title>Listing</title>" + next + "</head><body>" + body + "</body></html>";
    }

    @Override
    public void navigate(String url) throws NavigationException {
        visited.add(url);
        String landed = redirects.getOrDefault(url, url);
        String html = pages.get(landed);
        if (html == null) {
            throw new NavigationException("Failed to navigate to " + url,
                    new IllegalStateException("net::ERR_NAME_NOT_RESOLVED"));
        }
        currentUrl = landed;
        currentHtml = html;
        currentDocument = Jsoup.parse(html, landed);
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public byte[] currentSource() {
        return currentHtml.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<SessionElement> findSingle(String cssSelector) {
        Element e = currentDocument.selectFirst(cssSelector);
        if (e == null) return Optional.empty();
        return Optional.of(name -> e.hasAttr(name) ? Optional.of(e.attr(name)) : Optional.empty());
    }

    @Override
    public void close() {
        closed = true;
    }
}
