package com.example.acfeed;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class UrlUtils {

    /**
     * Parses an absolute URL. Relative references are rejected, as are strings {@link URI} refuses.
     */
    public static URI parseAbsolute(String url) throws URISyntaxException {
        if (url == null) throw new URISyntaxException("null", "URL is missing");
        URI uri = new URI(url.trim());
        if (!uri.isAbsolute()) {
            throw new URISyntaxException(url, "URL has no scheme");
        }
        return uri;
    }

    /**
     * Resolves a link target against the page it was found on, the way a browser does: a query-only
     * href such as {@code ?p=2} keeps the base path. Absolute hrefs are returned unchanged.
     */
    public static URI resolve(URI base, String href) throws URISyntaxException {
        if (href == null || href.isBlank()) {
            throw new URISyntaxException(String.valueOf(href), "Empty link target");
        }
        URI target = new URI(href.trim());
        if (target.isAbsolute()) return target;
        if (base.isOpaque()) {
            throw new URISyntaxException(href, "Cannot resolve against opaque URL " + base);
        }
        String resolved = StringUtil.resolve(base.toString(), target.toString());
        if (resolved.isEmpty()) {
            throw new URISyntaxException(href, "Cannot resolve against " + base);
        }
        return new URI(resolved);
    }

    public static boolean isSameSite(URI a, URI b) {
        String ha = a.getHost() != null ? a.getHost().toLowerCase(Locale.ROOT) : "";
        String hb = b.getHost() != null ? b.getHost().toLowerCase(Locale.ROOT) : "";
        return !ha.isEmpty() && ha.equals(hb);
    }
}
