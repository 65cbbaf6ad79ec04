package com.example.acfeed;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a page URL into an HTML file name that keeps as much of the URL as possible readable on disk.
 *
 * <p>Layout: {@code <scheme>__<host>__<port>_<path>[__<query>].html}, where every {@code /} in the path
 * becomes {@code _slash_}, every {@code =} in the query becomes {@code _eq_} and every {@code &}
 * becomes {@code _}. The same URL always yields the same name. Different URLs may escape to the same
 * name (e.g. {@code ?a_eq_b} and {@code ?a=b}); no hashing is added to prevent it.
 */
public final class PageNamer {

    static final String SLASH = "_slash_";
    static final String EQUALS = "_eq_";
    static final String AMPERSAND = "_";
    static final String SUFFIX = ".html";

    // schemes with a (scheme, host, port) origin and their implied ports
    private static final Map<String, Integer> DEFAULT_PORTS = Map.of(
            "http", 80,
            "https", 443,
            "ws", 80,
            "wss", 443,
            "ftp", 21
    );

    private PageNamer() {
    }

    public static String nameFor(URI url) throws PageNamingException {
        if (url.isOpaque() || url.getScheme() == null || url.getHost() == null) {
            throw new PageNamingException(url, PageNamingException.Reason.OPAQUE_ORIGIN,
                    "Cannot split " + url + " into scheme, host and port. The origin is opaque.");
        }

        String scheme = url.getScheme().toLowerCase(Locale.ROOT);
        Integer defaultPort = DEFAULT_PORTS.get(scheme);
        if (defaultPort == null) {
            throw new PageNamingException(url, PageNamingException.Reason.OPAQUE_ORIGIN,
                    "Scheme '" + scheme + "' has no tuple origin: " + url);
        }

        String host = url.getHost().toLowerCase(Locale.ROOT);
        int port = url.getPort() >= 0 ? url.getPort() : defaultPort;

        String rawPath = url.getRawPath();
        if (rawPath == null || rawPath.isEmpty()) rawPath = "/";
        String path = rawPath.replace("/", SLASH);

        String rawQuery = url.getRawQuery();
        if (rawQuery == null) {
            return scheme + "__" + host + "__" + port + "_" + path + SUFFIX;
        }
        String query = rawQuery.replace("=", EQUALS).replace("&", AMPERSAND);
        return scheme + "__" + host + "__" + port + "_" + path + "__" + query + SUFFIX;
    }
}
