package com.example.acfeed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guesses the catalog product type of an AC unit from its name and category path, using a
 * {@code keyword=Type} dictionary. The longest keyword found wins.
 */
public class ProductTypeDetector {

    private static final Logger log = LoggerFactory.getLogger(ProductTypeDetector.class);

    public static final String DEFAULT_TYPE = "Aer conditionat";
    static final String RESOURCE = "/product_types.txt";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final List<Entry> entries;

    private static final class Entry {
        final String keyword;
        final String type;
        final Pattern pattern;

        Entry(String keyword, String type, Pattern pattern) {
            this.keyword = keyword;
            this.type = type;
            this.pattern = pattern;
        }
    }

    ProductTypeDetector(List<String> lines) {
        List<Entry> parsed = new ArrayList<>();
        for (String line : lines) {
            String l = line.trim();
            if (l.isEmpty() || l.startsWith("#")) continue;
            int eq = l.indexOf('=');
            if (eq <= 0 || eq == l.length() - 1) {
                log.warn("Ignoring product type line '{}'", l);
                continue;
            }
            String keyword = normPhrase(l.substring(0, eq));
            String type = l.substring(eq + 1).trim();
            if (keyword.isEmpty()) continue;
            Pattern p = Pattern.compile("(^|\\W)" + Pattern.quote(keyword) + "(\\W|$)");
            parsed.add(new Entry(keyword, type, p));
        }
        this.entries = Collections.unmodifiableList(parsed);
    }

    /**
     * Loads the dictionary from the classpath, falling back to {@code ./product_types.txt}. Without
     * either, every product gets {@link #DEFAULT_TYPE}.
     */
    public static ProductTypeDetector load() {
        try (InputStream in = ProductTypeDetector.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                ProductTypeDetector d = new ProductTypeDetector(readLines(in));
                log.debug("Loaded {} product type entries from classpath {}", d.entries.size(), RESOURCE);
                return d;
            }
            Path file = Path.of("product_types.txt");
            if (Files.isRegularFile(file)) {
                ProductTypeDetector d = new ProductTypeDetector(Files.readAllLines(file, StandardCharsets.UTF_8));
                log.debug("Loaded {} product type entries from {}", d.entries.size(), file.toAbsolutePath());
                return d;
            }
        } catch (IOException e) {
            log.error("Failed to load product types: {}", e.getMessage());
        }
        log.warn("product_types.txt not found on classpath or in working directory. Product types will be '{}'.",
                DEFAULT_TYPE);
        return new ProductTypeDetector(List.of());
    }

    public String detect(String name, List<String> categoryDrillDown) {
        StringBuilder sb = new StringBuilder();
        if (name != null) sb.append(name).append(' ');
        if (categoryDrillDown != null) {
            for (String c : categoryDrillDown) sb.append(c).append(' ');
        }
        String hay = normPhrase(sb.toString());
        if (hay.isEmpty()) return DEFAULT_TYPE;

        String best = null;
        int bestLen = 0;
        for (Entry e : entries) {
            if (e.keyword.length() > bestLen && e.pattern.matcher(hay).find()) {
                bestLen = e.keyword.length();
                best = e.type;
            }
        }
        return best != null ? best : DEFAULT_TYPE;
    }

    // lower case, no diacritics, punctuation collapsed to single spaces
    static String normPhrase(String s) {
        String out = Normalizer.normalize(s, Normalizer.Form.NFD);
        out = COMBINING_MARKS.matcher(out).replaceAll("");
        out = out.toLowerCase(Locale.ROOT);
        out = out.replaceAll("[^a-z0-9\\s\\-/]", " ");
        out = out.replaceAll("\\s+", " ").trim();
        return out;
    }

    private static List<String> readLines(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
