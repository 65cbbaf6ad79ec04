package com.example.acfeed;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.example.acfeed.NodeQuery.tag;

/**
 * Reads saved listing pages and turns every product tile on them into a {@link ProductRecord}.
 *
 * <p>Lookups are first-match-or-nothing: a tile missing its image, link or feature table still yields a
 * record, with the affected fields left empty. A capture file that cannot be read is skipped.
 */
public class ProductExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProductExtractor.class);

    // ----------------------------------------------------
    // Listing structure
    // ----------------------------------------------------

    static final NodeQuery PRODUCT_ITEMS = NodeQuery
            .of(tag("div").id("amasty-shopby-product-list"))
            .descendant(tag("div").classes("products", "wrapper", "list", "products-list"))
            .descendant(tag("ol").classes("products", "list", "items", "product-items"))
            .child(tag("li"));

    static final NodeQuery IMAGE = NodeQuery
            .of(tag("img").classes("product-image-photo"));

    static final NodeQuery DETAIL_LINK = NodeQuery
            .of(tag("strong").classes("product", "name", "product-item-name", "product-name"))
            .descendant(tag("a").classes("product-item-link"));

    static final NodeQuery FEATURE_TABLE_BODY = NodeQuery
            .of(tag("table").classes("prod-list-features"))
            .descendant(tag("tbody"));

    static final NodeQuery FEATURE_ROWS = NodeQuery.childrenOf(tag("tr"));

    // lazy-loading image source used by the listing
    static final String LAZY_IMAGE_SRC = "data-amsrc";

    // ----------------------------------------------------
    // Directory entry points
    // ----------------------------------------------------

    /**
     * Extracts products from every capture file directly under {@code captureDir}, file by file in
     * name order, tiles in document order.
     *
     * @throws NotDirectoryException if {@code captureDir} is not an existing directory
     */
    public List<ProductRecord> extract(Path captureDir) throws IOException {
        PageStore store = new PageStore(captureDir);
        List<ProductRecord> products = new ArrayList<>();
        for (Path file : store.list()) {
            products.addAll(extractCapture(store, file));
        }
        log.info("Extracted {} product(s) from {}", products.size(), captureDir);
        return products;
    }

    /**
     * Same as {@link #extract(Path)}, but refuses to run when the exports would land in the directory
     * being read.
     */
    public List<ProductRecord> extract(Path captureDir, Path exportDir)
            throws IOException, ConfigurationException {
        if (sameDirectory(captureDir, exportDir)) {
            throw new ConfigurationException(
                    "Capture and export directories must differ: " + captureDir.toAbsolutePath().normalize());
        }
        return extract(captureDir);
    }

    /**
     * Products on one capture file. Unreadable files are logged and yield no products.
     */
    public List<ProductRecord> extractFile(Path file) {
        Path absolute = file.toAbsolutePath();
        return extractCapture(new PageStore(absolute.getParent()), absolute);
    }

    private List<ProductRecord> extractCapture(PageStore store, Path file) {
        log.info("Extracting products from file {}", file);
        Document document;
        try (InputStream in = new ByteArrayInputStream(store.read(file))) {
            // charset from the page's meta tag, UTF-8 otherwise
            document = Jsoup.parse(in, null, "");
        } catch (IOException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            return List.of();
        }
        return extractPage(document);
    }

    // ----------------------------------------------------
    // Page and tile extraction
    // ----------------------------------------------------

    public List<ProductRecord> extractPage(String html, String baseUri) {
        return extractPage(Jsoup.parse(html == null ? "" : html, baseUri));
    }

    public List<ProductRecord> extractPage(Document document) {
        List<ProductRecord> products = new ArrayList<>();
        for (Element item : PRODUCT_ITEMS.all(document)) {
            ProductRecord product = extractItem(item);
            log.debug("Found product: {}", product);
            products.add(product);
        }
        return products;
    }

    public ProductRecord extractItem(Element item) {
        ProductRecord product = new ProductRecord();

        IMAGE.first(item).ifPresent(img -> {
            attribute(img, LAZY_IMAGE_SRC).ifPresent(v -> product.listingImageUrl = v);
            attribute(img, "alt").ifPresent(v -> product.name = v);
        });

        DETAIL_LINK.first(item)
                .flatMap(a -> attribute(a, "href"))
                .ifPresent(v -> product.productUrl = v);

        Optional<Element> tableBody = FEATURE_TABLE_BODY.first(item);
        if (tableBody.isPresent()) {
            for (Element row : FEATURE_ROWS.all(tableBody.get())) {
                applyRow(product, row);
            }
        } else {
            log.warn("No product features table found for '{}'", product.name);
        }

        return product;
    }

    /**
     * Label is the first cell, value the last. A single-cell row has a label and no value.
     */
    static void applyRow(ProductRecord product, Element row) {
        Elements cells = row.children();
        String label = cells.isEmpty() ? "" : cleanText(cells.first().text());
        String value = cells.size() < 2 ? "" : cleanText(cells.last().text());

        FeatureRow.forLabel(label).ifPresent(feature -> feature.apply(product, value));
    }

    // ----------------------------------------------------
    // Utils
    // ----------------------------------------------------

    static Optional<String> attribute(Element element, String name) {
        return element.hasAttr(name) ? Optional.of(element.attr(name)) : Optional.empty();
    }

    private static String cleanText(String t) {
        if (t == null) return "";
        return t.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    static boolean sameDirectory(Path a, Path b) {
        Path na = a.toAbsolutePath().normalize();
        Path nb = b.toAbsolutePath().normalize();
        if (na.equals(nb)) return true;
        try {
            return Files.exists(na) && Files.exists(nb) && Files.isSameFile(na, nb);
        } catch (IOException e) {
            return false;
        }
    }
}
