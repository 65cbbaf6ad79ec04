package com.example.acfeed;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import static com.example.acfeed.ExportColumn.*;

/**
 * Maps a {@link ProductRecord} onto the catalog import row and writes it as one file named after
 * the product code. A later product with the same code replaces the earlier file.
 */
public class TemplateMapper {

    private static final Logger log = LoggerFactory.getLogger(TemplateMapper.class);

    static final String GOOGLE_CATEGORY_PATH =
            "Home & Garden > Household Appliances > Climate Control Appliances > Air Conditioners";
    static final String CATEGORY_SEPARATOR = " > ";
    static final String YES = "Da";
    static final String NO = "Nu";
    static final String WIFI_TAG = "WiFi";

    private final ProductTypeDetector typeDetector;
    private final ExportWriter writer;

    public TemplateMapper(ProductTypeDetector typeDetector, ExportWriter writer) {
        this.typeDetector = typeDetector;
        this.writer = writer;
    }

    /**
     * Writes {@code <exportRoot>/<product code>.<ext>}, overwriting an existing file. Path separators
     * in the code are written as {@value PageNamer#SLASH}, so set codes such as {@code FTXM25R/RXM25R}
     * stay one file directly under the root.
     *
     * @throws NotDirectoryException if {@code exportRoot} is not an existing directory
     * @throws IOException           if the code still does not name a file directly under the root
     */
    public Path toExport(ProductRecord product, Path exportRoot) throws IOException {
        if (!Files.isDirectory(exportRoot)) {
            throw new NotDirectoryException(exportRoot.toString());
        }
        Path out = exportFile(exportRoot, product.productCode);
        writer.write(toExportRecord(product), out);
        log.debug("Wrote {} for '{}'", out, product.name);
        return out;
    }

    Path exportFile(Path exportRoot, String productCode) throws IOException {
        String stem = fileStem(productCode);
        Path root = exportRoot.toAbsolutePath().normalize();
        Path out;
        try {
            out = root.resolve(stem + "." + writer.extension()).normalize();
        } catch (InvalidPathException e) {
            throw new IOException("Product code '" + productCode + "' is not usable as a file name", e);
        }
        if (!root.equals(out.getParent())) {
            throw new IOException("Product code '" + productCode + "' leads outside " + root);
        }
        return out;
    }

    static String fileStem(String productCode) {
        return nz(productCode).replace("/", PageNamer.SLASH).replace("\\", PageNamer.SLASH);
    }

    public ExportRecord toExportRecord(ProductRecord product) {
        String title = nz(product.name).trim();
        String type = typeDetector.detect(title, product.categoryDrillDown);

        ExportRecord r = new ExportRecord();

        // ----- from the product -----
        r.set(HANDLE, handleFor(title, product.productCode));
        r.set(TITLE, title);
        r.set(BODY_HTML, describe(product));
        r.set(VENDOR, nz(product.manufacturer).trim());
        r.set(TYPE, type);
        r.set(TAGS, tagsFor(product, type));
        r.set(VARIANT_SKU, nz(product.productCode));
        r.set(IMAGE_SRC, nz(product.listingImageUrl));
        r.set(IMAGE_ALT_TEXT, title);
        r.set(SEO_TITLE, title);
        r.set(SEO_DESCRIPTION, title);
        r.set(GOOGLE_PRODUCT_CATEGORY, GOOGLE_CATEGORY_PATH);
        r.set(GOOGLE_MPN, nz(product.productCode));

        // ----- publication defaults -----
        r.set(PUBLISHED, "TRUE");
        r.set(OPTION1_NAME, "Title");
        r.set(OPTION1_VALUE, "Default Title");
        r.set(VARIANT_GRAMS, "0");
        r.set(VARIANT_INVENTORY_TRACKER, "shopify");
        r.set(VARIANT_INVENTORY_QTY, "0");
        r.set(VARIANT_INVENTORY_POLICY, "deny");
        r.set(VARIANT_FULFILLMENT_SERVICE, "manual");
        r.set(VARIANT_PRICE, "0.00");
        r.set(VARIANT_REQUIRES_SHIPPING, "TRUE");
        r.set(VARIANT_TAXABLE, "TRUE");
        r.set(IMAGE_POSITION, "1");
        r.set(GIFT_CARD, "FALSE");
        r.set(GOOGLE_CONDITION, "new");
        r.set(GOOGLE_CUSTOM_PRODUCT, "FALSE");
        r.set(VARIANT_WEIGHT_UNIT, "kg");

        return r;
    }

    /**
     * Specification table for the product page, one row per attribute.
     */
    String describe(ProductRecord p) {
        Document doc = Document.createShell("");
        doc.outputSettings().prettyPrint(false);

        Element table = doc.body().appendElement("table").addClass("ac-specs");
        Element body = table.appendElement("tbody");
        row(body, "Capacitate racire", p.coolingBtuCapacity);
        row(body, "Capacitate incalzire", p.heatingBtuCapacity);
        row(body, "Clasa energetica racire", p.coolingEnergyClass);
        row(body, "Clasa energetica incalzire", p.heatingEnergyClass);
        row(body, "Tensiune alimentare", p.mainsVoltage);
        row(body, "Lungime unitate interna", p.internalUnitLength);
        row(body, "Conexiune Wi-Fi", p.hasWifiConnection ? YES : NO);
        row(body, "Categorie", String.join(CATEGORY_SEPARATOR, p.categoryDrillDown));

        return table.outerHtml();
    }

    private static void row(Element body, String label, String value) {
        Element tr = body.appendElement("tr");
        tr.appendElement("th").text(label);
        tr.appendElement("td").text(nz(value));
    }

    static String tagsFor(ProductRecord p, String type) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(ProductTypeDetector.DEFAULT_TYPE);
        tags.add(type);
        tags.add(nz(p.manufacturer).trim());
        if (p.hasWifiConnection) tags.add(WIFI_TAG);
        for (String c : p.categoryDrillDown) tags.add(nz(c).trim());
        tags.remove("");
        return String.join(", ", tags);
    }

    // url-safe slug of the title, the product code when the title has none
    static String handleFor(String title, String productCode) {
        String slug = slug(title);
        return slug.isEmpty() ? slug(nz(productCode)) : slug;
    }

    private static String slug(String s) {
        String out = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        out = out.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return out.replaceAll("^-+|-+$", "");
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
