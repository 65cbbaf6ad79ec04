package com.example.acfeed;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TemplateMapperTest {

    @TempDir
    Path tempDir;

    private final TemplateMapper mapper = new TemplateMapper(
            new ProductTypeDetector(List.of("caseta=Aer conditionat caseta")), new CsvExportWriter());

    @Test
    void toExportRecord_titleAndSeoMirrorTheName() {
        ExportRecord r = mapper.toExportRecord(unitA());

        assertThat(r.get(ExportColumn.TITLE)).isEqualTo("Unit A");
        assertThat(r.get(ExportColumn.SEO_TITLE)).isEqualTo("Unit A");
        assertThat(r.get(ExportColumn.SEO_DESCRIPTION)).isEqualTo("Unit A");
        assertThat(r.get(ExportColumn.IMAGE_ALT_TEXT)).isEqualTo("Unit A");
        assertThat(r.get(ExportColumn.HANDLE)).isEqualTo("unit-a");
        assertThat(r.get(ExportColumn.VARIANT_SKU)).isEqualTo("SKU1");
        assertThat(r.get(ExportColumn.GOOGLE_MPN)).isEqualTo("SKU1");
        assertThat(r.get(ExportColumn.VENDOR)).isEqualTo("Daikin");
        assertThat(r.get(ExportColumn.IMAGE_SRC)).isEqualTo("https://shop.test/a.jpg");
    }

    @Test
    void toExportRecord_descriptionEmbedsCapacitiesVerbatim() {
        String body = mapper.toExportRecord(unitA()).get(ExportColumn.BODY_HTML);

        assertThat(body)
                .startsWith("<table class=\"ac-specs\">")
                .contains("<td>9000 BTU</td>")
                .contains("<td>10000 BTU</td>")
                .contains("<td>A++</td>")
                .contains("<th>Conexiune Wi-Fi</th><td>Da</td>")
                .contains("<td>Rezidential &gt; Aer conditionat</td>")
                .doesNotContain("\n");
    }

    @Test
    void toExportRecord_withoutWifi_rendersNo() {
        ProductRecord p = unitA();
        p.hasWifiConnection = false;

        assertThat(mapper.toExportRecord(p).get(ExportColumn.BODY_HTML)).contains("<td>Nu</td>");
        assertThat(mapper.toExportRecord(p).get(ExportColumn.TAGS)).doesNotContain(TemplateMapper.WIFI_TAG);
    }

    @Test
    void toExportRecord_escapesMarkupInValues() {
        ProductRecord p = unitA();
        p.mainsVoltage = "<script>x</script>";

        assertThat(mapper.toExportRecord(p).get(ExportColumn.BODY_HTML))
                .contains("&lt;script&gt;x&lt;/script&gt;")
                .doesNotContain("<script>");
    }

    @Test
    void toExportRecord_fixedDefaults() {
        ExportRecord r = mapper.toExportRecord(new ProductRecord());

        assertThat(r.get(ExportColumn.PUBLISHED)).isEqualTo("TRUE");
        assertThat(r.get(ExportColumn.VARIANT_INVENTORY_POLICY)).isEqualTo("deny");
        assertThat(r.get(ExportColumn.VARIANT_FULFILLMENT_SERVICE)).isEqualTo("manual");
        assertThat(r.get(ExportColumn.VARIANT_PRICE)).isEqualTo("0.00");
        assertThat(r.get(ExportColumn.VARIANT_TAXABLE)).isEqualTo("TRUE");
        assertThat(r.get(ExportColumn.VARIANT_WEIGHT_UNIT)).isEqualTo("kg");
        assertThat(r.get(ExportColumn.IMAGE_POSITION)).isEqualTo("1");
        assertThat(r.get(ExportColumn.GOOGLE_PRODUCT_CATEGORY)).isEqualTo(TemplateMapper.GOOGLE_CATEGORY_PATH);
        assertThat(r.get(ExportColumn.TYPE)).isEqualTo(ProductTypeDetector.DEFAULT_TYPE);
        assertThat(r.get(ExportColumn.VARIANT_BARCODE)).isNull();
        assertThat(r.get(ExportColumn.COST_PER_ITEM)).isNull();
        assertThat(r.values()).hasSize(ExportColumn.values().length);
    }

    @Test
    void toExportRecord_typeAndTags() {
        ProductRecord p = unitA();
        p.name = "Unitate interioara VRV caseta Daikin";

        ExportRecord r = mapper.toExportRecord(p);

        assertThat(r.get(ExportColumn.TYPE)).isEqualTo("Aer conditionat caseta");
        assertThat(r.get(ExportColumn.TAGS))
                .isEqualTo("Aer conditionat, Aer conditionat caseta, Daikin, WiFi, Rezidential");
    }

    @Test
    void toExport_writesFileNamedAfterProductCode() throws Exception {
        Path out = mapper.toExport(unitA(), tempDir);

        assertThat(out).isEqualTo(tempDir.resolve("SKU1.csv"));
        assertThat(Files.readString(out)).contains("Unit A").contains("9000 BTU");
    }

    @Test
    void toExport_twice_isByteIdentical() throws Exception {
        Path out = mapper.toExport(unitA(), tempDir);
        byte[] first = Files.readAllBytes(out);

        mapper.toExport(unitA(), tempDir);

        assertThat(Files.readAllBytes(out)).isEqualTo(first);
    }

    @Test
    void toExport_sameCode_overwritesEarlierUnit() throws Exception {
        ProductRecord other = unitA();
        other.name = "Unit B";

        mapper.toExport(unitA(), tempDir);
        Path out = mapper.toExport(other, tempDir);

        assertThat(Files.list(tempDir)).hasSize(1);
        assertThat(Files.readString(out)).contains("Unit B").doesNotContain("Unit A");
    }

    @Test
    void toExport_emptyCode_writesEmptyStemFile() throws Exception {
        ProductRecord p = unitA();
        p.productCode = "";

        assertThat(mapper.toExport(p, tempDir)).isEqualTo(tempDir.resolve(".csv"));
    }

    @Test
    void toExport_setCodeWithSlash_staysOneFileUnderRoot() throws Exception {
        ProductRecord p = unitA();
        p.productCode = "FTXM25R/RXM25R";

        Path out = mapper.toExport(p, tempDir);

        assertThat(out).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("FTXM25R_slash_RXM25R.csv"));
        assertThat(Files.readString(out)).contains("FTXM25R/RXM25R");
        assertThat(Files.list(tempDir)).hasSize(1);
    }

    @Test
    void toExport_parentSegmentsInCode_neverLeaveRoot() throws Exception {
        Path exportRoot = Files.createDirectories(tempDir.resolve("a").resolve("exports"));
        ProductRecord p = unitA();
        p.productCode = "../../escaped";

        Path out = mapper.toExport(p, exportRoot);

        assertThat(out.getParent()).isEqualTo(exportRoot.toAbsolutePath().normalize());
        assertThat(out.getFileName().toString()).isEqualTo(".._slash_.._slash_escaped.csv");
        assertThat(tempDir.resolve("escaped.csv")).doesNotExist();
        assertThat(tempDir.resolve("a").resolve("escaped.csv")).doesNotExist();
    }

    @Test
    void toExport_backslashInCode_isEscapedToo() throws Exception {
        ProductRecord p = unitA();
        p.productCode = "..\\..\\escaped";

        Path out = mapper.toExport(p, tempDir);

        assertThat(out.getParent()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(out.getFileName().toString()).isEqualTo(".._slash_.._slash_escaped.csv");
    }

    @Test
    void toExport_missingExportRoot_fails() {
        assertThatThrownBy(() -> mapper.toExport(unitA(), tempDir.resolve("missing")))
                .isInstanceOf(NotDirectoryException.class);
    }

    private static ProductRecord unitA() {
        ProductRecord p = new ProductRecord();
        p.name = "  Unit A ";
        p.manufacturer = "Daikin";
        p.productCode = "SKU1";
        p.listingImageUrl = "https://shop.test/a.jpg";
        p.coolingBtuCapacity = "9000 BTU";
        p.heatingBtuCapacity = "10000 BTU";
        p.coolingEnergyClass = "A++";
        p.heatingEnergyClass = "A+";
        p.mainsVoltage = "230 V";
        p.internalUnitLength = "800 mm";
        p.hasWifiConnection = true;
        p.categoryDrillDown = List.of("Rezidential", "Aer conditionat");
        return p;
    }
}
