package com.example.acfeed;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CsvExportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void csv_quotesOnlyWhenNeeded() {
        assertThat(CsvExportWriter.csv(null)).isEmpty();
        assertThat(CsvExportWriter.csv("plain text")).isEqualTo("plain text");
        assertThat(CsvExportWriter.csv("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvExportWriter.csv("say \"da\"")).isEqualTo("\"say \"\"da\"\"\"");
        assertThat(CsvExportWriter.csv("two\nlines")).isEqualTo("\"two\nlines\"");
    }

    @Test
    void line_keepsEmptyFields() {
        assertThat(CsvExportWriter.line(Arrays.asList("a", null, "", "b"))).isEqualTo("a,,,b");
    }

    @Test
    void write_headerRowThenDataRow() throws Exception {
        ExportRecord record = new ExportRecord()
                .set(ExportColumn.HANDLE, "unit-a")
                .set(ExportColumn.TITLE, "Unit A")
                .set(ExportColumn.TAGS, "Aer conditionat, Daikin");
        Path out = tempDir.resolve("SKU1.csv");

        new CsvExportWriter().write(record, out);

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("Handle,Title,Body (HTML),Vendor,Type,Tags,Published,")
                .endsWith(",Variant Weight Unit,Variant Tax Code,Cost per item");
        assertThat(lines.get(1)).startsWith("unit-a,Unit A,,,,\"Aer conditionat, Daikin\",");
        // column separators plus the comma inside the quoted tags
        long commas = lines.get(1).chars().filter(c -> c == ',').count();
        assertThat(commas).isEqualTo(ExportColumn.values().length);
    }
}
