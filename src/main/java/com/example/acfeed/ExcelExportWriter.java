package com.example.acfeed;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Single-sheet {@code .xlsx}: bold header row, one data row. Empty columns are written as blank
 * strings so every column has a cell.
 */
public class ExcelExportWriter implements ExportWriter {

    static final String SHEET_NAME = "Products";

    @Override
    public String extension() {
        return "xlsx";
    }

    @Override
    public void write(ExportRecord record, Path out) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(SHEET_NAME);

            CellStyle headerStyle = wb.createCellStyle();
            Font headerFont = wb.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            List<String> headers = ExportRecord.headers();
            Row header = sheet.createRow(0);
            for (int i = 0; i < headers.size(); i++) {
                Cell c = header.createCell(i);
                c.setCellValue(headers.get(i));
                c.setCellStyle(headerStyle);
            }

            List<String> values = record.values();
            Row r = sheet.createRow(1);
            for (int i = 0; i < values.size(); i++) {
                r.createCell(i).setCellValue(nz(values.get(i)));
            }

            try (OutputStream os = Files.newOutputStream(out)) {
                wb.write(os);
            }
        }
    }

    private String nz(String s) {
        return s == null ? "" : s;
    }
}
