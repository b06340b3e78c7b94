package com.bmsedge.production.service;

import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.model.ImportRow;
import com.bmsedge.production.util.BigDecimalDeserializer;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the daily production export. Only the first sheet is read and row 0 is a header.
 * Columns are positional: fabric, production, customer, scrap, work center.
 */
@Service
public class ProductionSheetParser {

    private static final Logger logger = LoggerFactory.getLogger(ProductionSheetParser.class);

    static final int COL_FABRIC = 0;
    static final int COL_PRODUCTION = 1;
    static final int COL_CUSTOMER = 2;
    static final int COL_SCRAP = 3;
    static final int COL_WORK_CENTER = 4;

    public ParseResult parse(MultipartFile file) {
        String fileName = file.getOriginalFilename();

        if (fileName == null || file.isEmpty()) {
            throw new BusinessException("File cannot be empty");
        }

        String lower = fileName.toLowerCase();
        try {
            if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
                return parseWorkbook(file);
            } else if (lower.endsWith(".csv")) {
                return parseCsv(file);
            }
        } catch (BusinessException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to parse production sheet {}: {}", fileName, e.getMessage());
            throw new BusinessException("Error parsing file: " + e.getMessage(), e);
        }

        throw new BusinessException("Unsupported file format. Please upload Excel (.xlsx, .xls) or CSV (.csv) files only.");
    }

    private ParseResult parseWorkbook(MultipartFile file) throws IOException {
        List<ImportRow> rows = new ArrayList<>();
        int skipped = 0;

        try (InputStream in = file.getInputStream(); Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new BusinessException("No worksheet found");
            }

            Sheet sheet = workbook.getSheetAt(0);
            logger.info("Parsing production sheet '{}' with {} rows", sheet.getSheetName(), sheet.getLastRowNum());

            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null || isBlankRow(row)) {
                    continue;
                }

                String workCenter = getCellValueAsString(row.getCell(COL_WORK_CENTER));
                if (workCenter.isEmpty()) {
                    skipped++;
                    logger.debug("Row {} has no work center, skipping", i + 1);
                    continue;
                }

                rows.add(new ImportRow(
                        i + 1,
                        getCellValueAsString(row.getCell(COL_FABRIC)),
                        getCellValueAsBigDecimal(row.getCell(COL_PRODUCTION)),
                        getCellValueAsString(row.getCell(COL_CUSTOMER)),
                        getCellValueAsBigDecimal(row.getCell(COL_SCRAP)),
                        workCenter
                ));
            }
        }

        logger.info("Parsed {} production rows, {} skipped without work center", rows.size(), skipped);
        return new ParseResult(rows, skipped);
    }

    private ParseResult parseCsv(MultipartFile file) throws IOException, CsvException {
        List<ImportRow> rows = new ArrayList<>();
        int skipped = 0;

        try (CSVReader reader = new CSVReader(new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();

            for (int i = 1; i < lines.size(); i++) {
                String[] line = lines.get(i);
                if (isBlankLine(line)) {
                    continue;
                }

                String workCenter = column(line, COL_WORK_CENTER);
                if (workCenter.isEmpty()) {
                    skipped++;
                    continue;
                }

                rows.add(new ImportRow(
                        i + 1,
                        column(line, COL_FABRIC),
                        toQuantity(column(line, COL_PRODUCTION)),
                        column(line, COL_CUSTOMER),
                        toQuantity(column(line, COL_SCRAP)),
                        workCenter
                ));
            }
        }

        logger.info("Parsed {} production rows from CSV, {} skipped without work center", rows.size(), skipped);
        return new ParseResult(rows, skipped);
    }

    private boolean isBlankRow(Row row) {
        for (int c = COL_FABRIC; c <= COL_WORK_CENTER; c++) {
            if (!getCellValueAsString(row.getCell(c)).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private boolean isBlankLine(String[] line) {
        for (String value : line) {
            if (value != null && !value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private String column(String[] line, int index) {
        if (index >= line.length || line[index] == null) {
            return "";
        }
        return line[index].trim();
    }

    private BigDecimal toQuantity(String text) {
        BigDecimal value = BigDecimalDeserializer.parseQuantity(text);
        return value != null ? value : BigDecimal.ZERO;
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return "";
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                double numericValue = cell.getNumericCellValue();
                if (numericValue == Math.rint(numericValue) && !Double.isInfinite(numericValue)) {
                    return String.valueOf((long) numericValue);
                }
                return String.valueOf(numericValue);
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                if (cell.getCachedFormulaResultType() == CellType.NUMERIC) {
                    double cached = cell.getNumericCellValue();
                    return cached == Math.rint(cached) ? String.valueOf((long) cached) : String.valueOf(cached);
                }
                if (cell.getCachedFormulaResultType() == CellType.STRING) {
                    return cell.getStringCellValue().trim();
                }
                return "";
            default:
                return "";
        }
    }

    private BigDecimal getCellValueAsBigDecimal(Cell cell) {
        if (cell == null) return BigDecimal.ZERO;
        if (cell.getCellType() == CellType.NUMERIC
                || (cell.getCellType() == CellType.FORMULA && cell.getCachedFormulaResultType() == CellType.NUMERIC)) {
            return BigDecimal.valueOf(cell.getNumericCellValue());
        }
        return toQuantity(getCellValueAsString(cell));
    }

    public static class ParseResult {
        private final List<ImportRow> rows;
        private final int skippedRows;

        public ParseResult(List<ImportRow> rows, int skippedRows) {
            this.rows = Collections.unmodifiableList(rows);
            this.skippedRows = skippedRows;
        }

        public List<ImportRow> getRows() { return rows; }

        public int getSkippedRows() { return skippedRows; }
    }
}
