package com.archivesafrica.mailprocessor.core;

import com.archivesafrica.mailprocessor.exception.MalformedSpreadsheetException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a staged workbook into a {@link NormalizedRecord} and its vocabulary {@link TermSheet}s.
 * <p>
 * The primary sheet (named {@value #DEFAULT_PRIMARY_SHEET} by default, matched ignoring case) is
 * laid out vertically:
 * <pre>
 *   row 0     | ARCHIVES AFRICA: COLLECTION DATA |              |            |   title row, ignored
 *   row 1..n  | field label (Title*)             | element name | value      |
 *             | * Required                       |              |            |   legend row, ignored
 * </pre>
 * Column A holds the label shown to the submitter, column B an optional element name and
 * column C the value. Every other sheet of the workbook is a vocabulary sheet.
 *
 * @invariant Each labelled row produces exactly one field; blank or duplicate labels are
 *      reported, never dropped.
 */
public class RecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RecordExtractor.class);

    public static final String DEFAULT_PRIMARY_SHEET = "collection";
    public static final String REQUIRED_LEGEND = "* Required";

    private static final int LABEL_COLUMN = 0;
    private static final int NAME_COLUMN = 1;
    private static final int VALUE_COLUMN = 2;
    private static final int FIRST_FIELD_ROW = 1;

    private final String primarySheetName;
    private final DataFormatter formatter;

    public RecordExtractor() {
        this(DEFAULT_PRIMARY_SHEET);
    }

    public RecordExtractor(String primarySheetName) {
        this.primarySheetName = primarySheetName;
        this.formatter = new DataFormatter();
    }

    /**
     * Reads the primary sheet of {@code file}.
     *
     * @param file staged workbook
     * @return the record, fields in sheet order
     * @throws MalformedSpreadsheetException if the workbook cannot be opened, the primary sheet
     *         is missing or empty, or its labels are blank, duplicated or unusable as names
     */
    public NormalizedRecord extract(Path file) {
        try (Workbook workbook = open(file)) {
            Sheet sheet = primarySheet(workbook, file);
            NormalizedRecord record = readRecord(sheet, file);
            logger.debug("{}: extracted {} field(s) from sheet '{}'", file.getFileName(), record.size(), sheet.getSheetName());
            return record;
        } catch (IOException e) {
            throw new MalformedSpreadsheetException("Cannot close workbook " + file, e);
        }
    }

    /**
     * Reads every sheet other than the primary one, in workbook order.
     *
     * @throws MalformedSpreadsheetException if the workbook cannot be opened or a vocabulary
     *         sheet has no header
     */
    public List<TermSheet> extractTermSheets(Path file) {
        try (Workbook workbook = open(file)) {
            Sheet primary = primarySheet(workbook, file);
            List<TermSheet> sheets = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                if (sheet == primary) {
                    continue;
                }
                sheets.add(readTermSheet(sheet, file));
            }
            logger.debug("{}: extracted {} vocabulary sheet(s)", file.getFileName(), sheets.size());
            return sheets;
        } catch (IOException e) {
            throw new MalformedSpreadsheetException("Cannot close workbook " + file, e);
        }
    }

    private Workbook open(Path file) {
        try {
            return WorkbookFactory.create(file.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new MalformedSpreadsheetException("Cannot open workbook " + file + ": " + e.getMessage(), e);
        }
    }

    private Sheet primarySheet(Workbook workbook, Path file) {
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            if (sheet.getSheetName().trim().equalsIgnoreCase(primarySheetName)) {
                return sheet;
            }
        }
        throw new MalformedSpreadsheetException("Sheet '" + primarySheetName + "' not found in " + file.getFileName());
    }

    private NormalizedRecord readRecord(Sheet sheet, Path file) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            throw new MalformedSpreadsheetException("Sheet '" + sheet.getSheetName() + "' is empty in " + file.getFileName());
        }
        NormalizedRecord.Builder builder = NormalizedRecord.builder();

        for (int r = FIRST_FIELD_ROW; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            String label = text(row.getCell(LABEL_COLUMN));
            String name = text(row.getCell(NAME_COLUMN));
            FieldValue value = value(row.getCell(VALUE_COLUMN));

            if (label.isEmpty()) {
                if (!name.isEmpty() || value != null) {
                    throw new MalformedSpreadsheetException("Row " + (r + 1) + " of sheet '" + sheet.getSheetName()
                            + "' has content but no label in " + file.getFileName());
                }
                continue;
            }
            if (label.equalsIgnoreCase(REQUIRED_LEGEND)) {
                continue;
            }

            RecordField field = new RecordField(label, name, value);
            if (CollectionDocumentBuilder.sanitize(field.getName()).isEmpty()) {
                throw new MalformedSpreadsheetException("Label '" + label + "' on row " + (r + 1)
                        + " does not yield an element name in " + file.getFileName());
            }
            try {
                builder.add(field);
            } catch (IllegalArgumentException e) {
                throw new MalformedSpreadsheetException("Duplicate label '" + label + "' on row " + (r + 1)
                        + " in " + file.getFileName(), e);
            }
        }

        NormalizedRecord record = builder.build();
        if (record.size() == 0) {
            throw new MalformedSpreadsheetException("No field labels found in sheet '" + sheet.getSheetName()
                    + "' of " + file.getFileName());
        }
        return record;
    }

    private TermSheet readTermSheet(Sheet sheet, Path file) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        Map<Integer, String> header = headerRow == null ? new TreeMap<>() : rowMap(headerRow);
        if (!header.containsKey(0)) {
            throw new MalformedSpreadsheetException("Sheet '" + sheet.getSheetName() + "' has no header in its first column in "
                    + file.getFileName());
        }
        List<Map<Integer, String>> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<Integer, String> cells = rowMap(row);
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return new TermSheet(sheet.getSheetName(), header, rows);
    }

    private Map<Integer, String> rowMap(Row row) {
        Map<Integer, String> cells = new TreeMap<>();
        for (Cell cell : row) {
            String text = text(cell);
            if (!text.isEmpty()) {
                cells.put(cell.getColumnIndex(), text);
            }
        }
        return cells;
    }

    private String text(Cell cell) {
        if (cell == null) {
            return "";
        }
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell).trim();
        }
        // Formulas are not evaluated; the value cached by the authoring application is used.
        switch (cell.getCachedFormulaResultType()) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                return formatter.formatRawCellContents(cell.getNumericCellValue(),
                        cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString()).trim();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    /**
     * @return the typed value of a cell, or null if it is blank, whitespace or an error
     */
    private FieldValue value(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isBlank() ? null : FieldValue.text(text);
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return FieldValue.date(cell.getLocalDateTimeCellValue().toLocalDate());
                }
                return FieldValue.number(BigDecimal.valueOf(cell.getNumericCellValue()));
            case BOOLEAN:
                return FieldValue.bool(cell.getBooleanCellValue());
            default:
                return null;
        }
    }
}
