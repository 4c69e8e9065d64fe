package com.archivesafrica.mailprocessor.core;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds submission workbooks for tests in the layout the processor expects.
 */
public final class Workbooks {

    public static final String TITLE = "ARCHIVES AFRICA: COLLECTION DATA";

    private final List<Object[]> fields = new ArrayList<>();
    private final List<TermSheetSpec> termSheets = new ArrayList<>();
    private String primarySheet = RecordExtractor.DEFAULT_PRIMARY_SHEET;

    private Workbooks() {}

    public static Workbooks collection() {
        return new Workbooks();
    }

    /**
     * A valid submission: two required fields and one optional, all filled in.
     */
    public static Workbooks valid() {
        return collection()
                .field("Title*", "Title", "Letters of the Mission")
                .field("Date*", "Date", LocalDate.of(1961, 3, 1))
                .field("Description", "Description", "First paragraph\nSecond paragraph")
                .legend();
    }

    public Workbooks primarySheet(String name) {
        this.primarySheet = name;
        return this;
    }

    public Workbooks field(String label, Object value) {
        return field(label, null, value);
    }

    public Workbooks field(String label, String name, Object value) {
        fields.add(new Object[] {label, name, value});
        return this;
    }

    public Workbooks blankRow() {
        fields.add(null);
        return this;
    }

    public Workbooks legend() {
        return field(RecordExtractor.REQUIRED_LEGEND, null, null);
    }

    /**
     * @param header first header cell, e.g. {@code "Subject terms: one per row"}
     * @param labels per-column labels (first data row)
     * @param rows term rows; null entries leave the cell blank
     */
    public Workbooks termSheet(String sheetName, String header, List<String> labels, List<List<String>> rows) {
        termSheets.add(new TermSheetSpec(sheetName, header, labels, rows));
        return this;
    }

    public Workbooks termSheet(String sheetName, String header, List<String> labels, String[]... rows) {
        List<List<String>> list = new ArrayList<>();
        for (String[] row : rows) {
            list.add(Arrays.asList(row));
        }
        return termSheet(sheetName, header, labels, list);
    }

    public Path write(Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            out.write(toBytes());
        }
        return file;
    }

    public byte[] toBytes() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Sheet sheet = workbook.createSheet(primarySheet);
            Row title = sheet.createRow(0);
            title.createCell(0).setCellValue(TITLE);
            title.createCell(1).setCellValue("Element");
            title.createCell(2).setCellValue("Value");

            int r = 1;
            for (Object[] field : fields) {
                Row row = sheet.createRow(r++);
                if (field == null) {
                    continue;
                }
                for (int c = 0; c < field.length; c++) {
                    setCell(row, c, field[c], dateStyle);
                }
            }

            for (TermSheetSpec spec : termSheets) {
                Sheet terms = workbook.createSheet(spec.sheetName);
                terms.createRow(0).createCell(0).setCellValue(spec.header);
                Row labelRow = terms.createRow(1);
                for (int c = 0; c < spec.labels.size(); c++) {
                    setCell(labelRow, c, spec.labels.get(c), dateStyle);
                }
                int tr = 2;
                for (List<String> values : spec.rows) {
                    Row row = terms.createRow(tr++);
                    for (int c = 0; c < values.size(); c++) {
                        setCell(row, c, values.get(c), dateStyle);
                    }
                }
            }

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void setCell(Row row, int column, Object value, CellStyle dateStyle) {
        if (value == null) {
            return;
        }
        Cell cell = row.createCell(column);
        if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
            cell.setCellStyle(dateStyle);
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private static final class TermSheetSpec {
        final String sheetName;
        final String header;
        final List<String> labels;
        final List<List<String>> rows;

        TermSheetSpec(String sheetName, String header, List<String> labels, List<List<String>> rows) {
            this.sheetName = sheetName;
            this.header = header;
            this.labels = labels;
            this.rows = rows;
        }
    }
}
