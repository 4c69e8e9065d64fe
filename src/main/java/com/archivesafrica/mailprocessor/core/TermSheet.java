package com.archivesafrica.mailprocessor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A secondary (controlled vocabulary) sheet as plain rows.
 * <p>
 * The header row carries the vocabulary name in its first cell. The first data row holds the
 * per-column labels; every following row is one term. Rows are maps of 0-based column index
 * to trimmed cell text, with blank cells left out.
 */
public final class TermSheet {

    private final String sheetName;
    private final Map<Integer, String> header;
    private final List<Map<Integer, String>> rows;

    public TermSheet(String sheetName, Map<Integer, String> header, List<Map<Integer, String>> rows) {
        this.sheetName = sheetName;
        this.header = Collections.unmodifiableMap(new TreeMap<>(header));
        List<Map<Integer, String>> copy = new ArrayList<>(rows.size());
        for (Map<Integer, String> row : rows) {
            copy.add(Collections.unmodifiableMap(new TreeMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getSheetName() {
        return sheetName;
    }

    public Map<Integer, String> getHeader() {
        return header;
    }

    /**
     * @return all data rows, the label row first
     */
    public List<Map<Integer, String>> getRows() {
        return rows;
    }

    public Map<Integer, String> getLabelRow() {
        return rows.isEmpty() ? Collections.emptyMap() : rows.get(0);
    }

    public List<Map<Integer, String>> getTermRows() {
        return rows.size() <= 1 ? Collections.emptyList() : rows.subList(1, rows.size());
    }
}
