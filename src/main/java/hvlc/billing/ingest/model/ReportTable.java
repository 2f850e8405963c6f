package hvlc.billing.ingest.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory, column-oriented table of report data.
 *
 * Columns keep their insertion order and all share the same row count.
 * Cell values are String, BigDecimal, LocalDate or null. Transformation rules
 * work on a {@link #copy()} and never change the table they were given.
 */
@Slf4j
public class ReportTable {

    private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
    private int rowCount;

    public ReportTable() {
        this.rowCount = 0;
    }

    /**
     * Build a table from parsed delimited rows. Blank cells become null, short
     * rows are padded with null and surplus cells are dropped.
     *
     * A repeated header keeps its position under a numbered name: the second
     * "Notes" becomes "Notes.1", the third "Notes.2".
     *
     * @param headers column names
     * @param rows raw cell values, one list per row
     */
    public ReportTable(List<String> headers, List<List<String>> rows) {
        List<String> names = uniqueNames(headers);
        List<List<Object>> values = new ArrayList<>(names.size());
        for (String name : names) {
            List<Object> column = new ArrayList<>(rows.size());
            columns.put(name, column);
            values.add(column);
        }
        for (List<String> row : rows) {
            for (int i = 0; i < names.size(); i++) {
                String value = i < row.size() ? row.get(i) : null;
                values.get(i).add(value == null || value.isEmpty() ? null : value);
            }
        }
        this.rowCount = rows.size();
    }

    private static List<String> uniqueNames(List<String> headers) {
        Set<String> seen = new HashSet<>(headers);
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(headers.size());
        for (String header : headers) {
            String name = header;
            if (!used.add(name)) {
                int suffix = 1;
                do {
                    name = header + "." + suffix++;
                } while (seen.contains(name) || used.contains(name));
                used.add(name);
                log.warn("Duplicate column '{}' renamed to '{}'", header, name);
            }
            names.add(name);
        }
        return names;
    }

    public static ReportTable empty() {
        return new ReportTable();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty() || rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @return read-only view of the column values
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<Object> getColumn(String name) {
        List<Object> column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return Collections.unmodifiableList(column);
    }

    public Object getValue(int row, String column) {
        return getColumn(column).get(row);
    }

    /**
     * Add a column, or replace the values of an existing one in place.
     */
    public void setColumn(String name, List<?> values) {
        if (!columns.isEmpty() && values.size() != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "Column %s has %d values but table has %d rows", name, values.size(), rowCount));
        }
        if (columns.isEmpty()) {
            rowCount = values.size();
        }
        columns.put(name, new ArrayList<>(values));
    }

    /**
     * Fill a column with one value on every row.
     */
    public void setConstant(String name, Object value) {
        setColumn(name, new ArrayList<>(Collections.nCopies(rowCount, value)));
    }

    /**
     * Rename columns keeping their position. A rename onto a name that is
     * already present replaces that column.
     */
    public void renameColumns(Map<String, String> renames) {
        LinkedHashMap<String, List<Object>> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            String target = renames.getOrDefault(entry.getKey(), entry.getKey());
            if (renamed.containsKey(target) && !renames.containsKey(entry.getKey())) {
                // an earlier renamed column already claimed this name
                continue;
            }
            renamed.put(target, entry.getValue());
        }
        columns.clear();
        columns.putAll(renamed);
    }

    public void removeColumn(String name) {
        columns.remove(name);
    }

    /**
     * @return one row as an ordered column → value map
     */
    public Map<String, Object> getRow(int row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            values.put(entry.getKey(), entry.getValue().get(row));
        }
        return values;
    }

    public List<Map<String, Object>> getRows(int limit) {
        int end = Math.min(limit, rowCount);
        List<Map<String, Object>> rows = new ArrayList<>(end);
        for (int i = 0; i < end; i++) {
            rows.add(getRow(i));
        }
        return rows;
    }

    public List<Map<String, Object>> getRows() {
        return getRows(rowCount);
    }

    /**
     * Project onto the given columns in the given order.
     *
     * @throws IllegalArgumentException if any column is missing
     */
    public ReportTable select(List<String> names) {
        ReportTable projected = new ReportTable();
        projected.rowCount = rowCount;
        for (String name : names) {
            projected.columns.put(name, new ArrayList<>(getColumn(name)));
        }
        return projected;
    }

    public ReportTable copy() {
        ReportTable copy = new ReportTable();
        copy.rowCount = rowCount;
        columns.forEach((name, values) -> copy.columns.put(name, new ArrayList<>(values)));
        return copy;
    }

    @Override
    public String toString() {
        return "ReportTable[" + rowCount + " rows x " + columns.size() + " columns " + columns.keySet() + "]";
    }
}
