package domain.grid;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Name-addressed access to a table: header row, data rows, optional totals row.
 *
 * <p>Rows are 1-based on the data axis (row 1 is the first row under the header).
 * Columns are addressed by header label, exact and case-sensitive.</p>
 *
 * <p>The table's anchor and extent are re-derived from the {@link CellStore} on every call,
 * so growth is visible immediately and {@link #getRowCount()} is never stale. The column
 * index is built once, at construction.</p>
 *
 * <p>Data-shape problems never throw. {@code read*} methods return a {@link CellRead}
 * carrying the diagnostics; {@code get*}/{@code set*} methods report to the sink and fall
 * back to the type default (or {@code false}).</p>
 */
public final class TableView {

    private static final Logger log = LoggerFactory.getLogger(TableView.class);

    private final CellStore store;
    private final String name;
    private final ColumnIndex columns;
    private final DiagnosticSink sink;

    public TableView(CellStore store, String name, DiagnosticSink sink) {
        if (store == null) throw new IllegalArgumentException("store is null");
        this.store = store;
        this.name = name;
        this.sink = sink == null ? DiagnosticSink.none() : sink;
        this.columns = ColumnIndex.fromHeader(headerLabels(region()));
    }

    private List<String> headerLabels(TableRegion r) {
        if (r.getHeaderRowCount() == 0) return r.getColumnNames();
        CellArea a = r.getArea();
        List<String> labels = new ArrayList<>(a.columns());
        for (int c = a.getFirstColumn(); c <= a.getLastColumn(); c++) {
            labels.add(CellValues.coerce(store.getCell(r.getSheet(), a.getFirstRow(), c), String.class));
        }
        return labels;
    }

    TableRegion region() {
        TableRegion r = store.table(name);
        if (r == null) throw new IllegalStateException("table '" + name + "' no longer exists in the store");
        return r;
    }

    public String getName() {
        return name;
    }

    public int getRowCount() {
        return region().getDataRowCount();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return columns.names();
    }

    public boolean hasColumn(String columnName) {
        return columns.contains(columnName);
    }

    // ------------------------------------------------------------
    // reads
    // ------------------------------------------------------------

    public <T> CellRead<T> read(int row, String columnName, Class<T> type) {
        T def = CellValues.defaultValue(type);
        TableRegion r = region();

        int rows = r.getDataRowCount();
        if (row < 1 || row > rows) {
            return CellRead.failed(def, Diagnostic.of(DiagnosticCode.ROW_OUT_OF_RANGE, name, row, columnName,
                    "Tried to access row " + row + " of table '" + name + "'. Valid rows are 1 - " + rows + "."));
        }

        int p = columns.resolve(columnName);
        if (p < 0) return CellRead.failed(def, columnMissing(columnName));

        Object raw = store.getCell(r.getSheet(), r.getFirstDataRow() + row - 1, r.getArea().getFirstColumn() + p);
        T v = CellValues.coerce(raw, type);
        return v == null ? CellRead.absent(def) : CellRead.of(v);
    }

    public <T> T getValue(int row, String columnName, Class<T> type) {
        return emit(read(row, columnName, type)).getValue();
    }

    /**
     * Reads a label and maps it to an enum member by exact name.
     * Blank cell: absent, no diagnostic. Unknown label: absent, one {@code ENUM_LABEL_UNKNOWN}.
     * The value of an absent read is the enum's first member.
     */
    public <E extends Enum<E>> CellRead<E> readEnum(int row, String columnName, Class<E> enumType) {
        E zero = CellValues.zeroMember(enumType);
        CellRead<String> label = read(row, columnName, String.class);
        if (label.hasDiagnostics()) return CellRead.failedLike(label, zero);

        String text = label.getValue();
        if (text == null || text.isBlank()) return CellRead.absent(zero);

        E value = CellValues.parseEnum(text, enumType);
        if (value != null) return CellRead.of(value);

        return CellRead.failed(zero, Diagnostic.of(DiagnosticCode.ENUM_LABEL_UNKNOWN, name, row, columnName,
                "Unknown " + enumType.getSimpleName() + " value '" + text + "' in table " + name
                        + ", row " + row + ", column " + columnName + "."));
    }

    public <E extends Enum<E>> CellRead<E> getEnum(int row, String columnName, Class<E> enumType) {
        return emit(readEnum(row, columnName, enumType));
    }

    /**
     * One column, data rows 1..rowCount. Null (with a diagnostic) if the column is missing.
     * Unreadable cells hold the type default.
     */
    public <T> List<T> getColumnValues(String columnName, Class<T> type) {
        int p = resolveOrReport(columnName);
        if (p < 0) return null;

        TableRegion r = region();
        int rows = r.getDataRowCount();
        int col = r.getArea().getFirstColumn() + p;
        List<T> values = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            values.add(CellValues.coerceOrDefault(store.getCell(r.getSheet(), r.getFirstDataRow() + i, col), type));
        }
        return values;
    }

    /**
     * {@code width} consecutive physical columns starting at {@code startColumnName}.
     * Only the first column is looked up by name; the rest are positional, which is how
     * fixed-width groups such as "Item 1".."Item 3" are read in one go.
     *
     * @return rows x width, or null (with a diagnostic) if the start column is missing
     */
    public <T> List<List<T>> getColumnBlock(String startColumnName, int width, Class<T> type) {
        if (width < 1) throw new IllegalArgumentException("width must be >= 1: " + width);
        int p = resolveOrReport(startColumnName);
        if (p < 0) return null;

        TableRegion r = region();
        int rows = r.getDataRowCount();
        int startCol = r.getArea().getFirstColumn() + p;
        List<List<T>> block = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            List<T> line = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                line.add(CellValues.coerceOrDefault(store.getCell(r.getSheet(), r.getFirstDataRow() + i, startCol + c), type));
            }
            block.add(line);
        }
        return block;
    }

    // ------------------------------------------------------------
    // writes
    // ------------------------------------------------------------

    public boolean setValue(int row, String columnName, Object value) {
        TableRegion r = region();
        int rows = r.getDataRowCount();
        if (row < 1 || row > rows) {
            sink.report(Diagnostic.of(DiagnosticCode.ROW_OUT_OF_RANGE, name, row, columnName,
                    "Tried to write row " + row + " of table '" + name + "'. Valid rows are 1 - " + rows + "."));
            return false;
        }
        int p = resolveOrReport(columnName);
        if (p < 0) return false;

        store.setCell(r.getSheet(), r.getFirstDataRow() + row - 1, r.getArea().getFirstColumn() + p, CellValues.toRaw(value));
        return true;
    }

    /**
     * Overwrites a block of consecutive columns starting at {@code startColumnName}, from data
     * row 1. If there are more rows than the table holds, rows are inserted right after the
     * header first. The start column is resolved before any growth: on failure nothing is
     * inserted or written.
     *
     * @param values rows of values; ragged rows write only the cells they have
     */
    public boolean setColumnBlock(String startColumnName, List<? extends List<?>> values) {
        if (values == null) throw new IllegalArgumentException("values is null");
        int p = resolveOrReport(startColumnName);
        if (p < 0) return false;

        growTo(values.size());

        TableRegion r = region();
        int startCol = r.getArea().getFirstColumn() + p;
        for (int i = 0; i < values.size(); i++) {
            List<?> line = values.get(i);
            if (line == null) continue;
            for (int c = 0; c < line.size(); c++) {
                store.setCell(r.getSheet(), r.getFirstDataRow() + i, startCol + c, CellValues.toRaw(line.get(c)));
            }
        }
        return true;
    }

    /**
     * Overwrites one column from data row 1, growing the table if needed.
     *
     * @param appendIfAbsent when the column is missing, append it (header label included)
     *                       instead of failing; a blank name is always reported as missing
     */
    public boolean setColumn(String columnName, List<?> values, boolean appendIfAbsent) {
        if (values == null) throw new IllegalArgumentException("values is null");

        int p = columns.resolve(columnName);
        if (p < 0) {
            // a blank label cannot be appended as a header
            if (!appendIfAbsent || columnName == null || columnName.isBlank()) {
                sink.report(columnMissing(columnName));
                return false;
            }
            p = appendColumn(columnName);
        }

        growTo(values.size());

        TableRegion r = region();
        int col = r.getArea().getFirstColumn() + p;
        for (int i = 0; i < values.size(); i++) {
            store.setCell(r.getSheet(), r.getFirstDataRow() + i, col, CellValues.toRaw(values.get(i)));
        }
        return true;
    }

    /** Writes 1..rowCount down the named column. */
    public void numberRows(String columnName) {
        int p = resolveOrReport(columnName);
        if (p < 0) return;

        TableRegion r = region();
        int col = r.getArea().getFirstColumn() + p;
        for (int row = 1; row <= r.getDataRowCount(); row++) {
            store.setCell(r.getSheet(), r.getFirstDataRow() + row - 1, col, CellValues.toRaw(row));
        }
    }

    /**
     * Inserts one physical column right after the last known column, writes its header
     * label and registers it. Call sites check {@link #hasColumn} first.
     *
     * @return zero-based position of the new column
     */
    public int appendColumn(String columnName) {
        if (columnName == null || columnName.isBlank()) throw new IllegalArgumentException("column name is blank");
        if (columns.contains(columnName)) throw new IllegalArgumentException("column already present: " + columnName);

        TableRegion r = region();
        int at = r.getArea().getFirstColumn() + columns.size();
        store.insertColumns(r.getSheet(), at, 1);
        if (r.getHeaderRowCount() > 0) {
            store.setCell(r.getSheet(), r.getArea().getFirstRow(), at, columnName);
        }

        TableRegion after = region();
        CellArea widened = new CellArea(after.getArea().getFirstRow(), after.getArea().getFirstColumn(),
                after.getArea().getLastRow(), at);
        List<String> names = new ArrayList<>(columns.names());
        names.add(columnName);
        store.updateTable(new TableRegion(after.getName(), after.getSheet(), widened,
                after.getHeaderRowCount(), after.getTotalsRowCount(), names));

        log.debug("Appended column '{}' to table '{}' at sheet column {}", columnName, name, at);
        return columns.append(columnName);
    }

    // ------------------------------------------------------------
    // internals
    // ------------------------------------------------------------

    private void growTo(int rows) {
        TableRegion r = region();
        int have = r.getDataRowCount();
        if (rows <= have) return;

        int missing = rows - have;
        store.insertRows(r.getSheet(), r.getFirstDataRow(), missing);

        // a header-less table moves instead of growing, a header-only table does not absorb
        // rows inserted below it: pin the area to the original anchor and the new height
        TableRegion after = region();
        CellArea a = r.getArea();
        CellArea target = new CellArea(a.getFirstRow(), after.getArea().getFirstColumn(),
                a.getFirstRow() + r.getHeaderRowCount() + rows + r.getTotalsRowCount() - 1,
                after.getArea().getLastColumn());
        if (!target.equals(after.getArea())) {
            store.updateTable(after.withArea(target));
        }
        log.debug("Grew table '{}' by {} rows (now {})", name, missing, rows);
    }

    private int resolveOrReport(String columnName) {
        int p = columns.resolve(columnName);
        if (p < 0) sink.report(columnMissing(columnName));
        return p;
    }

    private Diagnostic columnMissing(String columnName) {
        return new Diagnostic(DiagnosticCode.COLUMN_NOT_FOUND, name, 0, columnName,
                "Cannot find column named '" + columnName + "' in table " + name + ".",
                columns.describeMiss(columnName));
    }

    private <T> CellRead<T> emit(CellRead<T> read) {
        for (Diagnostic d : read.getDiagnostics()) sink.report(d);
        return read;
    }

    @Override
    public String toString() {
        return "TableView{" + name + ", rows=" + getRowCount() + ", columns=" + columns.names() + '}';
    }
}
