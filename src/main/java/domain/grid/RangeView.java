package domain.grid;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional access to a named range: (row, column) offsets from the anchor, both 1-based.
 * No column names.
 *
 * <p>Like {@link TableView}, the area is re-derived from the store on every call.</p>
 */
public final class RangeView {

    private static final Logger log = LoggerFactory.getLogger(RangeView.class);

    private final CellStore store;
    private final String name;
    private final DiagnosticSink sink;

    public RangeView(CellStore store, String name, DiagnosticSink sink) {
        if (store == null) throw new IllegalArgumentException("store is null");
        this.store = store;
        this.name = name;
        this.sink = sink == null ? DiagnosticSink.none() : sink;
        region();
    }

    NamedRegion region() {
        NamedRegion r = store.namedRange(name);
        if (r == null) throw new IllegalStateException("named range '" + name + "' no longer exists in the store");
        return r;
    }

    public String getName() {
        return name;
    }

    public String getSheet() {
        return region().getSheet();
    }

    public int getRowCount() {
        return region().getArea().rows();
    }

    public int getColumnCount() {
        return region().getArea().columns();
    }

    public <T> CellRead<T> read(int row, int column, Class<T> type) {
        T def = CellValues.defaultValue(type);
        NamedRegion r = region();
        Diagnostic outside = checkBounds(r, row, column);
        if (outside != null) return CellRead.failed(def, outside);

        Object raw = store.getCell(r.getSheet(), r.getArea().getFirstRow() + row - 1, r.getArea().getFirstColumn() + column - 1);
        T v = CellValues.coerce(raw, type);
        return v == null ? CellRead.absent(def) : CellRead.of(v);
    }

    /** Top-left cell. */
    public <T> T getValue(Class<T> type) {
        return getValue(1, 1, type);
    }

    public <T> T getValue(int row, int column, Class<T> type) {
        return emit(read(row, column, type)).getValue();
    }

    public <E extends Enum<E>> CellRead<E> readEnum(int row, int column, Class<E> enumType) {
        E zero = CellValues.zeroMember(enumType);
        CellRead<String> label = read(row, column, String.class);
        if (label.hasDiagnostics()) return CellRead.failedLike(label, zero);

        String text = label.getValue();
        if (text == null || text.isBlank()) return CellRead.absent(zero);

        E value = CellValues.parseEnum(text, enumType);
        if (value != null) return CellRead.of(value);

        return CellRead.failed(zero, Diagnostic.of(DiagnosticCode.ENUM_LABEL_UNKNOWN, name, row, String.valueOf(column),
                "Unknown " + enumType.getSimpleName() + " value '" + text + "' in range '" + name
                        + "', row " + row + ", column " + column + "."));
    }

    public <E extends Enum<E>> CellRead<E> getEnum(Class<E> enumType) {
        return getEnum(1, 1, enumType);
    }

    public <E extends Enum<E>> CellRead<E> getEnum(int row, int column, Class<E> enumType) {
        return emit(readEnum(row, column, enumType));
    }

    /** Whole range as rows x columns; unreadable cells hold the type default. */
    public <T> List<List<T>> getValues(Class<T> type) {
        NamedRegion r = region();
        CellArea a = r.getArea();
        List<List<T>> values = new ArrayList<>(a.rows());
        for (int row = a.getFirstRow(); row <= a.getLastRow(); row++) {
            List<T> line = new ArrayList<>(a.columns());
            for (int col = a.getFirstColumn(); col <= a.getLastColumn(); col++) {
                line.add(CellValues.coerceOrDefault(store.getCell(r.getSheet(), row, col), type));
            }
            values.add(line);
        }
        return values;
    }

    /** Writes the top-left cell. */
    public boolean setValue(Object value) {
        return setValue(value, 1, 1);
    }

    public boolean setValue(Object value, int row, int column) {
        NamedRegion r = region();
        Diagnostic outside = checkBounds(r, row, column);
        if (outside != null) {
            sink.report(outside);
            return false;
        }
        store.setCell(r.getSheet(), r.getArea().getFirstRow() + row - 1, r.getArea().getFirstColumn() + column - 1,
                CellValues.toRaw(value));
        return true;
    }

    /**
     * Overwrites the range from its anchor. A larger grid grows the range first
     * (see {@link #expandToFit}); a smaller one leaves the remaining cells untouched.
     */
    public void setValues(List<? extends List<?>> values) {
        if (values == null) throw new IllegalArgumentException("values is null");
        int rows = values.size();
        int cols = 0;
        for (List<?> line : values) {
            if (line != null) cols = Math.max(cols, line.size());
        }

        expandToFit(rows, cols);

        NamedRegion r = region();
        int startRow = r.getArea().getFirstRow();
        int startCol = r.getArea().getFirstColumn();
        for (int i = 0; i < rows; i++) {
            List<?> line = values.get(i);
            if (line == null) continue;
            for (int c = 0; c < line.size(); c++) {
                store.setCell(r.getSheet(), startRow + i, startCol + c, CellValues.toRaw(line.get(c)));
            }
        }
    }

    /** Fills the first column with 1..rowCount. */
    public void numberRows() {
        NamedRegion r = region();
        CellArea a = r.getArea();
        for (int row = 1; row <= a.rows(); row++) {
            store.setCell(r.getSheet(), a.getFirstRow() + row - 1, a.getFirstColumn(), CellValues.toRaw(row));
        }
    }

    /** Fills the first row with 1..columnCount. */
    public void numberColumns() {
        NamedRegion r = region();
        CellArea a = r.getArea();
        for (int column = 1; column <= a.columns(); column++) {
            store.setCell(r.getSheet(), a.getFirstRow(), a.getFirstColumn() + column - 1, CellValues.toRaw(column));
        }
    }

    /**
     * Grows the range without writing: rows are inserted right after the anchor row, then
     * columns right after the anchor column, each compared with the current extent.
     */
    public void expandToFit(int rows, int columns) {
        NamedRegion r = region();
        int haveRows = r.getArea().rows();
        if (rows > haveRows) {
            store.insertRows(r.getSheet(), r.getArea().getFirstRow() + 1, rows - haveRows);
            NamedRegion after = region();
            CellArea target = after.getArea().withLastRow(after.getArea().getFirstRow() + rows - 1);
            if (!target.equals(after.getArea())) store.updateNamedRange(after.withArea(target));
            log.debug("Grew range '{}' by {} rows", name, rows - haveRows);
        }

        r = region();
        int haveCols = r.getArea().columns();
        if (columns > haveCols) {
            store.insertColumns(r.getSheet(), r.getArea().getFirstColumn() + 1, columns - haveCols);
            NamedRegion after = region();
            CellArea target = after.getArea().withLastColumn(after.getArea().getFirstColumn() + columns - 1);
            if (!target.equals(after.getArea())) store.updateNamedRange(after.withArea(target));
            log.debug("Grew range '{}' by {} columns", name, columns - haveCols);
        }
    }

    private Diagnostic checkBounds(NamedRegion r, int row, int column) {
        CellArea a = r.getArea();
        if (row >= 1 && row <= a.rows() && column >= 1 && column <= a.columns()) return null;
        return Diagnostic.of(DiagnosticCode.CELL_OUT_OF_RANGE, name, Math.max(row, 0), String.valueOf(column),
                "Tried to access row " + row + ", column " + column + " of range '" + name
                        + "'. Valid cells are 1 - " + a.rows() + " x 1 - " + a.columns() + ".");
    }

    private <T> CellRead<T> emit(CellRead<T> read) {
        for (Diagnostic d : read.getDiagnostics()) sink.report(d);
        return read;
    }

    @Override
    public String toString() {
        return "RangeView{" + region().getAddress() + '}';
    }
}
