package infra.grid;

import domain.grid.CellArea;
import domain.grid.CellStore;
import domain.grid.CellValues;
import domain.grid.NamedRegion;
import domain.grid.StructuralEditException;
import domain.grid.TableRegion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Sparse in-memory {@link CellStore}.
 *
 * <p>Each sheet is a row -> (column -> value) tree. Table and named range descriptors are
 * kept alongside and shifted on row/column insertion. Sheet limits are those of XLSX
 * (1,048,576 rows x 16,384 columns); an insertion that would push a cell past them is
 * rejected with {@link StructuralEditException}.</p>
 */
public final class MemoryCellStore implements CellStore {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private final Map<String, NavigableMap<Integer, NavigableMap<Integer, Object>>> sheets = new LinkedHashMap<>();
    private final List<TableRegion> tables = new ArrayList<>();
    private final List<NamedRegion> namedRanges = new ArrayList<>();

    // ------------------------------------------------------------
    // building
    // ------------------------------------------------------------

    public MemoryCellStore addSheet(String sheet) {
        if (sheet == null || sheet.isBlank()) throw new IllegalArgumentException("sheet name is blank");
        sheets.putIfAbsent(sheet, new TreeMap<>());
        return this;
    }

    /** Registers a table whose column names are taken from its header row (trimmed). */
    public MemoryCellStore addTable(String name, String sheet, CellArea area, boolean hasHeader, boolean hasTotals) {
        requireSheet(sheet);
        List<String> names = new ArrayList<>(area.columns());
        for (int c = area.getFirstColumn(); c <= area.getLastColumn(); c++) {
            String label = hasHeader ? CellValues.coerce(getCell(sheet, area.getFirstRow(), c), String.class) : null;
            names.add(label == null || label.isBlank()
                    ? "Column" + (c - area.getFirstColumn() + 1)
                    : label.trim());
        }
        return addTable(new TableRegion(name, sheet, area, hasHeader ? 1 : 0, hasTotals ? 1 : 0, names));
    }

    public MemoryCellStore addTable(TableRegion region) {
        requireSheet(region.getSheet());
        tables.add(region);
        return this;
    }

    public MemoryCellStore addNamedRange(NamedRegion region) {
        namedRanges.add(region);
        return this;
    }

    /**
     * Writes a header row at {@code (row, column)} followed by data rows and registers the
     * block as a table. Convenience for building workbooks in code.
     */
    public MemoryCellStore putTable(String name, String sheet, int row, int column,
                                    List<String> header, List<? extends List<?>> data) {
        addSheet(sheet);
        for (int c = 0; c < header.size(); c++) {
            setCell(sheet, row, column + c, header.get(c));
        }
        for (int r = 0; r < data.size(); r++) {
            List<?> line = data.get(r);
            for (int c = 0; c < line.size(); c++) {
                setCell(sheet, row + 1 + r, column + c, CellValues.toRaw(line.get(c)));
            }
        }
        return addTable(name, sheet, new CellArea(row, column, row + data.size(), column + header.size() - 1), true, false);
    }

    // ------------------------------------------------------------
    // CellStore
    // ------------------------------------------------------------

    @Override
    public List<String> sheetNames() {
        return Collections.unmodifiableList(new ArrayList<>(sheets.keySet()));
    }

    @Override
    public boolean hasSheet(String sheet) {
        return sheet != null && sheets.containsKey(sheet);
    }

    @Override
    public Object getCell(String sheet, int row, int column) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = sheets.get(sheet);
        if (grid == null) return null;
        NavigableMap<Integer, Object> cells = grid.get(row);
        return cells == null ? null : cells.get(column);
    }

    @Override
    public void setCell(String sheet, int row, int column, Object value) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = requireSheet(sheet);
        if (row < 1 || row > MAX_ROWS || column < 1 || column > MAX_COLUMNS) {
            throw new IllegalArgumentException("cell out of sheet bounds: " + sheet + "!" + row + "," + column);
        }
        if (value == null) {
            NavigableMap<Integer, Object> cells = grid.get(row);
            if (cells != null) {
                cells.remove(column);
                if (cells.isEmpty()) grid.remove(row);
            }
            return;
        }
        grid.computeIfAbsent(row, k -> new TreeMap<>()).put(column, value);
    }

    @Override
    public void insertRows(String sheet, int at, int count) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = checkInsert(sheet, at, count, MAX_ROWS, "row");
        if (!grid.isEmpty() && grid.lastKey() >= at && grid.lastKey() + count > MAX_ROWS) {
            throw new StructuralEditException("inserting " + count + " rows at " + at + " on sheet '" + sheet
                    + "' would push data past row " + MAX_ROWS);
        }

        List<Integer> moving = new ArrayList<>(grid.tailMap(at, true).descendingKeySet());
        for (Integer r : moving) {
            grid.put(r + count, grid.remove(r));
        }

        for (int i = 0; i < tables.size(); i++) {
            TableRegion t = tables.get(i);
            if (t.getSheet().equals(sheet)) tables.set(i, t.withArea(t.getArea().withRowsInserted(at, count)));
        }
        for (int i = 0; i < namedRanges.size(); i++) {
            NamedRegion n = namedRanges.get(i);
            if (n.getSheet().equals(sheet)) namedRanges.set(i, n.withArea(n.getArea().withRowsInserted(at, count)));
        }
    }

    @Override
    public void insertColumns(String sheet, int at, int count) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = checkInsert(sheet, at, count, MAX_COLUMNS, "column");
        for (NavigableMap<Integer, Object> cells : grid.values()) {
            if (!cells.isEmpty() && cells.lastKey() >= at && cells.lastKey() + count > MAX_COLUMNS) {
                throw new StructuralEditException("inserting " + count + " columns at " + at + " on sheet '" + sheet
                        + "' would push data past column " + MAX_COLUMNS);
            }
        }

        for (NavigableMap<Integer, Object> cells : grid.values()) {
            List<Integer> moving = new ArrayList<>(cells.tailMap(at, true).descendingKeySet());
            for (Integer c : moving) {
                cells.put(c + count, cells.remove(c));
            }
        }

        for (int i = 0; i < tables.size(); i++) {
            TableRegion t = tables.get(i);
            if (t.getSheet().equals(sheet)) tables.set(i, t.withArea(t.getArea().withColumnsInserted(at, count)));
        }
        for (int i = 0; i < namedRanges.size(); i++) {
            NamedRegion n = namedRanges.get(i);
            if (n.getSheet().equals(sheet)) namedRanges.set(i, n.withArea(n.getArea().withColumnsInserted(at, count)));
        }
    }

    @Override
    public List<TableRegion> tables(String sheet) {
        List<TableRegion> out = new ArrayList<>();
        for (TableRegion t : tables) {
            if (t.getSheet().equals(sheet)) out.add(t);
        }
        return out;
    }

    @Override
    public TableRegion table(String name) {
        int i = indexOfTable(name);
        return i < 0 ? null : tables.get(i);
    }

    @Override
    public void updateTable(TableRegion region) {
        int i = indexOfTable(region.getName());
        if (i < 0) throw new IllegalArgumentException("unknown table: " + region.getName());
        tables.set(i, region);
    }

    @Override
    public List<NamedRegion> namedRanges() {
        return Collections.unmodifiableList(new ArrayList<>(namedRanges));
    }

    @Override
    public NamedRegion namedRange(String name) {
        for (NamedRegion n : namedRanges) {
            if (n.getName().equals(name)) return n;
        }
        return null;
    }

    @Override
    public void updateNamedRange(NamedRegion region) {
        for (int i = 0; i < namedRanges.size(); i++) {
            if (namedRanges.get(i).getName().equals(region.getName())) {
                namedRanges.set(i, region);
                return;
            }
        }
        throw new IllegalArgumentException("unknown named range: " + region.getName());
    }

    @Override
    public Map<Integer, Map<Integer, Object>> cells(String sheet) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = sheets.get(sheet);
        if (grid == null) return Map.of();
        Map<Integer, Map<Integer, Object>> copy = new TreeMap<>();
        grid.forEach((r, cells) -> copy.put(r, Collections.unmodifiableMap(cells)));
        return Collections.unmodifiableMap(copy);
    }

    // ------------------------------------------------------------
    // internals
    // ------------------------------------------------------------

    // sheet order first, registration order within a sheet
    private int indexOfTable(String name) {
        for (String sheet : sheets.keySet()) {
            for (int i = 0; i < tables.size(); i++) {
                TableRegion t = tables.get(i);
                if (t.getSheet().equals(sheet) && t.getName().equals(name)) return i;
            }
        }
        return -1;
    }

    private NavigableMap<Integer, NavigableMap<Integer, Object>> requireSheet(String sheet) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = sheets.get(sheet);
        if (grid == null) throw new IllegalArgumentException("unknown sheet: " + sheet);
        return grid;
    }

    private NavigableMap<Integer, NavigableMap<Integer, Object>> checkInsert(String sheet, int at, int count, int max, String what) {
        NavigableMap<Integer, NavigableMap<Integer, Object>> grid = sheets.get(sheet);
        if (grid == null) throw new StructuralEditException("cannot insert " + what + "s into unknown sheet '" + sheet + "'");
        if (count < 1) throw new StructuralEditException(what + " count must be >= 1: " + count);
        if (at < 1 || at > max) throw new StructuralEditException(what + " insertion point out of bounds: " + at);
        return grid;
    }
}
