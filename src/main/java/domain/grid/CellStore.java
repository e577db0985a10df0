package domain.grid;

import java.util.List;
import java.util.Map;

/**
 * Raw addressable grid the views are built on.
 *
 * <p>All coordinates are 1-based absolute sheet coordinates. Cell values are untyped:
 * {@code String}, {@code Double}, {@code Boolean} or null for an empty cell.
 * Row/column insertion shifts every cell at or after the insertion point and adjusts the
 * region descriptors of that sheet (see {@link CellArea#withRowsInserted}).</p>
 *
 * <p>Not thread-safe. Callers must sequence structural edits.</p>
 */
public interface CellStore {

    List<String> sheetNames();

    boolean hasSheet(String sheet);

    Object getCell(String sheet, int row, int column);

    void setCell(String sheet, int row, int column, Object value);

    /** Non-empty cells of one sheet as row -> (column -> value), in ascending order. */
    Map<Integer, Map<Integer, Object>> cells(String sheet);

    /**
     * @throws StructuralEditException if the sheet is unknown, the arguments are invalid,
     *                                  or the shift would push cells past the sheet limit
     */
    void insertRows(String sheet, int at, int count);

    /**
     * @throws StructuralEditException if the sheet is unknown, the arguments are invalid,
     *                                  or the shift would push cells past the sheet limit
     */
    void insertColumns(String sheet, int at, int count);

    /** Tables of one sheet, in registration order. */
    List<TableRegion> tables(String sheet);

    /** Current descriptor of the first table with this name (sheet order, then registration order), or null. */
    TableRegion table(String name);

    /** Replaces the stored descriptor of the table with the same name. */
    void updateTable(TableRegion region);

    /** Workbook-scoped named ranges, in registration order. */
    List<NamedRegion> namedRanges();

    /** Current descriptor of the first named range with this name, or null. */
    NamedRegion namedRange(String name);

    /** Replaces the stored descriptor of the named range with the same name. */
    void updateNamedRange(NamedRegion region);
}
