package domain.grid;

/**
 * Immutable rectangular block of a sheet, 1-based inclusive bounds.
 *
 * <p>Insertion helpers follow spreadsheet semantics: an area that starts at or after the
 * insertion point moves, an area that strictly contains it (first &lt; at &lt;= last) grows,
 * anything before it is untouched.</p>
 */
public final class CellArea {

    private final int firstRow;
    private final int firstColumn;
    private final int lastRow;
    private final int lastColumn;

    public CellArea(int firstRow, int firstColumn, int lastRow, int lastColumn) {
        if (firstRow < 1 || firstColumn < 1) {
            throw new IllegalArgumentException("area must start at row/column >= 1: " + firstRow + "," + firstColumn);
        }
        if (lastRow < firstRow || lastColumn < firstColumn) {
            throw new IllegalArgumentException("area end before start: "
                    + firstRow + "," + firstColumn + " -> " + lastRow + "," + lastColumn);
        }
        this.firstRow = firstRow;
        this.firstColumn = firstColumn;
        this.lastRow = lastRow;
        this.lastColumn = lastColumn;
    }

    public static CellArea of(int firstRow, int firstColumn, int rows, int columns) {
        return new CellArea(firstRow, firstColumn, firstRow + rows - 1, firstColumn + columns - 1);
    }

    public int getFirstRow() {
        return firstRow;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    public int getLastRow() {
        return lastRow;
    }

    public int getLastColumn() {
        return lastColumn;
    }

    public int rows() {
        return lastRow - firstRow + 1;
    }

    public int columns() {
        return lastColumn - firstColumn + 1;
    }

    public CellArea withRowsInserted(int at, int count) {
        if (at <= firstRow) return new CellArea(firstRow + count, firstColumn, lastRow + count, lastColumn);
        if (at <= lastRow) return new CellArea(firstRow, firstColumn, lastRow + count, lastColumn);
        return this;
    }

    public CellArea withColumnsInserted(int at, int count) {
        if (at <= firstColumn) return new CellArea(firstRow, firstColumn + count, lastRow, lastColumn + count);
        if (at <= lastColumn) return new CellArea(firstRow, firstColumn, lastRow, lastColumn + count);
        return this;
    }

    public CellArea withLastRow(int newLastRow) {
        return new CellArea(firstRow, firstColumn, newLastRow, lastColumn);
    }

    public CellArea withLastColumn(int newLastColumn) {
        return new CellArea(firstRow, firstColumn, lastRow, newLastColumn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellArea)) return false;
        CellArea that = (CellArea) o;
        return firstRow == that.firstRow && firstColumn == that.firstColumn
                && lastRow == that.lastRow && lastColumn == that.lastColumn;
    }

    @Override
    public int hashCode() {
        int h = firstRow;
        h = 31 * h + firstColumn;
        h = 31 * h + lastRow;
        h = 31 * h + lastColumn;
        return h;
    }

    @Override
    public String toString() {
        return CellAddresses.formatArea(this);
    }
}
