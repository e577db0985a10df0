package domain.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptor of a named table inside a sheet: its physical area, whether it carries a
 * header and/or a totals row, and its column labels as declared by the table.
 *
 * <p>Immutable. Structural edits produce a new descriptor which the {@link CellStore}
 * keeps; views always re-derive the current descriptor from the store.</p>
 */
public final class TableRegion {

    private final String name;
    private final String sheet;
    private final CellArea area;
    private final int headerRowCount;
    private final int totalsRowCount;
    private final List<String> columnNames;

    public TableRegion(
            String name,
            String sheet,
            CellArea area,
            int headerRowCount,
            int totalsRowCount,
            List<String> columnNames
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name is blank");
        if (sheet == null) throw new IllegalArgumentException("sheet is null");
        if (area == null) throw new IllegalArgumentException("area is null");
        if (headerRowCount < 0 || headerRowCount > 1) {
            throw new IllegalArgumentException("headerRowCount must be 0 or 1: " + headerRowCount);
        }
        if (totalsRowCount < 0 || totalsRowCount > 1) {
            throw new IllegalArgumentException("totalsRowCount must be 0 or 1: " + totalsRowCount);
        }
        if (area.rows() < headerRowCount + totalsRowCount) {
            throw new IllegalArgumentException("table '" + name + "' area " + area
                    + " cannot hold header and totals rows");
        }
        this.name = name;
        this.sheet = sheet;
        this.area = area;
        this.headerRowCount = headerRowCount;
        this.totalsRowCount = totalsRowCount;
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames == null ? List.of() : columnNames));
    }

    public String getName() {
        return name;
    }

    public String getSheet() {
        return sheet;
    }

    public CellArea getArea() {
        return area;
    }

    public int getHeaderRowCount() {
        return headerRowCount;
    }

    public int getTotalsRowCount() {
        return totalsRowCount;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    /** Physical rows minus header minus totals. Never negative. */
    public int getDataRowCount() {
        return Math.max(0, area.rows() - headerRowCount - totalsRowCount);
    }

    /** Sheet row of data row 1. */
    public int getFirstDataRow() {
        return area.getFirstRow() + headerRowCount;
    }

    public TableRegion withArea(CellArea newArea) {
        return new TableRegion(name, sheet, newArea, headerRowCount, totalsRowCount, columnNames);
    }

    @Override
    public String toString() {
        return "TableRegion{" + name + " @ " + CellAddresses.qualify(sheet, area)
                + ", header=" + headerRowCount + ", totals=" + totalsRowCount + '}';
    }
}
