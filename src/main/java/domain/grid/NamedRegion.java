package domain.grid;

/**
 * Descriptor of a workbook-scoped named range: name, owning sheet and area.
 */
public final class NamedRegion {

    private final String name;
    private final String sheet;
    private final CellArea area;

    public NamedRegion(String name, String sheet, CellArea area) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("range name is blank");
        if (sheet == null) throw new IllegalArgumentException("sheet is null");
        if (area == null) throw new IllegalArgumentException("area is null");
        this.name = name;
        this.sheet = sheet;
        this.area = area;
    }

    /**
     * Builds a descriptor from a qualified address ({@code 'Sheet 1'!$A$1:$B$3}).
     * Returns null when the address has no sheet prefix or is not a contiguous area.
     */
    public static NamedRegion parse(String name, String qualifiedAddress) {
        String sheet = CellAddresses.sheetOf(qualifiedAddress);
        CellArea area = CellAddresses.areaOf(qualifiedAddress);
        if (sheet == null || area == null) return null;
        return new NamedRegion(name, sheet, area);
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

    public String getAddress() {
        return CellAddresses.qualify(sheet, area);
    }

    public NamedRegion withArea(CellArea newArea) {
        return new NamedRegion(name, sheet, newArea);
    }

    @Override
    public String toString() {
        return "NamedRegion{" + name + " = " + getAddress() + '}';
    }
}
