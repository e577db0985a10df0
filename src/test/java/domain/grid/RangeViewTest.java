package domain.grid;

import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import infra.grid.MemoryCellStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeViewTest {

    enum Color { None, Red, Green }

    private MemoryCellStore store;
    private ListDiagnosticSink sink;

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    @BeforeEach
    void setUp() {
        store = new MemoryCellStore();
        store.addSheet("Calc");
        store.addNamedRange(new NamedRegion("Cell", "Calc", CellArea.of(2, 2, 1, 1)));
        store.setCell("Calc", 2, 2, "Green");
        store.setCell("Calc", 2, 5, "right");
        store.setCell("Calc", 5, 2, "below");
        sink = new ListDiagnosticSink();
    }

    @Test
    void singleCell_readsTopLeft() {
        RangeView cell = new RangeView(store, "Cell", sink);

        assertEquals("Calc", cell.getSheet());
        assertEquals(1, cell.getRowCount());
        assertEquals(1, cell.getColumnCount());
        assertEquals("Green", cell.getValue(String.class));
        assertEquals(Color.Green, cell.getEnum(Color.class).getValue());
    }

    @Test
    void setValues_growsRowsThenColumns() {
        RangeView grid = new RangeView(store, "Cell", sink);

        grid.setValues(List.of(row(1, 2, 3), row(4, 5, 6)));

        assertEquals(2, grid.getRowCount());
        assertEquals(3, grid.getColumnCount());
        assertEquals(6, grid.getValue(2, 3, int.class));
        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6)), grid.getValues(int.class));
        assertEquals("below", store.getCell("Calc", 6, 2));
        assertEquals("right", store.getCell("Calc", 2, 7));
        assertEquals("Calc!$B$2:$D$3", store.namedRange("Cell").getAddress());
        assertEquals(0, sink.size());
    }

    @Test
    void setValues_smallerGridKeepsExtent() {
        RangeView grid = new RangeView(store, "Cell", sink);
        grid.expandToFit(3, 2);

        grid.setValues(List.of(row("x")));

        assertEquals(3, grid.getRowCount());
        assertEquals(2, grid.getColumnCount());
        assertEquals("x", grid.getValue(String.class));
    }

    @Test
    void outOfBounds_reportsCellOutOfRange() {
        RangeView cell = new RangeView(store, "Cell", sink);

        assertNull(cell.getValue(2, 1, String.class));
        assertFalse(cell.setValue("x", 1, 0));
        assertEquals(0, cell.read(1, 2, int.class).getValue());

        assertEquals(2, sink.count(DiagnosticCode.CELL_OUT_OF_RANGE));
    }

    @Test
    void enum_unknownLabelReportsOnce() {
        store.setCell("Calc", 2, 2, "Blue");
        RangeView cell = new RangeView(store, "Cell", sink);

        CellRead<Color> read = cell.getEnum(Color.class);

        assertFalse(read.isPresent());
        assertEquals(Color.None, read.getValue());
        assertEquals(1, sink.count(DiagnosticCode.ENUM_LABEL_UNKNOWN));
    }

    @Test
    void numberRowsAndColumns() {
        RangeView grid = new RangeView(store, "Cell", sink);
        grid.expandToFit(3, 4);

        grid.numberRows();
        grid.numberColumns();

        assertEquals(List.of(1, 2, 3, 4), grid.getValues(int.class).get(0));
        assertEquals(2, grid.getValue(2, 1, int.class));
        assertEquals(3, grid.getValue(3, 1, int.class));
    }

    @Test
    void unknownRange_failsAtConstruction() {
        assertThrows(IllegalStateException.class, () -> new RangeView(store, "Nope", sink));
    }

    @Test
    void expandToFit_propagatesStoreRefusal() {
        RangeView cell = new RangeView(store, "Cell", sink);
        store.setCell("Calc", MemoryCellStore.MAX_ROWS, 2, "last");
        store.setCell("Calc", 2, MemoryCellStore.MAX_COLUMNS, "edge");

        assertThrows(StructuralEditException.class, () -> cell.expandToFit(3, 1));
        assertThrows(StructuralEditException.class, () -> cell.expandToFit(1, 3));

        assertEquals(1, cell.getRowCount());
        assertEquals(1, cell.getColumnCount());
        assertEquals("right", store.getCell("Calc", 2, 5));
    }
}
