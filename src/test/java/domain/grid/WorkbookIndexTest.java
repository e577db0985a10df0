package domain.grid;

import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import infra.grid.MemoryCellStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookIndexTest {

    private static MemoryCellStore twoSheets() {
        MemoryCellStore store = new MemoryCellStore();
        store.putTable("Ingredients", "Shop", 1, 1, List.of("Name", "Cost"), List.of(List.of("Herb", 2)));
        store.putTable("Potions", "Lab", 1, 1, List.of("Name", "Cost"), List.of(List.of("Potion A", 9)));
        store.addNamedRange(NamedRegion.parse("Gold", "Shop!$E$1"));
        return store;
    }

    @Test
    void load_registersTablesAndRangesByName() {
        ListDiagnosticSink sink = new ListDiagnosticSink();
        WorkbookIndex index = WorkbookIndex.load(twoSheets(), sink);

        assertEquals(List.of("Ingredients", "Potions"), index.tableNames());
        assertEquals(List.of("Gold"), index.rangeNames());
        assertEquals("Potion A", index.findTable("Potions").getValue(1, "Name", String.class));
        assertEquals("Shop", index.findRange("Gold").getSheet());
        assertEquals(0, sink.size());
    }

    @Test
    void find_missingNameReturnsNullSilently() {
        ListDiagnosticSink sink = new ListDiagnosticSink();
        WorkbookIndex index = WorkbookIndex.load(twoSheets(), sink);

        assertNull(index.findTable("ingredients"));
        assertNull(index.findRange("Silver"));
        assertNull(index.findTable(null));
        assertEquals(0, sink.size());
    }

    @Test
    void duplicateNames_keepFirstAndReport() {
        MemoryCellStore store = twoSheets();
        store.putTable("Potions", "Shop", 5, 1, List.of("Other"), List.of(List.of("x")));
        store.addNamedRange(NamedRegion.parse("Gold", "Lab!$A$9"));
        ListDiagnosticSink sink = new ListDiagnosticSink();

        WorkbookIndex index = WorkbookIndex.load(store, sink);

        assertEquals(2, index.tableNames().size());
        assertEquals(2, sink.count(DiagnosticCode.DUPLICATE_REGION_NAME));
        // sheets are scanned in order, so the Shop table wins over the Lab one
        assertTrue(index.findTable("Potions").hasColumn("Other"));
        assertEquals("Shop", index.findRange("Gold").getSheet());
    }

    @Test
    void rangeOnUnknownSheet_isSkipped() {
        MemoryCellStore store = twoSheets();
        store.addNamedRange(NamedRegion.parse("Lost", "Gone!$A$1"));

        WorkbookIndex index = WorkbookIndex.load(store, null);

        assertNull(index.findRange("Lost"));
        assertEquals(List.of("Gold"), index.rangeNames());
    }

    @Test
    void save_delegatesWholeStore() {
        MemoryCellStore store = twoSheets();
        WorkbookIndex index = WorkbookIndex.load(store, null);
        List<Path> saved = new ArrayList<>();

        index.save((s, p) -> {
            assertSame(store, s);
            saved.add(p);
        }, Path.of("out.xlsx"));

        assertEquals(List.of(Path.of("out.xlsx")), saved);
    }
}
