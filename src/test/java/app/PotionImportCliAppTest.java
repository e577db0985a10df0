package app;

import domain.grid.CellArea;
import domain.grid.NamedRegion;
import infra.catalog.CatalogCsvReader;
import infra.catalog.CatalogSnapshot;
import infra.grid.MemoryCellStore;
import infra.xlsx.XlsxCellStoreReader;
import infra.xlsx.XlsxCellStoreWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PotionImportCliAppTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void cleanupProps() {
        System.clearProperty("baseDir");
    }

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    private Path writeWorkbook(String rarityOfHerb) {
        MemoryCellStore store = new MemoryCellStore();
        store.putTable("Ingredients", "Ingredients", 1, 1,
                List.of("Name", "Rarity", "Cost"),
                List.of(row("Herb", rarityOfHerb, 2), row("Water", "Common", 1)));
        store.putTable("Potions", "Potions", 1, 1,
                List.of("Name", "Rarity", "Cost", "Uses", "Max Profit"),
                List.of(row("Potion A", "Rare", 10, 3, 25)));
        store.putTable("Recipes", "Recipes", 1, 1,
                List.of("Potion", "Item 1", "Item 2", "Item 3"),
                List.of(row("Potion A", "Herb", "Water", "")));
        store.addNamedRange(new NamedRegion("Version", "Potions", new CellArea(10, 1, 10, 1)));

        Path file = tempDir.resolve("data/PotionCrafting.xlsx");
        new XlsxCellStoreWriter().save(store, file);
        return file;
    }

    @Test
    void run_importsWorkbookAndWritesCatalog() {
        writeWorkbook("Common");

        int code = PotionImportCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--saveWorkbook=output/copy.xlsx"
        });

        assertEquals(PotionImportCliApp.EXIT_OK, code);
        Path catalogDir = tempDir.resolve("output/catalog");
        assertTrue(Files.isRegularFile(catalogDir.resolve("items.csv")));
        assertTrue(Files.isRegularFile(catalogDir.resolve("recipes.csv")));

        CatalogSnapshot snapshot = new CatalogCsvReader().read(catalogDir, null);
        assertEquals(3, snapshot.getItems().size());
        assertSame(snapshot.getItems().resolve("Potion A"),
                snapshot.getRecipes().findProduct(snapshot.getItems().resolve("Water"), snapshot.getItems().resolve("Herb")));

        MemoryCellStore copy = new XlsxCellStoreReader().read(tempDir.resolve("output/copy.xlsx"));
        assertNotNull(copy.table("Recipes"));
        assertNotNull(copy.namedRange("Version"));
    }

    @Test
    void run_customTableNamesAndOutDir() {
        writeWorkbook("Common");

        int code = PotionImportCliApp.run(new String[]{
                "--baseDir", tempDir.toString(),
                "--out", "cat",
                "--recipesTable=Brews"
        });

        assertEquals(PotionImportCliApp.EXIT_OK, code);
        CatalogSnapshot snapshot = new CatalogCsvReader().read(tempDir.resolve("cat"), null);
        assertEquals(3, snapshot.getItems().size());
        assertTrue(snapshot.getRecipes().isEmpty());
    }

    @Test
    void run_failOnErrorReturnsTwoWhenErrorsReported() {
        writeWorkbook("Mythic");

        int lenient = PotionImportCliApp.run(new String[]{"--baseDir=" + tempDir});
        int strict = PotionImportCliApp.run(new String[]{"--baseDir=" + tempDir, "--failOnError"});

        assertEquals(PotionImportCliApp.EXIT_OK, lenient);
        assertEquals(PotionImportCliApp.EXIT_DIAGNOSTIC_ERRORS, strict);
    }

    @Test
    void run_missingWorkbookReturnsOne() {
        int code = PotionImportCliApp.run(new String[]{"--baseDir=" + tempDir, "--workbook=nope.xlsx"});

        assertEquals(PotionImportCliApp.EXIT_FAILED, code);
        assertFalse(Files.exists(tempDir.resolve("output/catalog")));
    }
}
