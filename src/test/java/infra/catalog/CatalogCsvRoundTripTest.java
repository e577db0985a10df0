package infra.catalog;

import domain.item.InventoryItem;
import domain.item.ItemCatalog;
import domain.item.Rarity;
import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import domain.recipe.RecipeIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogCsvRoundTripTest {

    @TempDir
    Path tempDir;

    private static ItemCatalog sampleCatalog() {
        ItemCatalog items = new ItemCatalog();
        InventoryItem herb = items.findOrCreate("Herb", "Ingredients");
        herb.setDisplayName("Green Herb");
        herb.setRarity(Rarity.Common);
        herb.setCost(2);
        items.findOrCreate("Water", "Ingredients").setCost(1);
        InventoryItem potion = items.findOrCreate("Potion, Strong", "Potions");
        potion.setRarity(Rarity.Epic);
        potion.setCost(40);
        potion.setUses(3);
        potion.setMaxProfit(55);
        return items;
    }

    @Test
    void writeThenRead_restoresItemsAndRecipes() {
        ItemCatalog items = sampleCatalog();
        RecipeIndex recipes = new RecipeIndex(null);
        recipes.tryAdd(items, "Potion, Strong", "Water", "Herb");
        Path dir = tempDir.resolve("catalog");

        new CatalogCsvWriter().write(dir, items, recipes);
        assertTrue(items.dirtyItems().isEmpty());

        ListDiagnosticSink sink = new ListDiagnosticSink();
        CatalogSnapshot snapshot = new CatalogCsvReader().read(dir, sink);

        ItemCatalog backItems = snapshot.getItems();
        assertEquals(3, backItems.size());
        InventoryItem herb = backItems.resolve("Herb");
        assertEquals("Green Herb", herb.getDisplayName());
        assertEquals(Rarity.Common, herb.getRarity());
        assertEquals(2, herb.getCost());
        assertFalse(herb.isDirty());
        assertNull(backItems.resolve("Water").getDisplayName());

        InventoryItem potion = backItems.resolve("Potion, Strong");
        assertEquals("Potions", potion.getCategory());
        assertEquals(Rarity.Epic, potion.getRarity());
        assertEquals(3, potion.getUses());
        assertEquals(55, potion.getMaxProfit());

        RecipeIndex backRecipes = snapshot.getRecipes();
        assertEquals(1, backRecipes.size());
        assertSame(potion, backRecipes.findProduct(backItems.resolve("Water"), herb));
        assertEquals(0, sink.size());
    }

    @Test
    void write_producesHeaderedFiles() throws Exception {
        ItemCatalog items = sampleCatalog();
        RecipeIndex recipes = new RecipeIndex(null);
        recipes.tryAdd(items, "Potion, Strong", "Water", "Herb");

        new CatalogCsvWriter().write(tempDir, items, recipes);

        List<String> itemLines = Files.readAllLines(tempDir.resolve("items.csv"), StandardCharsets.UTF_8);
        List<String> recipeLines = Files.readAllLines(tempDir.resolve("recipes.csv"), StandardCharsets.UTF_8);

        assertEquals("name,category,displayName,rarity,cost,uses,maxProfit", itemLines.get(0));
        assertEquals("Herb,Ingredients,Green Herb,Common,2,0,0", itemLines.get(1));
        assertEquals("Water,Ingredients,,Unset,1,0,0", itemLines.get(2));
        assertEquals(4, itemLines.size());

        assertEquals("product,ingredient1,ingredient2,ingredient3", recipeLines.get(0));
        assertEquals("\"Potion, Strong\",Herb,Water,", recipeLines.get(1));
    }

    @Test
    void read_duplicateStoredRecipesAreReportedAgain() throws Exception {
        Files.writeString(tempDir.resolve("items.csv"),
                "name,category,displayName,rarity,cost,uses,maxProfit\n"
                        + "Herb,Ingredients,,Common,2,0,0\n"
                        + "Water,Ingredients,,Shiny,1,0,0\n"
                        + "Potion A,Potions,,Rare,10,1,5\n"
                        + "Potion B,Potions,,Rare,10,1,5\n");
        Files.writeString(tempDir.resolve("recipes.csv"),
                "product,ingredient1,ingredient2,ingredient3\n"
                        + "Potion A,Herb,Water,\n"
                        + "Potion B,Water,Herb,\n"
                        + "Potion B,Ghost,,\n");

        ListDiagnosticSink sink = new ListDiagnosticSink();
        CatalogSnapshot snapshot = new CatalogCsvReader().read(tempDir, sink);

        assertEquals(Rarity.Unset, snapshot.getItems().resolve("Water").getRarity());
        assertEquals(1, snapshot.getRecipes().size());
        assertEquals(1, sink.count(DiagnosticCode.RECIPE_DUPLICATE));
        assertSame(snapshot.getItems().resolve("Potion A"),
                snapshot.getRecipes().findProduct(snapshot.getItems().resolve("Herb"), snapshot.getItems().resolve("Water")));
    }

    @Test
    void read_withoutRecipesFileYieldsEmptyIndex() throws Exception {
        Files.writeString(tempDir.resolve("items.csv"),
                "name,category,displayName,rarity,cost,uses,maxProfit\nHerb,Ingredients,,,2,0,0\n");

        CatalogSnapshot snapshot = new CatalogCsvReader().read(tempDir, null);

        assertEquals(1, snapshot.getItems().size());
        assertTrue(snapshot.getRecipes().isEmpty());
    }

    @Test
    void writeThenRead_keepsSurroundingSpacesInNames() {
        ItemCatalog items = new ItemCatalog();
        items.findOrCreate(" Herb", "Ingredients");
        items.findOrCreate("Water", "Ingredients");
        items.findOrCreate("Potion ", "Potions");
        RecipeIndex recipes = new RecipeIndex(null);
        assertTrue(recipes.tryAdd(items, "Potion ", " Herb", "Water"));

        new CatalogCsvWriter().write(tempDir, items, recipes);
        CatalogSnapshot snapshot = new CatalogCsvReader().read(tempDir, null);

        ItemCatalog backItems = snapshot.getItems();
        InventoryItem herb = backItems.resolve(" Herb");
        InventoryItem potion = backItems.resolve("Potion ");
        assertNotNull(herb);
        assertNotNull(potion);
        assertNull(backItems.resolve("Herb"));
        assertEquals(1, snapshot.getRecipes().size());
        assertSame(potion, snapshot.getRecipes().findProduct(herb, backItems.resolve("Water")));
    }

    @Test
    void read_missingItemsFileFails() {
        assertThrows(IllegalStateException.class, () -> new CatalogCsvReader().read(tempDir, null));
    }
}
