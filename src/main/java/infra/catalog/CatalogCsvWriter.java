package infra.catalog;

import domain.item.InventoryItem;
import domain.item.ItemCatalog;
import domain.recipe.Recipe;
import domain.recipe.RecipeIndex;
import domain.recipe.RecipeKey;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes an imported catalog as two CSV files under one directory:
 * <ul>
 *   <li>{@code items.csv}: name, category, displayName, rarity, cost, uses, maxProfit</li>
 *   <li>{@code recipes.csv}: product, ingredient1..ingredient3 (blank when unused)</li>
 * </ul>
 * Items are written in catalog order, recipes in the order the index accepted them.
 * After a successful write the catalog is marked saved.
 */
public final class CatalogCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(CatalogCsvWriter.class);

    public static final String ITEMS_FILE = "items.csv";
    public static final String RECIPES_FILE = "recipes.csv";

    static final String[] ITEM_HEADER = {"name", "category", "displayName", "rarity", "cost", "uses", "maxProfit"};
    static final String[] RECIPE_HEADER = {"product", "ingredient1", "ingredient2", "ingredient3"};

    public void write(Path dir, ItemCatalog items, RecipeIndex recipes) {
        if (dir == null) throw new IllegalArgumentException("dir is null");
        if (items == null) throw new IllegalArgumentException("items is null");
        if (recipes == null) throw new IllegalArgumentException("recipes is null");

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create catalog dir: " + dir, e);
        }

        writeItems(dir.resolve(ITEMS_FILE), items);
        writeRecipes(dir.resolve(RECIPES_FILE), recipes);
        items.markSaved();

        log.info("Catalog written to {}: {} items, {} recipes", dir.toAbsolutePath(), items.size(), recipes.size());
    }

    private void writeItems(Path path, ItemCatalog items) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(ITEM_HEADER)
                .build();

        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {

            for (InventoryItem item : items.all()) {
                printer.printRecord(
                        item.getName(),
                        item.getCategory(),
                        safe(item.getDisplayName()),
                        item.getRarity().name(),
                        item.getCost(),
                        item.getUses(),
                        item.getMaxProfit()
                );
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write csv: " + path, e);
        }
    }

    private void writeRecipes(Path path, RecipeIndex recipes) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(RECIPE_HEADER)
                .build();

        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {

            for (Recipe recipe : recipes.getRecipes()) {
                List<String> record = new ArrayList<>(RecipeKey.ARITY + 1);
                record.add(recipe.getProduct().getName());
                for (int i = 0; i < RecipeKey.ARITY; i++) {
                    List<InventoryItem> ingredients = recipe.getIngredients();
                    record.add(i < ingredients.size() ? ingredients.get(i).getName() : "");
                }
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write csv: " + path, e);
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
