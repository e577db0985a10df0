package infra.catalog;

import domain.item.InventoryItem;
import domain.item.ItemCatalog;
import domain.item.Rarity;
import domain.model.DiagnosticSink;
import domain.recipe.Recipe;
import domain.recipe.RecipeIndex;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a catalog directory written by {@link CatalogCsvWriter}.
 *
 * <p>Items come back clean (not dirty). Recipes are replayed through
 * {@link RecipeIndex#rehydrate}, so the lookup is rebuilt with the same canonical keys
 * and duplicates are reported again. Recipe rows that mention an unknown item are skipped
 * with a warning; a missing {@code recipes.csv} yields an empty index.</p>
 */
public final class CatalogCsvReader {

    private static final Logger log = LoggerFactory.getLogger(CatalogCsvReader.class);

    public CatalogSnapshot read(Path dir, DiagnosticSink sink) {
        if (dir == null) throw new IllegalArgumentException("dir is null");

        Path itemsPath = dir.resolve(CatalogCsvWriter.ITEMS_FILE);
        if (!Files.isRegularFile(itemsPath)) {
            throw new IllegalStateException("Catalog items file not found: " + itemsPath.toAbsolutePath());
        }

        ItemCatalog items = readItems(itemsPath);

        Path recipesPath = dir.resolve(CatalogCsvWriter.RECIPES_FILE);
        List<Recipe> stored = Files.isRegularFile(recipesPath) ? readRecipes(recipesPath, items) : List.of();
        RecipeIndex recipes = RecipeIndex.rehydrate(stored, sink);

        log.info("Catalog read from {}: {} items, {} recipes", dir.toAbsolutePath(), items.size(), recipes.size());
        return new CatalogSnapshot(items, recipes);
    }

    private ItemCatalog readItems(Path path) {
        ItemCatalog items = new ItemCatalog();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format(CatalogCsvWriter.ITEM_HEADER).parse(reader)) {

            for (CSVRecord r : parser) {
                String name = r.get("name");
                if (name == null || name.isBlank()) continue;

                InventoryItem item = new InventoryItem(name, r.get("category"));
                item.setDisplayName(blankToNull(r.get("displayName")));
                item.setRarity(parseRarity(r.get("rarity"), name));
                item.setCost(parseInt(r.get("cost")));
                item.setUses(parseInt(r.get("uses")));
                item.setMaxProfit(parseInt(r.get("maxProfit")));
                items.add(item);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read csv: " + path, e);
        }
        return items;
    }

    private List<Recipe> readRecipes(Path path, ItemCatalog items) {
        List<Recipe> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format(CatalogCsvWriter.RECIPE_HEADER).parse(reader)) {

            for (CSVRecord r : parser) {
                String productName = r.get("product");
                InventoryItem product = items.resolve(productName);
                if (product == null) {
                    log.warn("{} line {}: unknown product '{}', recipe skipped", path.getFileName(), r.getRecordNumber(), productName);
                    continue;
                }

                List<InventoryItem> ingredients = new ArrayList<>();
                boolean unknown = false;
                for (int i = 1; i < CatalogCsvWriter.RECIPE_HEADER.length; i++) {
                    String name = r.get(CatalogCsvWriter.RECIPE_HEADER[i]);
                    if (name == null || name.isBlank()) continue;
                    InventoryItem item = items.resolve(name);
                    if (item == null) {
                        log.warn("{} line {}: unknown ingredient '{}', recipe skipped", path.getFileName(), r.getRecordNumber(), name);
                        unknown = true;
                        break;
                    }
                    ingredients.add(item);
                }
                if (unknown || ingredients.isEmpty()) continue;

                out.add(new Recipe(ingredients, product));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read csv: " + path, e);
        }
        return out;
    }

    // names are stored verbatim (the writer quotes surrounding spaces), so no trimming here
    private static CSVFormat format(String[] header) {
        return CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setSkipHeaderRecord(true)
                .build();
    }

    private static Rarity parseRarity(String raw, String itemName) {
        if (raw == null || raw.isBlank()) return Rarity.Unset;
        try {
            return Rarity.valueOf(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Item '{}': unknown rarity '{}', using {}", itemName, raw, Rarity.Unset);
            return Rarity.Unset;
        }
    }

    private static int parseInt(String s) {
        if (s == null || s.isBlank()) return 0;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
