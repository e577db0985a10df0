package domain.importer;

import domain.grid.CellRead;
import domain.grid.TableView;
import domain.grid.WorkbookIndex;
import domain.item.InventoryItem;
import domain.item.ItemCatalog;
import domain.item.Rarity;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import domain.recipe.RecipeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports ingredients, potions and recipes from a workbook.
 *
 * <p>Item tables: {@code Name}, {@code Rarity}, {@code Cost}, and optionally {@code Uses}
 * and {@code Max Profit}. Recipe table: {@code Potion}, {@code Item 1}..{@code Item 3}.
 * The recipe index is cleared before recipes are read, so every run rebuilds it from
 * the sheet.</p>
 */
public final class PotionImporter {

    private static final Logger log = LoggerFactory.getLogger(PotionImporter.class);

    static final String COL_NAME = "Name";
    static final String COL_RARITY = "Rarity";
    static final String COL_COST = "Cost";
    static final String COL_USES = "Uses";
    static final String COL_MAX_PROFIT = "Max Profit";

    static final String COL_POTION = "Potion";
    static final String COL_ITEM_1 = "Item 1";
    static final String COL_ITEM_2 = "Item 2";
    static final String COL_ITEM_3 = "Item 3";

    private final ImportSettings settings;
    private final DiagnosticSink sink;

    public PotionImporter(ImportSettings settings, DiagnosticSink sink) {
        this.settings = settings == null ? ImportSettings.defaults() : settings;
        this.sink = sink == null ? DiagnosticSink.none() : sink;
    }

    public ImportReport importAll(WorkbookIndex workbook, ItemCatalog items, RecipeIndex recipes) {
        if (workbook == null) throw new IllegalArgumentException("workbook is null");
        if (items == null) throw new IllegalArgumentException("items is null");
        if (recipes == null) throw new IllegalArgumentException("recipes is null");

        ImportReport report = new ImportReport();
        importItems(settings.getIngredientsTable(), workbook, items, report);
        importItems(settings.getPotionsTable(), workbook, items, report);
        importRecipes(workbook, items, recipes, report);

        log.info("Import complete: {}", report);
        return report;
    }

    void importItems(String category, WorkbookIndex workbook, ItemCatalog items, ImportReport report) {
        TableView table = findTable(workbook, category, report);
        if (table == null) return;

        boolean hasUses = table.hasColumn(COL_USES);
        boolean hasMaxProfit = table.hasColumn(COL_MAX_PROFIT);

        for (int row = 1; row <= table.getRowCount(); row++) {
            String name = table.getValue(row, COL_NAME, String.class);
            if (name == null || name.isBlank()) {
                report.itemRowSkipped();
                continue;
            }

            InventoryItem item = items.findOrCreate(name, category);

            if (item.getDisplayName() == null || item.getDisplayName().isBlank()) {
                item.setDisplayName(name);
            }

            CellRead<Rarity> rarity = table.getEnum(row, COL_RARITY, Rarity.class);
            if (rarity.isPresent()) item.setRarity(rarity.getValue());

            item.setCost(table.getValue(row, COL_COST, int.class));

            if (hasUses) item.setUses(table.getValue(row, COL_USES, int.class));
            if (hasMaxProfit) item.setMaxProfit(table.getValue(row, COL_MAX_PROFIT, int.class));

            report.itemImported();
            log.debug("Imported {} '{}'", category, name);
        }
    }

    void importRecipes(WorkbookIndex workbook, ItemCatalog items, RecipeIndex recipes, ImportReport report) {
        TableView table = findTable(workbook, settings.getRecipesTable(), report);
        if (table == null) return;

        recipes.clear();

        for (int row = 1; row <= table.getRowCount(); row++) {
            boolean processed = recipes.tryAdd(
                    items,
                    table.getValue(row, COL_POTION, String.class),
                    table.getValue(row, COL_ITEM_1, String.class),
                    table.getValue(row, COL_ITEM_2, String.class),
                    table.getValue(row, COL_ITEM_3, String.class)
            );
            if (processed) {
                report.recipeRowProcessed();
            } else {
                report.recipeRowSkipped();
            }
        }
        log.debug("Recipe index holds {} recipes after {} rows", recipes.size(), table.getRowCount());
    }

    private TableView findTable(WorkbookIndex workbook, String tableName, ImportReport report) {
        TableView table = workbook.findTable(tableName);
        if (table == null) {
            report.tableMissing();
            sink.report(Diagnostic.of(DiagnosticCode.TABLE_NOT_FOUND, tableName,
                    "Could not find table '" + tableName + "' in the workbook. Known tables: " + workbook.tableNames()));
        }
        return table;
    }
}
