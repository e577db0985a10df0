package domain.importer;

/**
 * Table names the potion import reads. Column names are fixed by the workbook layout
 * (see {@link PotionImporter}).
 */
public final class ImportSettings {

    public static final String DEFAULT_INGREDIENTS_TABLE = "Ingredients";
    public static final String DEFAULT_POTIONS_TABLE = "Potions";
    public static final String DEFAULT_RECIPES_TABLE = "Recipes";

    private final String ingredientsTable;
    private final String potionsTable;
    private final String recipesTable;

    public ImportSettings(String ingredientsTable, String potionsTable, String recipesTable) {
        this.ingredientsTable = orDefault(ingredientsTable, DEFAULT_INGREDIENTS_TABLE);
        this.potionsTable = orDefault(potionsTable, DEFAULT_POTIONS_TABLE);
        this.recipesTable = orDefault(recipesTable, DEFAULT_RECIPES_TABLE);
    }

    public static ImportSettings defaults() {
        return new ImportSettings(null, null, null);
    }

    private static String orDefault(String v, String def) {
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    public String getIngredientsTable() {
        return ingredientsTable;
    }

    public String getPotionsTable() {
        return potionsTable;
    }

    public String getRecipesTable() {
        return recipesTable;
    }
}
