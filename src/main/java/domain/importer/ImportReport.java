package domain.importer;

/**
 * Counters of one import run. Diagnostics go to the sink the importer was built with.
 */
public final class ImportReport {

    private int itemsImported;
    private int itemRowsSkipped;
    private int recipeRowsProcessed;
    private int recipeRowsSkipped;
    private int tablesMissing;

    void itemImported() {
        itemsImported++;
    }

    void itemRowSkipped() {
        itemRowsSkipped++;
    }

    void recipeRowProcessed() {
        recipeRowsProcessed++;
    }

    void recipeRowSkipped() {
        recipeRowsSkipped++;
    }

    void tableMissing() {
        tablesMissing++;
    }

    public int getItemsImported() {
        return itemsImported;
    }

    public int getItemRowsSkipped() {
        return itemRowsSkipped;
    }

    /** Recipe rows accepted by the index, duplicates included. */
    public int getRecipeRowsProcessed() {
        return recipeRowsProcessed;
    }

    public int getRecipeRowsSkipped() {
        return recipeRowsSkipped;
    }

    public int getTablesMissing() {
        return tablesMissing;
    }

    @Override
    public String toString() {
        return "ImportReport{items=" + itemsImported
                + ", itemRowsSkipped=" + itemRowsSkipped
                + ", recipeRows=" + recipeRowsProcessed
                + ", recipeRowsSkipped=" + recipeRowsSkipped
                + ", tablesMissing=" + tablesMissing + '}';
    }
}
