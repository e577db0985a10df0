package infra.catalog;

import domain.item.ItemCatalog;
import domain.recipe.RecipeIndex;

/**
 * Catalog loaded back from disk: the items and the recipe index rebuilt from them.
 */
public final class CatalogSnapshot {

    private final ItemCatalog items;
    private final RecipeIndex recipes;

    public CatalogSnapshot(ItemCatalog items, RecipeIndex recipes) {
        this.items = items;
        this.recipes = recipes;
    }

    public ItemCatalog getItems() {
        return items;
    }

    public RecipeIndex getRecipes() {
        return recipes;
    }
}
