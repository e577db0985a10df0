package domain.recipe;

import domain.item.InventoryItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored recipe: ingredients (as recorded, sorted by name when added through the index)
 * and the product they make.
 */
public final class Recipe {

    private final List<InventoryItem> ingredients;
    private final InventoryItem product;

    public Recipe(List<InventoryItem> ingredients, InventoryItem product) {
        if (ingredients == null || ingredients.isEmpty()) throw new IllegalArgumentException("recipe has no ingredients");
        if (product == null) throw new IllegalArgumentException("recipe has no product");
        this.ingredients = Collections.unmodifiableList(new ArrayList<>(ingredients));
        this.product = product;
    }

    public List<InventoryItem> getIngredients() {
        return ingredients;
    }

    public InventoryItem getProduct() {
        return product;
    }

    /** Canonical lookup key (ingredients re-sorted, so stored order does not matter). */
    public RecipeKey toKey() {
        return RecipeKey.of(ingredients);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (InventoryItem item : ingredients) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(item.getName());
        }
        return sb + " -> " + product.getName();
    }
}
