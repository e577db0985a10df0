package domain.recipe;

import domain.item.InventoryItem;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingredient combination -> product, with duplicate detection.
 *
 * <p>Two parallel structures: the recipes in the order they were added (what gets saved),
 * and a {@link RecipeKey} -> product map (what gets queried). On a key collision the first
 * mapping is kept and {@code RECIPE_DUPLICATE} is reported.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class RecipeIndex {

    private static final Logger log = LoggerFactory.getLogger(RecipeIndex.class);

    private final List<Recipe> recipes = new ArrayList<>();
    private final Map<RecipeKey, InventoryItem> lookup = new HashMap<>();
    private final DiagnosticSink sink;

    public RecipeIndex(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.none() : sink;
    }

    /**
     * Rebuilds an index from stored recipes, replaying each through the same
     * canonicalization as {@link #tryAdd}. Later duplicates are reported and dropped.
     */
    public static RecipeIndex rehydrate(List<Recipe> stored, DiagnosticSink sink) {
        RecipeIndex index = new RecipeIndex(sink);
        if (stored == null) return index;
        for (Recipe recipe : stored) {
            List<InventoryItem> sorted = RecipeKey.sortedByName(recipe.getIngredients());
            if (sorted.size() > RecipeKey.ARITY) {
                index.reportTooMany(recipe.getProduct().getName(), sorted.size());
                continue;
            }
            index.register(new Recipe(sorted, recipe.getProduct()), "stored recipes");
        }
        log.debug("Rehydrated {} of {} stored recipes", index.size(), stored.size());
        return index;
    }

    /**
     * Adds one recipe row.
     *
     * <ol>
     *   <li>blank or unresolvable ingredient names are dropped</li>
     *   <li>no ingredients left: false, nothing recorded</li>
     *   <li>ingredients are sorted by name, so {A,B} and {B,A} collide</li>
     *   <li>unresolvable product: false</li>
     *   <li>more than {@link RecipeKey#ARITY} ingredients: false</li>
     *   <li>key already present: first mapping kept, duplicate reported, true</li>
     * </ol>
     *
     * @return true if the row was processed (added or reported as duplicate)
     */
    public boolean tryAdd(EntityLookup items, String productName, String... ingredientNames) {
        if (items == null) throw new IllegalArgumentException("items lookup is null");

        List<InventoryItem> ingredients = new ArrayList<>();
        if (ingredientNames != null) {
            for (String name : ingredientNames) {
                if (name == null || name.isBlank()) continue;
                InventoryItem item = items.resolve(name);
                if (item != null) ingredients.add(item);
            }
        }
        if (ingredients.isEmpty()) return false;

        ingredients.sort(RecipeKey.BY_NAME);

        InventoryItem product = productName == null ? null : items.resolve(productName);
        if (product == null) {
            sink.report(Diagnostic.of(DiagnosticCode.RECIPE_PRODUCT_NOT_FOUND, "recipes",
                    "Unknown product '" + productName + "' for ingredients " + Arrays.toString(ingredientNames) + "."));
            return false;
        }

        if (ingredients.size() > RecipeKey.ARITY) {
            reportTooMany(product.getName(), ingredients.size());
            return false;
        }

        register(new Recipe(ingredients, product), "recipes");
        return true;
    }

    private void register(Recipe recipe, String source) {
        RecipeKey key = recipe.toKey();
        InventoryItem existing = lookup.get(key);
        if (existing != null) {
            sink.report(Diagnostic.of(DiagnosticCode.RECIPE_DUPLICATE, source,
                    "Duplicate recipe detected: " + key.describe() + " maps to both " + existing.getName()
                            + " and " + recipe.getProduct().getName() + ". Only the first mapping will be kept."));
            return;
        }
        recipes.add(recipe);
        lookup.put(key, recipe.getProduct());
    }

    private void reportTooMany(String productName, int count) {
        sink.report(Diagnostic.of(DiagnosticCode.RECIPE_TOO_MANY_INGREDIENTS, "recipes",
                "Recipe for '" + productName + "' has " + count + " ingredients; at most "
                        + RecipeKey.ARITY + " are supported."));
    }

    /** Product made from these ingredients (any order), or null. */
    public InventoryItem findProduct(InventoryItem... ingredients) {
        List<InventoryItem> sorted = RecipeKey.sortedByName(ingredients == null ? List.of() : Arrays.asList(ingredients));
        if (sorted.isEmpty() || sorted.size() > RecipeKey.ARITY) return null;
        return lookup.get(RecipeKey.of(sorted));
    }

    public void clear() {
        recipes.clear();
        lookup.clear();
    }

    public int size() {
        return recipes.size();
    }

    public boolean isEmpty() {
        return recipes.isEmpty();
    }

    /** Recipes in the order they were added. */
    public List<Recipe> getRecipes() {
        return Collections.unmodifiableList(recipes);
    }
}
