package domain.recipe;

import domain.item.InventoryItem;

/**
 * Name -> item resolution used by the recipe index. Exact, case-sensitive.
 */
@FunctionalInterface
public interface EntityLookup {

    /** The item with exactly this name, or null. */
    InventoryItem resolve(String name);
}
