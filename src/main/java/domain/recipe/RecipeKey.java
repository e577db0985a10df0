package domain.recipe;

import domain.item.InventoryItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Order-independent combination of up to {@link #ARITY} ingredients.
 *
 * <p>Fixed-arity tuple: ingredients are sorted by name, packed into the slots, and unused
 * slots hold {@link Slot#EMPTY}. Slots compare items by identity, so two keys are equal
 * iff they hold the same items regardless of the order they were supplied in.</p>
 */
public final class RecipeKey {

    public static final int ARITY = 3;

    static final Comparator<InventoryItem> BY_NAME = Comparator.comparing(InventoryItem::getName);

    private final Slot first;
    private final Slot second;
    private final Slot third;

    private RecipeKey(Slot first, Slot second, Slot third) {
        this.first = first;
        this.second = second;
        this.third = third;
    }

    /**
     * Canonical key for a set of ingredients in any order.
     *
     * @throws IllegalArgumentException if there are no ingredients or more than {@link #ARITY}
     */
    public static RecipeKey of(List<InventoryItem> ingredients) {
        List<InventoryItem> sorted = sortedByName(ingredients);
        if (sorted.isEmpty()) throw new IllegalArgumentException("recipe key needs at least one ingredient");
        if (sorted.size() > ARITY) {
            throw new IllegalArgumentException("recipe key holds at most " + ARITY + " ingredients, got " + sorted.size());
        }
        return new RecipeKey(slot(sorted, 0), slot(sorted, 1), slot(sorted, 2));
    }

    public static RecipeKey of(InventoryItem... ingredients) {
        return of(ingredients == null ? List.of() : List.of(ingredients));
    }

    /** Copy sorted by name, nulls dropped. The sort is stable. */
    static List<InventoryItem> sortedByName(List<InventoryItem> ingredients) {
        List<InventoryItem> sorted = new ArrayList<>();
        if (ingredients != null) {
            for (InventoryItem item : ingredients) {
                if (item != null) sorted.add(item);
            }
        }
        sorted.sort(BY_NAME);
        return sorted;
    }

    private static Slot slot(List<InventoryItem> sorted, int i) {
        return i < sorted.size() ? new Slot(sorted.get(i)) : Slot.EMPTY;
    }

    public Slot getFirst() {
        return first;
    }

    public Slot getSecond() {
        return second;
    }

    public Slot getThird() {
        return third;
    }

    /** "Herb + Water + ''" style text for diagnostics. */
    public String describe() {
        return "'" + first.label() + "' + '" + second.label() + "' + '" + third.label() + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecipeKey)) return false;
        RecipeKey that = (RecipeKey) o;
        return first.equals(that.first) && second.equals(that.second) && third.equals(that.third);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, third);
    }

    @Override
    public String toString() {
        return "RecipeKey{" + describe() + '}';
    }

    /**
     * One ingredient position: either an item or {@link #EMPTY}.
     */
    public static final class Slot {

        public static final Slot EMPTY = new Slot(null);

        private final InventoryItem item;

        private Slot(InventoryItem item) {
            this.item = item;
        }

        public boolean isEmpty() {
            return item == null;
        }

        /** The item, or null for {@link #EMPTY}. */
        public InventoryItem getItem() {
            return item;
        }

        String label() {
            return item == null ? "" : item.getName();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Slot)) return false;
            return item == ((Slot) o).item;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(item);
        }
    }
}
