package domain.item;

/**
 * An ingredient or potion.
 *
 * <p>Identity is the instance: the {@link ItemCatalog} hands out exactly one instance per
 * name, and recipe keys compare items by reference.</p>
 */
public final class InventoryItem {

    private final String name;
    private final String category;

    private String displayName;
    private Rarity rarity = Rarity.Unset;
    private int cost;
    private int uses;
    private int maxProfit;

    private boolean dirty;

    public InventoryItem(String name, String category) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("item name is blank");
        this.name = name;
        this.category = category == null ? "" : category;
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public Rarity getRarity() {
        return rarity;
    }

    public void setRarity(Rarity rarity) {
        this.rarity = rarity == null ? Rarity.Unset : rarity;
    }

    public int getCost() {
        return cost;
    }

    public void setCost(int cost) {
        this.cost = cost;
    }

    public int getUses() {
        return uses;
    }

    public void setUses(int uses) {
        this.uses = uses;
    }

    public int getMaxProfit() {
        return maxProfit;
    }

    public void setMaxProfit(int maxProfit) {
        this.maxProfit = maxProfit;
    }

    /** Changed since the catalog was last saved. */
    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        this.dirty = true;
    }

    void markSaved() {
        this.dirty = false;
    }

    @Override
    public String toString() {
        return "InventoryItem{" + category + "/" + name + ", rarity=" + rarity + ", cost=" + cost + '}';
    }
}
