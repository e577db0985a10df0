package domain.item;

import domain.recipe.EntityLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All known items, one instance per name.
 *
 * <p>{@link #findOrCreate} is the import entry point: it returns the existing item or
 * creates one in the given category, and marks it dirty either way since the caller is
 * about to change it.</p>
 */
public final class ItemCatalog implements EntityLookup {

    private static final Logger log = LoggerFactory.getLogger(ItemCatalog.class);

    private final Map<String, InventoryItem> items = new LinkedHashMap<>();

    public InventoryItem findOrCreate(String name, String category) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("item name is blank");

        InventoryItem item = items.get(name);
        if (item == null) {
            item = new InventoryItem(name, category);
            items.put(name, item);
            log.debug("Created item '{}' in category '{}'", name, category);
        }
        item.markDirty();
        return item;
    }

    /** Adds an already-built item (catalog reload). An existing item with the same name is replaced. */
    public void add(InventoryItem item) {
        if (item == null) throw new IllegalArgumentException("item is null");
        items.put(item.getName(), item);
    }

    @Override
    public InventoryItem resolve(String name) {
        return name == null ? null : items.get(name);
    }

    public List<InventoryItem> all() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    public List<InventoryItem> dirtyItems() {
        List<InventoryItem> out = new ArrayList<>();
        for (InventoryItem item : items.values()) {
            if (item.isDirty()) out.add(item);
        }
        return out;
    }

    public void markSaved() {
        for (InventoryItem item : items.values()) item.markSaved();
    }

    public int size() {
        return items.size();
    }
}
