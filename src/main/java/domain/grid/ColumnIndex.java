package domain.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column name -> zero-based position within one table.
 *
 * <p>Built once from the table header (labels trimmed). Lookup is exact and
 * case-sensitive. The only mutation is {@link #append(String)}.</p>
 *
 * <p>Duplicate header labels are not de-duplicated: the first occurrence wins.</p>
 */
public final class ColumnIndex {

    private final Map<String, Integer> positions = new HashMap<>();
    private final List<String> names = new ArrayList<>();

    private ColumnIndex() {
    }

    public static ColumnIndex fromHeader(List<String> header) {
        ColumnIndex index = new ColumnIndex();
        if (header == null) return index;
        for (String label : header) {
            String name = label == null ? "" : label.trim();
            index.positions.putIfAbsent(name, index.names.size());
            index.names.add(name);
        }
        return index;
    }

    /** Zero-based position, or -1 if no column has exactly this name. */
    public int resolve(String name) {
        if (name == null) return -1;
        Integer p = positions.get(name);
        return p == null ? -1 : p;
    }

    public boolean contains(String name) {
        return resolve(name) >= 0;
    }

    /**
     * Registers {@code name} at the next position. Callers check {@link #contains} first.
     *
     * @return the new zero-based position
     */
    public int append(String name) {
        if (name == null) throw new IllegalArgumentException("column name is null");
        if (positions.containsKey(name)) {
            throw new IllegalArgumentException("column already present: " + name);
        }
        int p = names.size();
        positions.put(name, p);
        names.add(name);
        return p;
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    /**
     * Text for a failed lookup: every known column, plus a capitalization/whitespace hint
     * when some column matches case- and whitespace-insensitively.
     */
    public String describeMiss(String requested) {
        StringBuilder info = new StringBuilder("Valid columns are...");
        for (String label : names) {
            info.append(" '").append(label).append('\'');
        }
        if (hasNearMatch(requested)) info.append(" (check capitalization and whitespace)");
        return info.toString();
    }

    public boolean hasNearMatch(String requested) {
        if (requested == null) return false;
        String comparison = requested.trim().toLowerCase(Locale.ROOT);
        for (String label : names) {
            if (label.trim().toLowerCase(Locale.ROOT).equals(comparison)) return true;
        }
        return false;
    }
}
