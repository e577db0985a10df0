package domain.grid;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every table and named range of a loaded store, by name.
 *
 * <p>Lookups are exact and report nothing when a name is missing: only the caller knows
 * which name it expected and why. Duplicate names keep the first registration and report
 * {@code DUPLICATE_REGION_NAME}.</p>
 *
 * <p>Views re-derive their anchors from the store, but a table's column index is fixed at
 * discovery. After inserting columns through one view, re-load the index before reading
 * other tables on the same sheet.</p>
 */
public final class WorkbookIndex {

    private static final Logger log = LoggerFactory.getLogger(WorkbookIndex.class);

    private final CellStore store;
    private final Map<String, TableView> tables = new LinkedHashMap<>();
    private final Map<String, RangeView> ranges = new LinkedHashMap<>();

    private WorkbookIndex(CellStore store) {
        this.store = store;
    }

    public static WorkbookIndex load(CellStore store, DiagnosticSink sink) {
        if (store == null) throw new IllegalArgumentException("store is null");
        DiagnosticSink s = sink == null ? DiagnosticSink.none() : sink;
        WorkbookIndex index = new WorkbookIndex(store);

        for (String sheet : store.sheetNames()) {
            for (TableRegion t : store.tables(sheet)) {
                if (index.tables.containsKey(t.getName())) {
                    s.report(Diagnostic.of(DiagnosticCode.DUPLICATE_REGION_NAME, t.getName(),
                            "Table name '" + t.getName() + "' on sheet '" + sheet + "' is already registered; keeping the first."));
                    continue;
                }
                index.tables.put(t.getName(), new TableView(store, t.getName(), s));
            }
        }

        for (NamedRegion r : store.namedRanges()) {
            if (!store.hasSheet(r.getSheet())) {
                log.warn("Named range '{}' refers to unknown sheet '{}', skipped", r.getName(), r.getSheet());
                continue;
            }
            if (index.ranges.containsKey(r.getName())) {
                s.report(Diagnostic.of(DiagnosticCode.DUPLICATE_REGION_NAME, r.getName(),
                        "Named range '" + r.getName() + "' is already registered; keeping the first."));
                continue;
            }
            index.ranges.put(r.getName(), new RangeView(store, r.getName(), s));
        }

        log.info("Workbook index loaded: {} tables, {} named ranges", index.tables.size(), index.ranges.size());
        return index;
    }

    /** Table by exact name, or null. */
    public TableView findTable(String name) {
        return name == null ? null : tables.get(name);
    }

    /** Named range by exact name, or null. */
    public RangeView findRange(String name) {
        return name == null ? null : ranges.get(name);
    }

    public List<String> tableNames() {
        return Collections.unmodifiableList(new ArrayList<>(tables.keySet()));
    }

    public List<String> rangeNames() {
        return Collections.unmodifiableList(new ArrayList<>(ranges.keySet()));
    }

    public CellStore getStore() {
        return store;
    }

    public void save(WorkbookSaver saver, Path destination) {
        if (saver == null) throw new IllegalArgumentException("saver is null");
        saver.save(store, destination);
    }
}
