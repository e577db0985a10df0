package domain.grid;

import domain.model.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a typed read: the value (or the type default), whether a real value was
 * found, and any diagnostics explaining why not.
 *
 * <p>Keeps "legitimately zero" apart from "failed to read": a blank cell is
 * {@code present=false} with no diagnostics, a missing column is {@code present=false}
 * with a {@code COLUMN_NOT_FOUND} diagnostic.</p>
 */
public final class CellRead<T> {

    private final T value;
    private final boolean present;
    private final List<Diagnostic> diagnostics;

    private CellRead(T value, boolean present, List<Diagnostic> diagnostics) {
        this.value = value;
        this.present = present;
        this.diagnostics = diagnostics;
    }

    public static <T> CellRead<T> of(T value) {
        return new CellRead<>(value, true, List.of());
    }

    public static <T> CellRead<T> absent(T defaultValue) {
        return new CellRead<>(defaultValue, false, List.of());
    }

    public static <T> CellRead<T> failed(T defaultValue, Diagnostic diagnostic) {
        return new CellRead<>(defaultValue, false, List.of(diagnostic));
    }

    /** Same diagnostics and presence, different value type (used when re-reading a label as an enum). */
    static <T> CellRead<T> failedLike(CellRead<?> other, T defaultValue) {
        return new CellRead<>(defaultValue, false, other.diagnostics);
    }

    public T getValue() {
        return value;
    }

    public boolean isPresent() {
        return present;
    }

    public T orElse(T other) {
        return present ? value : other;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return present ? "CellRead{" + value + '}' : "CellRead{absent, default=" + value + ", " + diagnostics + '}';
    }
}
