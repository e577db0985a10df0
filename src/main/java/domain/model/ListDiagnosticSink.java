package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List-backed sink. Keeps every diagnostic in arrival order (no de-duplication:
 * a duplicate recipe reported twice is two separate problems in the sheet).
 */
public final class ListDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> target;

    public ListDiagnosticSink() {
        this(new ArrayList<>());
    }

    public ListDiagnosticSink(List<Diagnostic> target) {
        if (target == null) throw new IllegalArgumentException("target is null");
        this.target = target;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic == null) return;
        target.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(target);
    }

    public long count(DiagnosticCode code) {
        return target.stream().filter(d -> d.getCode() == code).count();
    }

    public boolean hasErrors() {
        return target.stream().anyMatch(d -> d.getSeverity() == DiagnosticCode.Severity.ERROR);
    }

    public int size() {
        return target.size();
    }
}
