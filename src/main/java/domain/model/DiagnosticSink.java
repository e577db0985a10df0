package domain.model;

/**
 * Sink for non-fatal diagnostics.
 *
 * <p>Table views, the recipe index and the importer all report through a sink so
 * that the batch can finish with partial results instead of stopping on the first
 * malformed row.</p>
 */
public interface DiagnosticSink {

    static DiagnosticSink none() {
        return NullDiagnosticSink.INSTANCE;
    }

    void report(Diagnostic diagnostic);
}
