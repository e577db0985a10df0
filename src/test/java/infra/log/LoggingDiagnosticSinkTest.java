package infra.log;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingDiagnosticSinkTest {

    @Test
    void report_forwardsEverySeverity() {
        ListDiagnosticSink collected = new ListDiagnosticSink();
        LoggingDiagnosticSink sink = new LoggingDiagnosticSink(collected);

        sink.report(Diagnostic.of(DiagnosticCode.COLUMN_NOT_FOUND, "Items", 0, "Cost", "missing"));
        sink.report(Diagnostic.of(DiagnosticCode.DUPLICATE_REGION_NAME, "Items", "twice"));
        sink.report(null);

        assertEquals(2, collected.size());
        assertTrue(collected.hasErrors());
    }

    @Test
    void report_withoutDelegateOnlyLogs() {
        LoggingDiagnosticSink sink = new LoggingDiagnosticSink(null);

        assertDoesNotThrow(() -> sink.report(Diagnostic.of(DiagnosticCode.RECIPE_DUPLICATE, "recipes", "dup")));
    }
}
