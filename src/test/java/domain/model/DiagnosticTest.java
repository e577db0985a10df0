package domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void location_omitsEmptyParts() {
        assertEquals("Recipes row 3, column 'Item 1'",
                Diagnostic.of(DiagnosticCode.COLUMN_NOT_FOUND, "Recipes", 3, "Item 1", "m").location());
        assertEquals("Recipes", Diagnostic.of(DiagnosticCode.TABLE_NOT_FOUND, "Recipes", "m").location());
        assertEquals("row 2", Diagnostic.of(DiagnosticCode.ROW_OUT_OF_RANGE, null, 2, null, "m").location());
    }

    @Test
    void toString_includesCodeAndDetail() {
        Diagnostic d = new Diagnostic(DiagnosticCode.COLUMN_NOT_FOUND, "Items", 0, "cost", "Cannot find column", "Valid columns are... 'Cost'");

        assertEquals("COLUMN_NOT_FOUND [Items, column 'cost'] Cannot find column (Valid columns are... 'Cost')", d.toString());
        assertEquals(DiagnosticCode.Severity.ERROR, d.getSeverity());
    }

    @Test
    void listSink_countsAndSeverity() {
        ListDiagnosticSink sink = new ListDiagnosticSink();
        sink.report(Diagnostic.of(DiagnosticCode.DUPLICATE_REGION_NAME, "T", "dup"));

        assertFalse(sink.hasErrors());
        sink.report(Diagnostic.of(DiagnosticCode.RECIPE_DUPLICATE, "recipes", "dup"));
        sink.report(Diagnostic.of(DiagnosticCode.RECIPE_DUPLICATE, "recipes", "dup"));

        assertTrue(sink.hasErrors());
        assertEquals(2, sink.count(DiagnosticCode.RECIPE_DUPLICATE));
        assertEquals(3, sink.size());
    }

    @Test
    void none_discardsSilently() {
        assertDoesNotThrow(() -> DiagnosticSink.none().report(Diagnostic.of(DiagnosticCode.TABLE_NOT_FOUND, "x", "y")));
    }
}
