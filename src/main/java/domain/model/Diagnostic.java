package domain.model;

/**
 * A single non-fatal problem found while reading or importing data.
 *
 * <p>Carries enough location to find the offending cell: the table/range name,
 * the 1-based data row (0 when not row specific) and the column label.</p>
 */
public final class Diagnostic {

    private final DiagnosticCode code;
    private final String source;
    private final int row;
    private final String column;
    private final String message;
    private final String detail;

    public Diagnostic(
            DiagnosticCode code,
            String source,
            int row,
            String column,
            String message,
            String detail
    ) {
        if (code == null) throw new IllegalArgumentException("code is null");
        this.code = code;
        this.source = nullToEmpty(source);
        this.row = Math.max(0, row);
        this.column = nullToEmpty(column);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static Diagnostic of(DiagnosticCode code, String source, int row, String column, String message) {
        return new Diagnostic(code, source, row, column, message, "");
    }

    public static Diagnostic of(DiagnosticCode code, String source, String message) {
        return new Diagnostic(code, source, 0, "", message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public DiagnosticCode.Severity getSeverity() {
        return code.getSeverity();
    }

    public String getSource() {
        return source;
    }

    public int getRow() {
        return row;
    }

    public String getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    /** "Recipes row 3, column 'Item 1'" style location, empty parts omitted. */
    public String location() {
        StringBuilder sb = new StringBuilder(source);
        if (row > 0) sb.append(sb.length() == 0 ? "" : " ").append("row ").append(row);
        if (!column.isEmpty()) sb.append(sb.length() == 0 ? "" : ", ").append("column '").append(column).append('\'');
        return sb.toString();
    }

    @Override
    public String toString() {
        return code + " [" + location() + "] " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
