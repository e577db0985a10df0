package domain.model;

/**
 * Standard diagnostic codes for table access and recipe import.
 *
 * <p>Keep the set small and stable. Each code carries the severity it is reported with,
 * so batch callers can decide to continue or abort without parsing messages.</p>
 */
public enum DiagnosticCode {

    /**
     * Column name could not be resolved in a table header.
     */
    COLUMN_NOT_FOUND(Severity.ERROR),

    /**
     * Data row index outside [1, rowCount].
     */
    ROW_OUT_OF_RANGE(Severity.ERROR),

    /**
     * Row/column offset outside a named range.
     */
    CELL_OUT_OF_RANGE(Severity.ERROR),

    /**
     * Non-blank label that matches no enum member.
     */
    ENUM_LABEL_UNKNOWN(Severity.ERROR),

    /**
     * Table expected by an import step is missing from the workbook.
     */
    TABLE_NOT_FOUND(Severity.ERROR),

    /**
     * Two tables (or two named ranges) share a name; the first one is kept.
     */
    DUPLICATE_REGION_NAME(Severity.WARN),

    /**
     * Recipe product name could not be resolved.
     */
    RECIPE_PRODUCT_NOT_FOUND(Severity.WARN),

    /**
     * Recipe row resolved more ingredients than a recipe key can hold.
     */
    RECIPE_TOO_MANY_INGREDIENTS(Severity.ERROR),

    /**
     * Ingredient combination already maps to a product; the first mapping is kept.
     */
    RECIPE_DUPLICATE(Severity.ERROR);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    public enum Severity {
        INFO,
        WARN,
        ERROR
    }
}
