package com.example.cardpipeline.exception;

import java.util.List;

/**
 * Raised when a table lacks columns the pipeline cannot run without, or carries the same column twice. Aborts the
 * run; never used for row-level data quality problems.
 */
public class SchemaException extends RuntimeException {

    private final List<String> missingColumns;
    private final List<String> duplicateColumns;

    public SchemaException(String tableName, List<String> missingColumns) {
        this(String.format("Table '%s' is missing expected column(s): %s",
                tableName, String.join(", ", missingColumns)), missingColumns, List.of());
    }

    private SchemaException(String message, List<String> missingColumns, List<String> duplicateColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
        this.duplicateColumns = List.copyOf(duplicateColumns);
    }

    /**
     * @param duplicateColumns logical columns that more than one source header resolves to
     */
    public static SchemaException duplicateColumns(String tableName, List<String> duplicateColumns) {
        return new SchemaException(String.format("Table '%s' has duplicated column(s): %s",
                tableName, String.join(", ", duplicateColumns)), List.of(), duplicateColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }

    public List<String> getDuplicateColumns() {
        return duplicateColumns;
    }
}
