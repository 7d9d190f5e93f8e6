package com.example.rentroll.domain.model;

/**
 * Domain DTO holding the 0-based column indices inferred from the rent roll header region.
 * Built once per sheet and shared between the extractor and the writer.
 */
public record ColumnMap(
        int unitColumn,
        int codeColumn,
        int amountColumn,
        int nameColumn
) {

    /**
     * Column index used when no resident name header exists. Lies beyond any column a rent roll
     * export uses; readers check {@link #hasNameColumn()} before reading names.
     */
    public static final int NO_NAME_COLUMN = 9999;

    public boolean hasNameColumn() {
        return nameColumn != NO_NAME_COLUMN;
    }
}
