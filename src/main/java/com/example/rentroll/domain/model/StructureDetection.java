package com.example.rentroll.domain.model;

import java.util.List;

/**
 * Outcome of header inspection: the detected layout, the column map, and any non-fatal warnings.
 */
public record StructureDetection(
        RentRollLayout layout,
        ColumnMap columnMap,
        List<String> warnings
) {
    public StructureDetection {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
