package com.example.rentroll.domain.model;

import java.util.List;

/**
 * Domain DTO summarizing a processed rent roll for the interfaces layer.
 * Returned to controllers so UI code can stay presentation-only.
 */
public record ProcessingResult(
        String fileName,
        String outputFileName,
        RentRollLayout layout,
        ColumnMap columnMap,
        List<UnitRecord> units,
        List<String> chargeCodes,
        List<Integer> appendedColumns,
        List<String> warnings,
        List<ProcessingStage> completedStages
) {
}
