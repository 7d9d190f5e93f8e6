package com.example.rentroll.domain.model;

import java.util.List;

/**
 * Result of walking a rent roll sheet: units in order of appearance and the distinct
 * charge codes in order of first occurrence.
 */
public record RentRollExtraction(
        List<UnitRecord> units,
        List<String> chargeCodes
) {
    public RentRollExtraction {
        units = units == null ? List.of() : List.copyOf(units);
        chargeCodes = chargeCodes == null ? List.of() : List.copyOf(chargeCodes);
    }
}
