package com.example.rentroll.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domain DTO describing the aggregated charges of one unit block.
 * Charge keys are lowercased, trimmed codes mapped to their summed amount.
 */
public record UnitRecord(
        String unit,
        String name,
        Map<String, Double> charges,
        double total
) {
    public UnitRecord {
        name = name == null ? "" : name;
        charges = charges == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(charges));
    }

    /**
     * @param code lowercased charge code
     * @return summed amount or {@code 0.0} when the unit has no such charge
     */
    public double chargeFor(String code) {
        return charges.getOrDefault(code, 0.0);
    }
}
