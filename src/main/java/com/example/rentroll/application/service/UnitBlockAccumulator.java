package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.UnitRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Two-state machine that folds rent roll rows into unit records.
 * At most one unit is open at a time; closed units are immutable once emitted.
 */
public class UnitBlockAccumulator {

    public enum State {
        NO_OPEN_UNIT,
        OPEN_UNIT
    }

    private final List<UnitRecord> units = new ArrayList<>();
    private final Set<String> chargeCodes = new LinkedHashSet<>();
    private OpenUnit openUnit;

    public State state() {
        return openUnit == null ? State.NO_OPEN_UNIT : State.OPEN_UNIT;
    }

    /**
     * Closes the open unit, if any, and opens a new one.
     *
     * @param unit trimmed unit label
     * @param name resident name, empty when unknown
     */
    public void startUnit(String unit, String name) {
        closeOpenUnit();
        openUnit = new OpenUnit(unit, name);
    }

    /**
     * Sets the total of the open unit and closes it. Ignored when no unit is open.
     *
     * @param amount parsed amount of the total row
     */
    public void applyTotal(double amount) {
        if (openUnit == null) {
            return;
        }
        openUnit.total = amount;
        closeOpenUnit();
    }

    /**
     * Adds a charge line to the open unit. Ignored when no unit is open or the code is blank.
     *
     * @param code   raw charge code, lowercased and trimmed before use
     * @param amount parsed amount
     */
    public void applyCharge(String code, double amount) {
        if (openUnit == null || code == null) {
            return;
        }
        String key = code.strip().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return;
        }
        openUnit.charges.merge(key, amount, Double::sum);
        chargeCodes.add(key);
    }

    /**
     * Emits any unit still open and returns everything accumulated so far.
     *
     * @return units in order of appearance and codes in order of first occurrence
     */
    public RentRollExtraction finish() {
        closeOpenUnit();
        return new RentRollExtraction(units, new ArrayList<>(chargeCodes));
    }

    private void closeOpenUnit() {
        if (openUnit != null) {
            units.add(new UnitRecord(openUnit.unit, openUnit.name, openUnit.charges, openUnit.total));
            openUnit = null;
        }
    }

    private static final class OpenUnit {
        private final String unit;
        private final String name;
        private final Map<String, Double> charges = new LinkedHashMap<>();
        private double total;

        private OpenUnit(String unit, String name) {
            this.unit = unit;
            this.name = name;
        }
    }
}
