package com.example.rentroll.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Source layout of a rent roll workbook, selected by the text in the first cell.
 * Affordable exports carry unit identifiers in column C, standard exports in column A.
 */
public enum RentRollLayout {
    AFFORDABLE_RENT_ROLL("affordable", 2),
    RENT_ROLL("rent", 0);

    private final String markerPrefix;
    private final int unitColumn;

    RentRollLayout(String markerPrefix, int unitColumn) {
        this.markerPrefix = markerPrefix;
        this.unitColumn = unitColumn;
    }

    /**
     * @return 0-based column holding the unit identifiers
     */
    public int unitColumn() {
        return unitColumn;
    }

    /**
     * Resolves the layout from the marker cell text. The affordable prefix is checked first.
     *
     * @param marker raw text of cell (1, 1)
     * @return matching layout or empty when the workbook is not a supported rent roll
     */
    public static Optional<RentRollLayout> fromMarker(String marker) {
        if (marker == null) {
            return Optional.empty();
        }
        String normalized = marker.strip().toLowerCase(Locale.ROOT);
        for (RentRollLayout layout : values()) {
            if (normalized.startsWith(layout.markerPrefix)) {
                return Optional.of(layout);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a human friendly label for the UI.
     *
     * @param layout layout to translate
     * @return display name
     */
    public static String toDisplayName(RentRollLayout layout) {
        return switch (layout) {
            case AFFORDABLE_RENT_ROLL -> "Affordable Rent Roll";
            case RENT_ROLL -> "Rent Roll";
        };
    }
}
