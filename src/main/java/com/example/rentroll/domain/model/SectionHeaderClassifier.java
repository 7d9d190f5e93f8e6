package com.example.rentroll.domain.model;

/**
 * Decides whether a cell in the unit column is a section header rather than a unit identifier.
 * Layouts with a different block-boundary signal can supply their own implementation.
 */
@FunctionalInterface
public interface SectionHeaderClassifier {

    /**
     * @param grid   sheet being scanned
     * @param row    1-based row number
     * @param column 1-based column number
     * @return {@code true} when the cell heads a section and must not be treated as a unit
     */
    boolean isSectionHeader(SheetGrid grid, int row, int column);

    /**
     * Rent roll exports style group headers in bold and unit rows in a regular font.
     *
     * @return classifier that treats bold cells as section headers
     */
    static SectionHeaderClassifier boldCells() {
        return SheetGrid::isBold;
    }
}
