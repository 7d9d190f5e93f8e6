package com.example.rentroll.domain.model;

/**
 * Read/write view over a single worksheet, addressed with 1-based rows and columns.
 * Implemented by infrastructure adapters so the extraction logic never touches the spreadsheet library.
 */
public interface SheetGrid {

    /**
     * Reads a cell value. Coordinates outside the used range yield {@link CellValue#EMPTY}.
     *
     * @param row    1-based row number
     * @param column 1-based column number
     * @return cell value, never {@code null}
     */
    CellValue valueAt(int row, int column);

    /**
     * @param row    1-based row number
     * @param column 1-based column number
     * @return {@code true} when the cell font is bold
     */
    boolean isBold(int row, int column);

    /**
     * @return last used row number (1-based), {@code 0} for an empty sheet
     */
    int lastRow();

    /**
     * @return highest used column number over all rows (1-based), {@code 0} for an empty sheet
     */
    int lastColumn();

    /**
     * @return rightmost column that holds a non-empty value, at least {@code 1}
     */
    int lastNonEmptyColumn();

    void writeText(int row, int column, String value);

    void writeNumber(int row, int column, double value);
}
