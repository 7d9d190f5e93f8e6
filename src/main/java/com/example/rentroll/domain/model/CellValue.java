package com.example.rentroll.domain.model;

/**
 * Domain representation of a single spreadsheet cell value.
 * Cells are either empty, text, or numeric so parsing code can branch on explicit variants
 * instead of inspecting raw library types.
 */
public interface CellValue {

    /**
     * Shared instance for blank, missing, or error cells.
     */
    CellValue EMPTY = new Empty();

    /**
     * Creates a text value.
     *
     * @param text raw text, {@code null} is treated as an empty cell
     * @return text variant or {@link #EMPTY}
     */
    static CellValue text(String text) {
        return text == null ? EMPTY : new Text(text);
    }

    /**
     * Creates a numeric value.
     *
     * @param number numeric cell content
     * @return number variant
     */
    static CellValue number(double number) {
        return new Number(number);
    }

    /**
     * @return {@code true} when the cell holds nothing or only whitespace
     */
    boolean isBlank();

    /**
     * Renders the value as text. Integral numbers are rendered without a decimal suffix.
     *
     * @return textual form, never {@code null}
     */
    String asText();

    /**
     * @return trimmed textual form
     */
    default String trimmed() {
        return asText().strip();
    }

    record Empty() implements CellValue {
        @Override
        public boolean isBlank() {
            return true;
        }

        @Override
        public String asText() {
            return "";
        }
    }

    record Text(String value) implements CellValue {
        @Override
        public boolean isBlank() {
            return value.isBlank();
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Number(double value) implements CellValue {
        @Override
        public boolean isBlank() {
            return false;
        }

        @Override
        public String asText() {
            if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }
}
