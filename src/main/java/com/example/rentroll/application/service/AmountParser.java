package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.CellValue;

import java.util.regex.Pattern;

/**
 * Converts heterogeneous cell content (numbers, currency strings, accounting negatives,
 * comma-grouped values) into a signed amount. Never throws: anything unreadable becomes {@code 0.0}.
 */
public final class AmountParser {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.\\-]");

    private AmountParser() {
    }

    /**
     * Parses a domain cell value.
     *
     * @param value cell value, may be {@code null}
     * @return finite amount, {@code 0.0} when the value cannot be read
     */
    public static double parse(CellValue value) {
        if (value == null || value instanceof CellValue.Empty) {
            return 0.0;
        }
        if (value instanceof CellValue.Number number) {
            return finiteOrZero(number.value());
        }
        return parseText(value.asText());
    }

    /**
     * Parses an arbitrary object. Numbers are taken as-is, everything else goes through its string form.
     *
     * @param value raw value, may be {@code null}
     * @return finite amount, {@code 0.0} when the value cannot be read
     */
    public static double parse(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof CellValue cellValue) {
            return parse(cellValue);
        }
        if (value instanceof Number number) {
            return finiteOrZero(number.doubleValue());
        }
        return parseText(String.valueOf(value));
    }

    private static double parseText(String raw) {
        String text = raw.strip();
        if (text.isEmpty()) {
            return 0.0;
        }
        text = text.replace(",", "").replace("\u00A0", "");
        if (text.startsWith("(") && text.endsWith(")")) {
            text = "-" + text.substring(1, text.length() - 1);
        }
        text = NON_NUMERIC.matcher(text).replaceAll("");
        if (text.isEmpty()) {
            return 0.0;
        }
        try {
            return finiteOrZero(Double.parseDouble(text));
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
