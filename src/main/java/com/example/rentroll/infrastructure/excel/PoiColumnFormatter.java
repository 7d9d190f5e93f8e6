package com.example.rentroll.infrastructure.excel;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellUtil;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Infrastructure helper applying the cosmetic touches to appended columns:
 * width sized to the longest rendered value and a bold red font on every written cell.
 */
@Component
public class PoiColumnFormatter {

    static final byte[] HIGHLIGHT_RGB = {(byte) 0xE2, 0x00, 0x00};

    private static final int WIDTH_PADDING_CHARS = 2;
    private static final int MAX_WIDTH_CHARS = 255;

    /**
     * Sets each column width to the longest trimmed rendered value plus padding.
     *
     * @param sheet   sheet to adjust
     * @param columns 1-based column indices
     */
    public void autoSize(Sheet sheet, List<Integer> columns) {
        DataFormatter formatter = new DataFormatter();
        for (int column : columns) {
            int maxLength = 0;
            for (Row row : sheet) {
                Cell cell = row.getCell(column - 1);
                if (cell != null) {
                    maxLength = Math.max(maxLength, formatter.formatCellValue(cell).strip().length());
                }
            }
            int widthChars = Math.min(maxLength + WIDTH_PADDING_CHARS, MAX_WIDTH_CHARS);
            sheet.setColumnWidth(column - 1, widthChars * 256);
        }
    }

    /**
     * Applies the bold highlight font to every non-blank cell in the given columns.
     * Only the font changes; borders, fills and number formats already on the cell are kept.
     *
     * @param sheet   sheet to adjust
     * @param columns 1-based column indices
     */
    public void highlight(Sheet sheet, List<Integer> columns) {
        Font font = createHighlightFont(sheet);
        for (Row row : sheet) {
            for (int column : columns) {
                Cell cell = row.getCell(column - 1);
                if (cell != null && cell.getCellType() != CellType.BLANK) {
                    CellUtil.setFont(cell, font);
                }
            }
        }
    }

    private Font createHighlightFont(Sheet sheet) {
        Font font = sheet.getWorkbook().createFont();
        font.setBold(true);
        if (font instanceof XSSFFont xssfFont) {
            xssfFont.setColor(new XSSFColor(HIGHLIGHT_RGB, null));
        } else {
            font.setColor(IndexedColors.RED.getIndex());
        }
        return font;
    }
}
