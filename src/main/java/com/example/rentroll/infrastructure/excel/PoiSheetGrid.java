package com.example.rentroll.infrastructure.excel;

import com.example.rentroll.domain.model.CellValue;
import com.example.rentroll.domain.model.SheetGrid;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.Locale;

/**
 * Infrastructure adapter exposing an Apache POI {@link Sheet} as a 1-based {@link SheetGrid}.
 * Formula cells are read through their cached result so amounts and codes never surface as formula text.
 */
public class PoiSheetGrid implements SheetGrid {

    private final Sheet sheet;

    public PoiSheetGrid(Sheet sheet) {
        this.sheet = sheet;
    }

    public Sheet sheet() {
        return sheet;
    }

    @Override
    public CellValue valueAt(int row, int column) {
        Cell cell = cellAt(row, column);
        if (cell == null) {
            return CellValue.EMPTY;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case STRING -> CellValue.text(cell.getStringCellValue());
            case NUMERIC -> CellValue.number(cell.getNumericCellValue());
            case BOOLEAN -> CellValue.text(String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT));
            default -> CellValue.EMPTY;
        };
    }

    @Override
    public boolean isBold(int row, int column) {
        Cell cell = cellAt(row, column);
        if (cell == null) {
            return false;
        }
        Font font = sheet.getWorkbook().getFontAt(cell.getCellStyle().getFontIndex());
        return font != null && font.getBold();
    }

    @Override
    public int lastRow() {
        return sheet.getLastRowNum() + 1;
    }

    @Override
    public int lastColumn() {
        int last = 0;
        for (Row row : sheet) {
            last = Math.max(last, row.getLastCellNum());
        }
        return last;
    }

    @Override
    public int lastNonEmptyColumn() {
        int last = 1;
        for (Row row : sheet) {
            for (Cell cell : row) {
                int column = cell.getColumnIndex() + 1;
                if (column > last && !valueAt(row.getRowNum() + 1, column).asText().isEmpty()) {
                    last = column;
                }
            }
        }
        return last;
    }

    @Override
    public void writeText(int row, int column, String value) {
        writableCell(row, column).setCellValue(value);
    }

    @Override
    public void writeNumber(int row, int column, double value) {
        writableCell(row, column).setCellValue(value);
    }

    private Cell cellAt(int row, int column) {
        if (row < 1 || column < 1) {
            return null;
        }
        Row sheetRow = sheet.getRow(row - 1);
        return sheetRow == null ? null : sheetRow.getCell(column - 1);
    }

    private Cell writableCell(int row, int column) {
        Row sheetRow = sheet.getRow(row - 1);
        if (sheetRow == null) {
            sheetRow = sheet.createRow(row - 1);
        }
        return sheetRow.getCell(column - 1, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
    }
}
