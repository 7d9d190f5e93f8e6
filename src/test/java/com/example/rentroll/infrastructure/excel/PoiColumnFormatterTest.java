package com.example.rentroll.infrastructure.excel;

import com.example.rentroll.testing.RentRollSheetBuilder;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for sizing and highlighting of appended columns.
 */
class PoiColumnFormatterTest {

    private final PoiColumnFormatter formatter = new PoiColumnFormatter();

    @Test
    void widthFollowsTheLongestRenderedValue() {
        Sheet sheet = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(1, 2, "Resident Name")
                .cell(5, 2, "  Jo  ")
                .cell(1, 3, "fee")
                .cell(5, 3, 1234.5)
                .sheet();

        formatter.autoSize(sheet, List.of(2, 3));

        assertThat(sheet.getColumnWidth(1)).isEqualTo(("Resident Name".length() + 2) * 256);
        assertThat(sheet.getColumnWidth(2)).isEqualTo(("1234.5".length() + 2) * 256);
    }

    @Test
    void highlightsNonBlankCellsInBoldRed() {
        RentRollSheetBuilder builder = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(1, 2, "Total Amount")
                .cell(3, 2, 1050);
        Sheet sheet = builder.sheet();

        formatter.highlight(sheet, List.of(2));

        XSSFFont font = ((XSSFCellStyle) sheet.getRow(2).getCell(1).getCellStyle()).getFont();
        assertThat(font.getBold()).isTrue();
        assertThat(font.getXSSFColor().getRGB()).containsExactly(PoiColumnFormatter.HIGHLIGHT_RGB);
        XSSFFont untouched = ((XSSFCellStyle) sheet.getRow(0).getCell(0).getCellStyle()).getFont();
        assertThat(untouched.getBold()).isFalse();
    }

    @Test
    void highlightKeepsExistingBorderFillAndNumberFormat() {
        RentRollSheetBuilder builder = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(3, 2, 1050);
        XSSFWorkbook workbook = builder.workbook();
        CellStyle bordered = workbook.createCellStyle();
        bordered.setBorderBottom(BorderStyle.THIN);
        bordered.setFillForegroundColor(IndexedColors.LIGHT_YELLOW.getIndex());
        bordered.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        bordered.setDataFormat(workbook.createDataFormat().getFormat("#,##0.00"));
        Sheet sheet = builder.sheet();
        sheet.getRow(2).getCell(1).setCellStyle(bordered);

        formatter.highlight(sheet, List.of(2));

        Cell cell = sheet.getRow(2).getCell(1);
        XSSFCellStyle style = (XSSFCellStyle) cell.getCellStyle();
        assertThat(style.getBorderBottom()).isEqualTo(BorderStyle.THIN);
        assertThat(style.getFillPattern()).isEqualTo(FillPatternType.SOLID_FOREGROUND);
        assertThat(style.getFillForegroundColor()).isEqualTo(IndexedColors.LIGHT_YELLOW.getIndex());
        assertThat(style.getDataFormatString()).isEqualTo("#,##0.00");
        assertThat(style.getFont().getBold()).isTrue();
        assertThat(style.getFont().getXSSFColor().getRGB()).containsExactly(PoiColumnFormatter.HIGHLIGHT_RGB);
    }
}
