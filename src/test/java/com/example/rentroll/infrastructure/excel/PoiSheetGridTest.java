package com.example.rentroll.infrastructure.excel;

import com.example.rentroll.domain.model.CellValue;
import com.example.rentroll.testing.RentRollSheetBuilder;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the POI-backed sheet grid adapter.
 */
class PoiSheetGridTest {

    @Test
    void readsTypedValuesWithOneBasedCoordinates() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(2, 3, 12.5)
                .cell(3, 1, true)
                .grid();

        assertThat(grid.valueAt(1, 1)).isEqualTo(CellValue.text("Rent Roll"));
        assertThat(grid.valueAt(2, 3)).isEqualTo(CellValue.number(12.5));
        assertThat(grid.valueAt(3, 1)).isEqualTo(CellValue.text("TRUE"));
    }

    @Test
    void outOfRangeReadsAreEmpty() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll").grid();

        assertThat(grid.valueAt(50, 1)).isSameAs(CellValue.EMPTY);
        assertThat(grid.valueAt(1, 10_000)).isSameAs(CellValue.EMPTY);
        assertThat(grid.valueAt(0, 0)).isSameAs(CellValue.EMPTY);
        assertThat(grid.isBold(50, 1)).isFalse();
    }

    @Test
    void formulaCellsExposeTheirCachedResult() {
        RentRollSheetBuilder builder = RentRollSheetBuilder.withMarker("Rent Roll");
        Cell formula = builder.sheet().getRow(0).createCell(1);
        formula.setCellFormula("1000+50");
        FormulaEvaluator evaluator = builder.workbook().getCreationHelper().createFormulaEvaluator();
        evaluator.evaluateFormulaCell(formula);

        assertThat(builder.grid().valueAt(1, 2)).isEqualTo(CellValue.number(1050));
    }

    @Test
    void reportsBoldCells() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll").bold(2, 1, "Building").grid();

        assertThat(grid.isBold(2, 1)).isTrue();
        assertThat(grid.isBold(1, 1)).isFalse();
    }

    @Test
    void tracksUsedAndNonEmptyColumns() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(4, 3, "x")
                .cell(5, 6, "")
                .grid();

        assertThat(grid.lastRow()).isEqualTo(5);
        assertThat(grid.lastColumn()).isEqualTo(6);
        assertThat(grid.lastNonEmptyColumn()).isEqualTo(3);
    }

    @Test
    void writesCreateMissingRowsAndCells() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll").grid();

        grid.writeText(3, 4, "Resident Name");
        grid.writeNumber(4, 4, 99.5);

        assertThat(grid.valueAt(3, 4).asText()).isEqualTo("Resident Name");
        assertThat(grid.valueAt(4, 4)).isEqualTo(CellValue.number(99.5));
    }
}
