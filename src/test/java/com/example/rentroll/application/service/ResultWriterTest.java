package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.ColumnMap;
import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.UnitRecord;
import com.example.rentroll.infrastructure.excel.PoiSheetGrid;
import com.example.rentroll.testing.RentRollSheetBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the appended column layout and the unit-to-row write-back.
 */
class ResultWriterTest {

    private static final ColumnMap COLUMNS = new ColumnMap(0, 4, 5, 1);

    private final ResultWriter writer = new ResultWriter();

    @Test
    void headerRowListsNameThenCodesThenTotal() {
        PoiSheetGrid grid = RentRollSheetBuilder.twoUnitRentRoll().grid();
        RentRollExtraction extraction = new RentRollExtraction(List.of(), List.of("rent", "fee", "parking"));

        List<Integer> columns = writer.write(grid, COLUMNS, extraction);

        assertThat(columns).containsExactly(7, 8, 9, 10, 11);
        assertThat(columns).extracting(column -> grid.valueAt(1, column).asText())
                .containsExactly("Resident Name", "rent", "fee", "parking", "Total Amount");
    }

    @Test
    void valuesLandOnTheUnitRowWithZeroForAbsentCodes() {
        PoiSheetGrid grid = RentRollSheetBuilder.twoUnitRentRoll().grid();
        UnitRecord unit = new UnitRecord("102", "John Roe", Map.of("fee", 20.0), 20.0);

        writer.write(grid, COLUMNS, new RentRollExtraction(List.of(unit), List.of("rent", "fee")));

        assertThat(grid.valueAt(11, 7).asText()).isEqualTo("John Roe");
        assertThat(grid.valueAt(11, 8).asText()).isEqualTo("0");
        assertThat(grid.valueAt(11, 9).asText()).isEqualTo("20");
        assertThat(grid.valueAt(11, 10).asText()).isEqualTo("20");
        assertThat(grid.valueAt(8, 7).isBlank()).isTrue();
    }

    @Test
    void unitMissingFromTheSheetIsDropped() {
        PoiSheetGrid grid = RentRollSheetBuilder.twoUnitRentRoll().grid();
        UnitRecord ghost = new UnitRecord("999", "Nobody", Map.of("rent", 5.0), 5.0);

        writer.write(grid, COLUMNS, new RentRollExtraction(List.of(ghost), List.of("rent")));

        for (int row = 2; row <= grid.lastRow(); row++) {
            assertThat(grid.valueAt(row, 7).isBlank()).isTrue();
            assertThat(grid.valueAt(row, 9).isBlank()).isTrue();
        }
    }

    @Test
    void duplicateLabelsWriteToTheFirstRow() {
        PoiSheetGrid grid = RentRollSheetBuilder.withMarker("Rent Roll")
                .cell(7, 1, "A-1").cell(7, 5, "rent").cell(7, 6, 10)
                .cell(9, 1, "A-1").cell(9, 5, "rent").cell(9, 6, 20)
                .grid();
        UnitRecord unit = new UnitRecord("A-1", "", Map.of("rent", 20.0), 0.0);

        writer.write(grid, COLUMNS, new RentRollExtraction(List.of(unit), List.of("rent")));

        assertThat(grid.valueAt(7, 8).asText()).isEqualTo("20");
        assertThat(grid.valueAt(9, 8).isBlank()).isTrue();
    }
}
