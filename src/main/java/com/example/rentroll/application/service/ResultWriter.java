package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.ColumnMap;
import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.SheetGrid;
import com.example.rentroll.domain.model.UnitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that appends the aggregated charges to the right of the original data.
 * Each unit's values land on the row where its label first appears in the unit column.
 */
@Service
public class ResultWriter {

    static final String NAME_HEADER = "Resident Name";
    static final String TOTAL_HEADER = "Total Amount";

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    /**
     * Writes the header row and one row of values per matched unit.
     *
     * @param grid       sheet that already contains the original data
     * @param columnMap  detected columns, only the unit column is used
     * @param extraction units and ordered charge codes
     * @return 1-based indices of the appended columns, left to right
     */
    public List<Integer> write(SheetGrid grid, ColumnMap columnMap, RentRollExtraction extraction) {
        int nameColumn = grid.lastNonEmptyColumn() + 1;
        List<Integer> written = new ArrayList<>();

        grid.writeText(1, nameColumn, NAME_HEADER);
        written.add(nameColumn);

        Map<String, Integer> codeColumns = new HashMap<>();
        int column = nameColumn + 1;
        for (String code : extraction.chargeCodes()) {
            grid.writeText(1, column, code);
            codeColumns.put(code, column);
            written.add(column);
            column++;
        }
        int totalColumn = column;
        grid.writeText(1, totalColumn, TOTAL_HEADER);
        written.add(totalColumn);

        Map<String, Integer> unitRows = indexUnitRows(grid, columnMap.unitColumn() + 1);
        int dropped = 0;
        for (UnitRecord unit : extraction.units()) {
            Integer row = unitRows.get(unit.unit());
            if (row == null) {
                dropped++;
                log.debug("Unit {} has no row in the unit column, skipping", unit.unit());
                continue;
            }
            grid.writeText(row, nameColumn, unit.name());
            for (String code : extraction.chargeCodes()) {
                grid.writeNumber(row, codeColumns.get(code), unit.chargeFor(code));
            }
            grid.writeNumber(row, totalColumn, unit.total());
        }
        if (dropped > 0) {
            log.info("{} units could not be matched to a row and were not written", dropped);
        }
        return written;
    }

    /**
     * Maps each trimmed unit label to the first row it appears on.
     */
    private Map<String, Integer> indexUnitRows(SheetGrid grid, int unitColumn) {
        Map<String, Integer> rows = new HashMap<>();
        int lastRow = grid.lastRow();
        for (int row = 1; row <= lastRow; row++) {
            String label = grid.valueAt(row, unitColumn).trimmed();
            if (!label.isEmpty()) {
                rows.putIfAbsent(label, row);
            }
        }
        return rows;
    }
}
