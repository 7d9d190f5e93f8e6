package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.CellValue;
import com.example.rentroll.domain.model.ColumnMap;
import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.SectionHeaderClassifier;
import com.example.rentroll.domain.model.SheetGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Application-layer service that walks the rent roll body and aggregates charge lines per unit.
 * Unit blocks start on rows whose unit cell matches a known unit label and end on a "total" row,
 * the next unit, or the end of the sheet.
 */
@Service
public class RentRollExtractor {

    private static final Logger log = LoggerFactory.getLogger(RentRollExtractor.class);
    private static final int FIRST_DATA_ROW = 7;
    private static final String TOTAL_CODE = "total";

    private final SectionHeaderClassifier sectionHeaderClassifier;

    /**
     * @param sectionHeaderClassifier decides which unit-column cells are group headers rather than units
     */
    public RentRollExtractor(SectionHeaderClassifier sectionHeaderClassifier) {
        this.sectionHeaderClassifier = sectionHeaderClassifier;
    }

    /**
     * Extracts unit records and the ordered charge-code list.
     *
     * @param grid      sheet to walk
     * @param columnMap 0-based columns detected by {@link StructureDetector}
     * @return aggregated units and codes
     */
    public RentRollExtraction extract(SheetGrid grid, ColumnMap columnMap) {
        int unitColumn = columnMap.unitColumn() + 1;
        int codeColumn = columnMap.codeColumn() + 1;
        int amountColumn = columnMap.amountColumn() + 1;
        int nameColumn = columnMap.nameColumn() + 1;

        Set<String> unitLabels = collectUnitLabels(grid, unitColumn);
        log.debug("Collected {} unit labels from column {}", unitLabels.size(), unitColumn);

        UnitBlockAccumulator accumulator = new UnitBlockAccumulator();
        int lastRow = grid.lastRow();
        for (int row = FIRST_DATA_ROW; row <= lastRow; row++) {
            String unit = grid.valueAt(row, unitColumn).trimmed();
            CellValue code = grid.valueAt(row, codeColumn);
            double amount = AmountParser.parse(grid.valueAt(row, amountColumn));

            if (!unit.isEmpty() && unitLabels.contains(unit)) {
                CellValue name = columnMap.hasNameColumn() ? grid.valueAt(row, nameColumn) : CellValue.EMPTY;
                accumulator.startUnit(unit, name instanceof CellValue.Text text ? text.value() : "");
            }
            if (accumulator.state() == UnitBlockAccumulator.State.NO_OPEN_UNIT) {
                continue;
            }
            if (isTotalRow(code)) {
                accumulator.applyTotal(amount);
            } else if (!code.isBlank()) {
                accumulator.applyCharge(code.asText(), amount);
            }
        }

        RentRollExtraction extraction = accumulator.finish();
        log.info("Extracted {} units and {} charge codes", extraction.units().size(), extraction.chargeCodes().size());
        return extraction;
    }

    /**
     * Collects the trimmed labels of every non-empty unit-column cell that is not a section header.
     */
    private Set<String> collectUnitLabels(SheetGrid grid, int unitColumn) {
        Set<String> labels = new HashSet<>();
        int lastRow = grid.lastRow();
        for (int row = 1; row <= lastRow; row++) {
            if (sectionHeaderClassifier.isSectionHeader(grid, row, unitColumn)) {
                continue;
            }
            String label = grid.valueAt(row, unitColumn).trimmed();
            if (!label.isEmpty()) {
                labels.add(label);
            }
        }
        return labels;
    }

    private boolean isTotalRow(CellValue code) {
        return code instanceof CellValue.Text text
                && TOTAL_CODE.equals(text.value().strip().toLowerCase(Locale.ROOT));
    }
}
