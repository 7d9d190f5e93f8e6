package com.example.rentroll.application.service;

import com.example.rentroll.domain.exception.StructureDetectionException;
import com.example.rentroll.domain.model.CellValue;
import com.example.rentroll.domain.model.ColumnMap;
import com.example.rentroll.domain.model.RentRollLayout;
import com.example.rentroll.domain.model.SheetGrid;
import com.example.rentroll.domain.model.StructureDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Application-layer service that infers the rent roll column layout from the header region.
 * Only rows 1 and 5 through 12 are inspected; the data body is never scanned here.
 */
@Service
public class StructureDetector {

    static final String NAME_COLUMN_WARNING = "Name column not found (row 6/5). Using blank.";

    private static final Logger log = LoggerFactory.getLogger(StructureDetector.class);
    private static final int HEADER_ROW = 6;
    private static final int NAME_FALLBACK_ROW = 5;
    private static final int CODE_FALLBACK_FIRST_ROW = 7;
    private static final int CODE_FALLBACK_LAST_ROW = 12;
    private static final Set<String> CODE_HEADERS = Set.of("code", "rent code");

    /**
     * Detects the layout and the unit, code, amount and name columns.
     *
     * @param grid sheet to inspect
     * @return detected structure, including non-fatal warnings
     * @throws StructureDetectionException when the unit or charge-code column cannot be located
     */
    public StructureDetection detect(SheetGrid grid) {
        RentRollLayout layout = detectLayout(grid);
        int codeColumn = detectCodeColumn(grid);
        int amountColumn = findInRow(grid, HEADER_ROW, header -> header.contains("amount"));
        if (amountColumn < 0) {
            amountColumn = codeColumn + 1;
            log.debug("Amount header missing, assuming column {} next to the code column", amountColumn);
        }

        List<String> warnings = new ArrayList<>();
        int nameColumn = findInRow(grid, HEADER_ROW, header -> header.contains("name"));
        if (nameColumn < 0) {
            nameColumn = findInRow(grid, NAME_FALLBACK_ROW, header -> header.contains("name"));
        }
        if (nameColumn < 0) {
            log.warn(NAME_COLUMN_WARNING);
            warnings.add(NAME_COLUMN_WARNING);
            nameColumn = ColumnMap.NO_NAME_COLUMN;
        }

        ColumnMap columnMap = new ColumnMap(layout.unitColumn(), codeColumn, amountColumn, nameColumn);
        log.info("Detected {} layout with columns {}", RentRollLayout.toDisplayName(layout), columnMap);
        return new StructureDetection(layout, columnMap, warnings);
    }

    private RentRollLayout detectLayout(SheetGrid grid) {
        String marker = grid.valueAt(1, 1).asText();
        return RentRollLayout.fromMarker(marker)
                .orElseThrow(() -> new StructureDetectionException("unit",
                        "Unit column could not be detected (Row 1 mismatch)."));
    }

    private int detectCodeColumn(SheetGrid grid) {
        Predicate<String> isCodeHeader = CODE_HEADERS::contains;
        int column = findInRow(grid, HEADER_ROW, isCodeHeader);
        for (int row = CODE_FALLBACK_FIRST_ROW; column < 0 && row <= CODE_FALLBACK_LAST_ROW; row++) {
            column = findInRow(grid, row, isCodeHeader);
        }
        if (column < 0) {
            throw new StructureDetectionException("code", "Rent Code column not found in row 6 or rows 7–12.");
        }
        return column;
    }

    /**
     * Finds the first text cell in the row whose trimmed lowercase value satisfies the predicate.
     *
     * @return 0-based column index or {@code -1}
     */
    private int findInRow(SheetGrid grid, int row, Predicate<String> matcher) {
        int lastColumn = grid.lastColumn();
        for (int column = 1; column <= lastColumn; column++) {
            CellValue value = grid.valueAt(row, column);
            if (value instanceof CellValue.Text text
                    && matcher.test(text.value().strip().toLowerCase(Locale.ROOT))) {
                return column - 1;
            }
        }
        return -1;
    }
}
