package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;

/**
 * Workbook-level read access used for sheet-qualified references such as Sheet2!A1.
 */
@FunctionalInterface
public interface SheetResolver {

    /**
     * Resolver for a sheet standing alone: every other sheet is unknown.
     */
    SheetResolver NONE = (sheetName, address) -> {
        throw new SheetNotFoundException("Sheet not found: " + sheetName);
    };

    CellValue getCellValue(String sheetName, CellAddress address);
}
