package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;

/**
 * What the evaluator needs from its surroundings: cell values and the stack of
 * cells currently being evaluated.
 */
public interface EvaluationContext {

    /**
     * Current value of a cell on the evaluating sheet, EMPTY when unset.
     */
    CellValue getCellValue(CellAddress address);

    /**
     * Current value of a cell on another sheet.
     *
     * @throws com.spreadsheet.calc.exceptions.SheetNotFoundException if there is no such sheet
     */
    CellValue getSheetCellValue(String sheetName, CellAddress address);

    boolean isEvaluating(CellAddress address);

    void push(CellAddress address);

    void pop(CellAddress address);
}
