package com.spreadsheet.calc.facade;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.evaluator.SheetResolver;
import com.spreadsheet.calc.events.SpreadsheetEvent;
import com.spreadsheet.calc.events.SpreadsheetEvent.EventType;
import com.spreadsheet.calc.exceptions.BatchStateException;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.InvalidArgumentsException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.repository.InMemoryCellRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for one sheet, driven through the facade only
 * (no Spring context, no HTTP).
 */
class SpreadsheetFacadeTest {

    private SpreadsheetFacade sheet;
    private List<SpreadsheetEvent> events;

    @BeforeEach
    void setUp() {
        sheet = new SpreadsheetFacade();
        events = new ArrayList<>();
        sheet.addListener(events::add);
    }

    private String display(String a1) {
        return sheet.getCellValue(a1).toDisplayString();
    }

    private String raw(String a1) {
        return sheet.getCell(CellAddress.fromA1(a1)).map(c -> c.getRawValue()).orElse(null);
    }

    private List<EventType> eventTypes() {
        return events.stream().map(SpreadsheetEvent::getType).collect(Collectors.toList());
    }

    /**
     * A1=10, B1=20, C1=A1+B1 gives 30; changing A1 to 15 updates C1 to 35.
     */
    @Test
    void testDependentsRecalculate() {
        sheet.setCell("A1", "10");
        sheet.setCell("B1", "20");
        sheet.setCell("C1", "=A1+B1");
        assertEquals(CellValue.number(30), sheet.getCellValue("C1"));

        sheet.setCell("A1", "15");
        assertEquals(CellValue.number(35), sheet.getCellValue("C1"));
    }

    @Test
    void testChainedRecalculation() {
        sheet.setCell("A1", "1");
        sheet.setCell("A2", "=A1*2");
        sheet.setCell("A3", "=A2+A1");
        sheet.setCell("A4", "=SUM(A1:A3)");
        assertEquals("7", display("A4"));
        sheet.setCell("A1", "2");
        assertEquals("14", display("A4"));
    }

    /**
     * Closing a loop is rejected and B1 keeps its old content.
     */
    @Test
    void testCycleIsRejected() {
        sheet.setCell("A1", "=B1+1");
        sheet.setCell("B1", "5");
        assertEquals("6", display("A1"));

        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> sheet.setCell("B1", "=A1"));
        assertEquals(List.of(CellAddress.fromA1("B1"), CellAddress.fromA1("A1"), CellAddress.fromA1("B1")),
                ex.getCycle());
        assertEquals("5", raw("B1"));
        assertEquals("6", display("A1"));
        assertEquals(Optional.of("Set B1 to \"5\""), sheet.peekUndo());

        assertThrows(CircularReferenceException.class, () -> sheet.setCell("C1", "=C1"));
        assertNull(raw("C1"));
    }

    @Test
    void testRejectedInputLeavesNothingBehind() {
        assertThrows(FormulaParseException.class, () -> sheet.setCell("A1", "=1+"));
        assertThrows(InvalidArgumentsException.class, () -> sheet.setCell("A1", "=ABS()"));
        assertTrue(sheet.getCells().isEmpty());
        assertFalse(sheet.canUndo());
        assertTrue(events.isEmpty());
    }

    @Test
    void testErrorValues() {
        sheet.setCell("A1", "=1/0");
        sheet.setCell("B1", "=A1+1");
        assertEquals("#DIV/0!", display("A1"));
        assertEquals("#DIV/0!", display("B1"));

        sheet.setCell("C1", "=NOPE(1)");
        assertEquals("#NAME?", display("C1"));
        sheet.setCell("D1", "=\"abc\"*2");
        assertEquals("#VALUE!", display("D1"));
        sheet.setCell("E1", "=Other!A1");
        assertEquals("#REF!", display("E1"));
    }

    @Test
    void testLiteralsAndEmptyCells() {
        sheet.setCell("A1", "hello");
        sheet.setCell("A2", "TRUE");
        sheet.setCell("A3", "");
        sheet.setCell("B1", "=A1&\" world\"");
        sheet.setCell("B2", "=Z50+1");
        assertEquals(CellValue.string("hello world"), sheet.getCellValue("B1"));
        assertEquals(CellValue.TRUE, sheet.getCellValue("A2"));
        assertEquals(CellValue.EMPTY, sheet.getCellValue("A3"));
        assertEquals(CellValue.number(1), sheet.getCellValue("B2"));
        assertEquals(CellValue.EMPTY, sheet.getCellValue("Q7"));
    }

    @Test
    void testDeleteCell() {
        sheet.setCell("A1", "5");
        sheet.setCell("B1", "=A1+1");
        sheet.deleteCell("A1");
        assertEquals("1", display("B1"));
        assertFalse(sheet.getCell(CellAddress.fromA1("A1")).isPresent());

        // deleting an absent cell is not an undo step
        int before = sheet.getUndoHistory().size();
        sheet.deleteCell("Z9");
        assertEquals(before, sheet.getUndoHistory().size());

        sheet.undo();
        assertEquals("6", display("B1"));
    }

    @Test
    void testDependencyQueries() {
        sheet.setCell("C1", "=A1+B1");
        sheet.setCell("D1", "=A1");
        assertEquals(Set.of(CellAddress.fromA1("C1"), CellAddress.fromA1("D1")),
                sheet.getDependents(CellAddress.fromA1("A1")));
        assertEquals(Set.of(CellAddress.fromA1("A1"), CellAddress.fromA1("B1")),
                sheet.getDependencies(CellAddress.fromA1("C1")));
    }

    @Test
    void testUndoRedo() {
        sheet.setCell("A1", "1");
        sheet.setCell("A1", "2");
        sheet.setCell("B1", "=A1*10");
        assertEquals("20", display("B1"));

        assertTrue(sheet.undo());
        assertNull(raw("B1"));
        assertTrue(sheet.undo());
        assertEquals("1", display("A1"));
        assertTrue(sheet.canRedo());

        assertTrue(sheet.redo());
        assertEquals("2", display("A1"));

        // a fresh edit discards what was left to redo
        sheet.setCell("C1", "x");
        assertFalse(sheet.canRedo());
        assertFalse(sheet.redo());
    }

    @Test
    void testUndoRestoresFormula() {
        sheet.setCell("A1", "3");
        sheet.setCell("B1", "=A1*2");
        sheet.setCell("B1", "7");
        sheet.setCell("A1", "4");
        sheet.undo();
        sheet.undo();
        assertEquals("=A1*2", raw("B1"));
        assertEquals("6", display("B1"));
        sheet.setCell("A1", "10");
        assertEquals("20", display("B1"));
    }

    /**
     * Deleting row 5 turns a reference to A5 into #REF!; undo brings it back.
     */
    @Test
    void testDeleteRowInvalidatesReference() {
        sheet.setCell("A5", "7");
        sheet.setCell("A6", "1");
        sheet.setCell("C1", "=A5*2");
        sheet.setCell("C2", "=A6+1");
        sheet.deleteRow(4);

        assertEquals("#REF!", display("C1"));
        assertEquals("=#REF!*2", raw("C1"));
        assertEquals("=A5+1", raw("C2"));
        assertEquals("1", display("A5"));
        assertEquals("2", display("C2"));

        sheet.undo();
        assertEquals("14", display("C1"));
        assertEquals("=A5*2", raw("C1"));
        assertEquals("7", display("A5"));
    }

    @Test
    void testInsertRowAndColumn() {
        sheet.setCell("A1", "1");
        sheet.setCell("A2", "=A1+1");
        sheet.insertRow(0);
        assertNull(raw("A1"));
        assertEquals("=A2+1", raw("A3"));
        assertEquals("2", display("A3"));

        sheet.insertColumn(0);
        assertEquals("=B2+1", raw("B3"));
        assertEquals("2", display("B3"));
        assertEquals(List.of("Insert column A", "Insert row 1", "Set A2 to \"=A1+1\"", "Set A1 to \"1\""),
                sheet.getUndoHistory());
    }

    @Test
    void testDeleteColumn() {
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "2");
        sheet.setCell("C1", "=SUM(A1:B1)");
        sheet.deleteColumn(0);
        assertEquals("=SUM(A1:A1)", raw("B1"));
        assertEquals("2", display("B1"));
    }

    @Test
    void testMoveRange() {
        sheet.setCell("A1", "5");
        sheet.setCell("B1", "=A1*2");
        sheet.moveRange(CellRange.fromA1("A1"), CellAddress.fromA1("D1"));
        assertNull(raw("A1"));
        assertEquals("5", display("D1"));
        assertEquals("=D1*2", raw("B1"));
        assertEquals("10", display("B1"));
    }

    @Test
    void testStructuralBounds() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxRows(10);
        properties.setMaxColumns(5);
        SpreadsheetFacade small = new SpreadsheetFacade(properties);
        assertThrows(InvalidAddressException.class, () -> small.setCell("A11", "1"));
        assertThrows(InvalidAddressException.class, () -> small.setCell("F1", "1"));
        assertThrows(InvalidAddressException.class, () -> small.deleteRow(10));
        assertThrows(InvalidAddressException.class, () -> small.insertColumn(-1));

        // the last row falls off the sheet on insert
        small.setCell("A10", "last");
        small.insertRow(0);
        assertTrue(small.getCells().isEmpty());
    }

    /**
     * Queued edits have no visible effect until commit, which fires the
     * batch events around the usual ones and records a single undo step.
     */
    @Test
    void testBatchCommit() {
        sheet.setCell("A1", "1");
        events.clear();

        String batchId = sheet.beginBatch();
        sheet.setCell("A1", "10");
        sheet.setCell("B1", "=A1*2");
        assertTrue(sheet.isBatchActive());
        assertEquals("1", display("A1"));
        assertNull(raw("B1"));
        assertTrue(events.isEmpty());

        sheet.commitBatch(batchId);
        assertEquals("20", display("B1"));
        assertEquals(EventType.BATCH_STARTED, events.get(0).getType());
        assertEquals(EventType.BATCH_COMPLETED, events.get(events.size() - 1).getType());
        assertEquals(2, events.get(0).getOperationCount());
        assertTrue(eventTypes().contains(EventType.CELL_UPDATED));

        sheet.undo();
        assertEquals("1", display("A1"));
        assertNull(raw("B1"));
    }

    @Test
    void testBatchRollback() {
        sheet.setCell("A1", "1");
        events.clear();
        String batchId = sheet.beginBatch();
        sheet.setCell("A1", "99");
        sheet.deleteCell("A1");
        sheet.rollbackBatch(batchId);

        assertFalse(sheet.isBatchActive());
        assertEquals("1", display("A1"));
        assertTrue(events.isEmpty());
        assertEquals(1, sheet.getUndoHistory().size());
    }

    /**
     * A failing edit inside a batch reverts the edits already applied.
     */
    @Test
    void testFailingBatchIsAllOrNothing() {
        String batchId = sheet.beginBatch();
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "=B1");
        assertThrows(CircularReferenceException.class, () -> sheet.commitBatch(batchId));

        assertFalse(sheet.isBatchActive());
        assertTrue(sheet.getCells().isEmpty());
        assertFalse(sheet.canUndo());
    }

    @Test
    void testBatchState() {
        String batchId = sheet.beginBatch();
        assertThrows(BatchStateException.class, () -> sheet.beginBatch());
        assertThrows(BatchStateException.class, () -> sheet.undo());
        assertThrows(BatchStateException.class, () -> sheet.redo());
        // syntax is still checked while queuing
        assertThrows(FormulaParseException.class, () -> sheet.setCell("A1", "=SUM("));
        sheet.commitBatch(batchId);
        assertFalse(sheet.canUndo());
    }

    @Test
    void testEventOrderForSingleEdit() {
        sheet.setCell("C1", "=A1*2");
        events.clear();

        sheet.setCell("A1", "4");
        assertEquals(List.of(EventType.CELL_UPDATED, EventType.RECALCULATION_STARTED,
                EventType.RECALCULATION_COMPLETED), eventTypes());
        SpreadsheetEvent updated = events.get(0);
        assertEquals(CellAddress.fromA1("A1"), updated.getAddress());
        assertEquals(CellValue.EMPTY, updated.getOldValue());
        assertEquals(CellValue.number(4), updated.getNewValue());
        assertEquals(List.of(CellAddress.fromA1("C1")), events.get(1).getAffectedCells());

        events.clear();
        sheet.deleteCell("A1");
        assertEquals(EventType.CELL_DELETED, events.get(0).getType());
        assertEquals(CellValue.number(4), events.get(0).getOldValue());
    }

    @Test
    void testFailingListenerDoesNotBreakEdits() {
        sheet.addListener(event -> {
            throw new IllegalStateException("listener down");
        });
        sheet.setCell("A1", "1");
        assertEquals("1", display("A1"));
        assertFalse(events.isEmpty());
    }

    @Test
    void testRecalculateAll() {
        sheet.setCell("A1", "2");
        sheet.setCell("B1", "=A1^2");
        events.clear();
        sheet.recalculateAll();
        assertEquals("4", display("B1"));
        assertEquals(List.of(EventType.RECALCULATION_STARTED, EventType.RECALCULATION_COMPLETED), eventTypes());
    }

    /**
     * Naming the sheet itself ("Sheet1!A1" on Sheet1) is the same as a plain A1:
     * the edge is recorded and the cell follows its source.
     */
    @Test
    void testOwnSheetQualifiedReferencePropagates() {
        sheet.setCell("A1", "10");
        sheet.setCell("B1", "=Sheet1!A1");
        sheet.setCell("C1", "=SUM(sheet1!A1:A2)");
        assertEquals(Set.of(CellAddress.fromA1("A1")), sheet.getDependencies(CellAddress.fromA1("B1")));

        sheet.setCell("A1", "20");
        assertEquals("20", display("B1"));
        assertEquals("20", display("C1"));
        assertEquals("=Sheet1!A1", raw("B1"));
    }

    @Test
    void testOwnSheetQualifiedLoopIsRejected() {
        sheet.setCell("A1", "=Sheet1!B1");
        assertThrows(CircularReferenceException.class, () -> sheet.setCell("B1", "=Sheet1!A1"));
        assertNull(raw("B1"));
        assertEquals(Optional.of("Set A1 to \"=Sheet1!B1\""), sheet.peekUndo());

        assertThrows(CircularReferenceException.class, () -> sheet.setCell("C1", "='Sheet1'!C1+1"));
        assertNull(raw("C1"));
    }

    /**
     * A huge digit count fed into ROUND from another cell is a valid edit:
     * every dependent is refreshed and the edit is undoable.
     */
    @Test
    void testRoundWithHugeDigitCountFromCell() {
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "=ROUND(1.5,A1)");
        sheet.setCell("C1", "=A1+1");

        sheet.setCell("A1", "2147483647");
        assertEquals("1.5", display("B1"));
        assertEquals(CellValue.number(2147483648.0), sheet.getCellValue("C1"));
        assertEquals(Optional.of("Set A1 to \"2147483647\""), sheet.peekUndo());
    }

    /**
     * A formula that blows up during a pass gets an error value; the rest of
     * the pass still runs.
     */
    @Test
    void testFailingFormulaDoesNotAbortRecalculation() {
        AtomicBoolean broken = new AtomicBoolean(false);
        SheetResolver resolver = (sheetName, address) -> {
            if (broken.get()) {
                throw new IllegalStateException("store unavailable");
            }
            return CellValue.number(100);
        };
        SpreadsheetFacade local = new SpreadsheetFacade("Sheet1", new EngineProperties(), resolver,
                new InMemoryCellRepository());
        local.setCell("A1", "1");
        local.setCell("B1", "=Other!A1+A1");
        local.setCell("C1", "=A1*2");
        assertEquals("101", local.getCellValue("B1").toDisplayString());

        broken.set(true);
        local.setCell("A1", "5");
        assertEquals("#VALUE!", local.getCellValue("B1").toDisplayString());
        assertEquals("10", local.getCellValue("C1").toDisplayString());
        assertEquals(Optional.of("Set A1 to \"5\""), local.peekUndo());

        broken.set(false);
        local.undo();
        assertEquals("101", local.getCellValue("B1").toDisplayString());
        assertEquals("2", local.getCellValue("C1").toDisplayString());
    }
}
