package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.events.SheetEvent;
import com.spreadsheet.calc.events.SpreadsheetEvent.EventType;
import com.spreadsheet.calc.exceptions.DuplicateSheetException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkbookService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class WorkbookServiceTest {

    private WorkbookService workbookService;
    private List<Object> published;

    @BeforeEach
    void setUp() {
        published = Collections.synchronizedList(new ArrayList<>());
        workbookService = new WorkbookService(new EngineProperties(), published::add);
    }

    @Test
    void testDefaultSheetExists() {
        assertEquals(List.of("Sheet1"), workbookService.listSheets());
        assertNotNull(workbookService.getSheet("sheet1"));
    }

    @Test
    void testCreateAndRemoveSheets() {
        workbookService.createSheet("Budget");
        assertEquals(List.of("Sheet1", "Budget"), workbookService.listSheets());
        assertThrows(DuplicateSheetException.class, () -> workbookService.createSheet("BUDGET"));
        assertThrows(InvalidAddressException.class, () -> workbookService.createSheet("bad!name"));
        assertThrows(InvalidAddressException.class, () -> workbookService.createSheet(" "));

        workbookService.removeSheet("budget");
        assertEquals(List.of("Sheet1"), workbookService.listSheets());
        assertThrows(SheetNotFoundException.class, () -> workbookService.removeSheet("Budget"));
        assertThrows(SheetNotFoundException.class, () -> workbookService.getSheetData("Budget"));
    }

    /**
     * Display values keyed by A1 address, in row-major order.
     */
    @Test
    void testSheetData() {
        workbookService.setCellValue("Sheet1", "B1", "20");
        workbookService.setCellValue("Sheet1", "A1", "10");
        workbookService.setCellValue("Sheet1", "A2", "=A1+B1");
        Map<String, String> data = workbookService.getSheetData("Sheet1");
        assertEquals(List.of("A1", "B1", "A2"), new ArrayList<>(data.keySet()));
        assertEquals("30", data.get("A2"));

        assertEquals(List.of("A2"), workbookService.getDependents("Sheet1", "A1"));
        assertEquals(List.of("A1", "B1"), workbookService.getDependencies("Sheet1", "A2"));
        assertEquals("=A1+B1", workbookService.getCell("Sheet1", "A2").getRawValue());
    }

    @Test
    void testCrossSheetReferences() {
        workbookService.createSheet("Rates");
        workbookService.setCellValue("Rates", "A1", "0.5");
        workbookService.setCellValue("Sheet1", "A1", "=Rates!A1*10");
        assertEquals("5", workbookService.getCell("Sheet1", "A1").getValue());

        // other sheets are not tracked as dependencies: a recalculation picks the change up
        workbookService.setCellValue("Rates", "A1", "2");
        workbookService.recalculate("Sheet1");
        assertEquals("20", workbookService.getCell("Sheet1", "A1").getValue());

        workbookService.removeSheet("Rates");
        workbookService.recalculate("Sheet1");
        assertEquals("#REF!", workbookService.getCell("Sheet1", "A1").getValue());
    }

    @Test
    void testStructuralEditsUseOneBasedNumbers() {
        workbookService.setCellValue("Sheet1", "A5", "7");
        workbookService.setCellValue("Sheet1", "C1", "=A5*2");
        workbookService.deleteRow("Sheet1", 5);
        assertEquals("#REF!", workbookService.getCell("Sheet1", "C1").getValue());
        assertTrue(workbookService.undo("Sheet1"));
        assertEquals("14", workbookService.getCell("Sheet1", "C1").getValue());

        workbookService.insertColumn("Sheet1", "A");
        assertEquals("=B5*2", workbookService.getCell("Sheet1", "D1").getRawValue());
        workbookService.deleteColumn("Sheet1", "b");
        assertEquals("#REF!", workbookService.getCell("Sheet1", "C1").getValue());
        assertThrows(InvalidAddressException.class, () -> workbookService.insertRow("Sheet1", 0));
    }

    @Test
    void testBatchThroughService() {
        String batchId = workbookService.beginBatch("Sheet1");
        workbookService.setCellValue("Sheet1", "A1", "1");
        workbookService.setCellValue("Sheet1", "A2", "=A1+1");
        assertTrue(workbookService.getSheetData("Sheet1").isEmpty());
        workbookService.commitBatch("Sheet1", batchId);
        assertEquals("2", workbookService.getSheetData("Sheet1").get("A2"));
    }

    /**
     * Facade events reach the application event bus tagged with their sheet.
     */
    @Test
    void testEventsArePublished() {
        workbookService.setCellValue("Sheet1", "A1", "1");
        assertFalse(published.isEmpty());
        SheetEvent first = (SheetEvent) published.get(0);
        assertEquals("Sheet1", first.getSheetName());
        assertEquals(EventType.CELL_UPDATED, first.getEvent().getType());
    }

    /**
     * Concurrent writers on two sheets that read each other finish without deadlock,
     * and every write lands.
     */
    @Test
    void testConcurrentWrites() throws Exception {
        workbookService.createSheet("Other");
        workbookService.setCellValue("Sheet1", "Z1", "=Other!A1");
        workbookService.setCellValue("Other", "Z1", "=Sheet1!A1");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            String sheet = t % 2 == 0 ? "Sheet1" : "Other";
            int column = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int row = 1; row <= 50; row++) {
                    workbookService.setCellValue(sheet, (char) ('A' + column) + String.valueOf(row), String.valueOf(row));
                    workbookService.getSheetData(sheet);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals("50", workbookService.getCell("Sheet1", "A50").getValue());
        assertEquals("50", workbookService.getCell("Other", "B50").getValue());
        assertEquals("50", workbookService.getCell("Sheet1", "C50").getValue());
        assertEquals("50", workbookService.getCell("Other", "D50").getValue());
    }
}
