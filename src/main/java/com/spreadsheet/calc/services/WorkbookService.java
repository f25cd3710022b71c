package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.evaluator.SheetResolver;
import com.spreadsheet.calc.events.SheetEvent;
import com.spreadsheet.calc.exceptions.DuplicateSheetException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.exceptions.SpreadsheetException;
import com.spreadsheet.calc.facade.SpreadsheetFacade;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellResponse;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.repository.InMemoryCellRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Holds the sheets of the workbook, keyed by name (case-insensitive),
 * and resolves sheet-qualified references between them.
 *
 * Mutations across the whole workbook are serialised by one lock: a formula
 * on one sheet may read another sheet while its own sheet is write-locked,
 * and two sheets doing that to each other at once would deadlock.
 * Reads go straight to the sheet and only take its read lock.
 */
@Slf4j
@Service
public class WorkbookService implements SheetResolver {

    private static final Pattern SHEET_NAME_PATTERN = Pattern.compile("^[^!'\\[\\]*?/\\\\:]{1,31}$");

    private final Map<String, SpreadsheetFacade> sheets = new ConcurrentHashMap<>();
    private final List<String> sheetOrder = new ArrayList<>();
    private final EngineProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public WorkbookService(EngineProperties properties, ApplicationEventPublisher eventPublisher) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        createSheet(properties.getDefaultSheetName());
    }

    // ------------------------
    // Sheets
    // ------------------------

    /**
     * Creates an empty sheet. Names are unique ignoring case.
     */
    public String createSheet(String name) {
        if (name == null || !SHEET_NAME_PATTERN.matcher(name.trim()).matches()) {
            throw new InvalidAddressException("Invalid sheet name: " + name);
        }
        String sheetName = name.trim();
        return withMutationLock(() -> {
            String key = key(sheetName);
            if (sheets.containsKey(key)) {
                throw new DuplicateSheetException(sheetName);
            }
            SpreadsheetFacade sheet = new SpreadsheetFacade(sheetName, properties, this, new InMemoryCellRepository());
            sheet.addListener(event -> eventPublisher.publishEvent(new SheetEvent(sheetName, event)));
            sheets.put(key, sheet);
            sheetOrder.add(sheetName);
            log.info("Created sheet '{}'", sheetName);
            return sheetName;
        });
    }

    /**
     * Removes a sheet. Formulas elsewhere that point at it show #REF! once recalculated.
     */
    public void removeSheet(String name) {
        withMutationLock(() -> {
            SpreadsheetFacade removed = sheets.remove(key(name));
            if (removed == null) {
                throw new SheetNotFoundException("Sheet not found: " + name);
            }
            sheetOrder.remove(removed.getSheetName());
            log.info("Removed sheet '{}'", removed.getSheetName());
            return null;
        });
    }

    /**
     * Sheet names in creation order.
     */
    public List<String> listSheets() {
        mutationLock.lock();
        try {
            return new ArrayList<>(sheetOrder);
        } finally {
            mutationLock.unlock();
        }
    }

    public SpreadsheetFacade getSheet(String name) {
        SpreadsheetFacade sheet = name == null ? null : sheets.get(key(name));
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + name);
        }
        return sheet;
    }

    /**
     * Display values of every stored cell, keyed by A1 address in row-major order,
     * e.g. { "A1": "10", "B1": "20", "C1": "30" }.
     */
    public Map<String, String> getSheetData(String name) {
        Map<String, String> data = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Cell> entry : getSheet(name).getCells().entrySet()) {
            data.put(entry.getKey().toA1(), entry.getValue().getEvaluatedValue().toDisplayString());
        }
        return data;
    }

    // ------------------------
    // Cells
    // ------------------------

    public void setCellValue(String sheetName, String a1, String rawValue) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        CellAddress address = CellAddress.fromA1(a1);
        withMutationLock(() -> {
            sheet.setCell(address, rawValue);
            return null;
        });
    }

    public void deleteCell(String sheetName, String a1) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        CellAddress address = CellAddress.fromA1(a1);
        withMutationLock(() -> {
            sheet.deleteCell(address);
            return null;
        });
    }

    public CellResponse getCell(String sheetName, String a1) {
        CellAddress address = CellAddress.fromA1(a1);
        return CellResponse.of(address, getSheet(sheetName).getCell(address).orElse(null));
    }

    public List<String> getDependents(String sheetName, String a1) {
        return toA1(getSheet(sheetName).getDependents(CellAddress.fromA1(a1)));
    }

    public List<String> getDependencies(String sheetName, String a1) {
        return toA1(getSheet(sheetName).getDependencies(CellAddress.fromA1(a1)));
    }

    // ------------------------
    // Undo / redo and batches
    // ------------------------

    public boolean undo(String sheetName) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        return withMutationLock(sheet::undo);
    }

    public boolean redo(String sheetName) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        return withMutationLock(sheet::redo);
    }

    public String beginBatch(String sheetName) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        return withMutationLock(sheet::beginBatch);
    }

    public void commitBatch(String sheetName, String batchId) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        withMutationLock(() -> {
            sheet.commitBatch(batchId);
            return null;
        });
    }

    public void rollbackBatch(String sheetName, String batchId) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        withMutationLock(() -> {
            sheet.rollbackBatch(batchId);
            return null;
        });
    }

    // ------------------------
    // Structural edits (1-based row numbers, column letters)
    // ------------------------

    public void insertRow(String sheetName, int rowNumber) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        int row = toRowIndex(rowNumber);
        withMutationLock(() -> {
            sheet.insertRow(row);
            return null;
        });
    }

    public void deleteRow(String sheetName, int rowNumber) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        int row = toRowIndex(rowNumber);
        withMutationLock(() -> {
            sheet.deleteRow(row);
            return null;
        });
    }

    public void insertColumn(String sheetName, String letters) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        int column = CellAddress.columnLabelToIndex(letters);
        withMutationLock(() -> {
            sheet.insertColumn(column);
            return null;
        });
    }

    public void deleteColumn(String sheetName, String letters) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        int column = CellAddress.columnLabelToIndex(letters);
        withMutationLock(() -> {
            sheet.deleteColumn(column);
            return null;
        });
    }

    public void recalculate(String sheetName) {
        SpreadsheetFacade sheet = getSheet(sheetName);
        withMutationLock(() -> {
            sheet.recalculateAll();
            return null;
        });
    }

    // ------------------------
    // SheetResolver
    // ------------------------

    @Override
    public CellValue getCellValue(String sheetName, CellAddress address) {
        return getSheet(sheetName).getCellValue(address);
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private <T> T withMutationLock(Supplier<T> action) {
        mutationLock.lock();
        try {
            return action.get();
        } catch (SpreadsheetException e) {
            log.debug("Workbook mutation rejected: {}", e.getMessage());
            throw e;
        } finally {
            mutationLock.unlock();
        }
    }

    private static int toRowIndex(int rowNumber) {
        if (rowNumber < 1) {
            throw new InvalidAddressException("Row number must be greater than 0: " + rowNumber);
        }
        return rowNumber - 1;
    }

    private static List<String> toA1(Iterable<CellAddress> addresses) {
        List<String> result = new ArrayList<>();
        for (CellAddress address : addresses) {
            result.add(address.toA1());
        }
        return result;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
