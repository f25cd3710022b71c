package com.spreadsheet.calc.facade;

import com.spreadsheet.calc.commands.BatchCommand;
import com.spreadsheet.calc.commands.BatchManager;
import com.spreadsheet.calc.commands.CommandExecutor;
import com.spreadsheet.calc.commands.DeleteCellCommand;
import com.spreadsheet.calc.commands.SetCellCommand;
import com.spreadsheet.calc.commands.StructuralEdit;
import com.spreadsheet.calc.commands.StructuralEditCommand;
import com.spreadsheet.calc.commands.UndoRedoManager;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.dependency.DependencyGraph;
import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.SheetResolver;
import com.spreadsheet.calc.events.SpreadsheetEvent;
import com.spreadsheet.calc.events.SpreadsheetEventListener;
import com.spreadsheet.calc.exceptions.BatchStateException;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.SpreadsheetException;
import com.spreadsheet.calc.formula.Expr;
import com.spreadsheet.calc.formula.FormulaFormatter;
import com.spreadsheet.calc.formula.FormulaParser;
import com.spreadsheet.calc.formula.FormulaTransformer;
import com.spreadsheet.calc.formula.ReferenceExtractor;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.repository.CellRepository;
import com.spreadsheet.calc.repository.InMemoryCellRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Entry point to one sheet: cell edits, recalculation, batches, undo/redo,
 * structural edits and change events.
 *
 * Every mutation follows the same steps:
 * 1) Validate (parse, cycle check, trial evaluation) before anything is stored.
 * 2) Apply the change and remember the value each touched cell had before.
 * 3) Recalculate the touched cells and everything downstream, in dependency order.
 * 4) After the write lock is released, notify listeners.
 * A mutation that throws leaves cells, dependency graph and undo history as they were.
 */
@Slf4j
public class SpreadsheetFacade {

    private final String sheetName;
    private final EngineProperties properties;
    private final CellRepository repository;
    private final SheetResolver sheetResolver;
    private final FormulaParser parser;
    private final FormulaTransformer transformer;
    private final Evaluator evaluator = new Evaluator();
    private final DependencyGraph graph = new DependencyGraph();
    private final UndoRedoManager undoRedo;
    private final BatchManager batches = new BatchManager();
    private final Executor executor = new Executor();
    private final List<SpreadsheetEventListener> listeners = new CopyOnWriteArrayList<>();

    // Single writer, many readers
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // State of the mutation in progress; only touched while holding the write lock
    private final Map<CellAddress, CellValue> touched = new LinkedHashMap<>();
    private boolean fullRecalculationNeeded;

    public SpreadsheetFacade() {
        this(new EngineProperties());
    }

    public SpreadsheetFacade(EngineProperties properties) {
        this(properties.getDefaultSheetName(), properties, SheetResolver.NONE, new InMemoryCellRepository());
    }

    public SpreadsheetFacade(String sheetName, EngineProperties properties,
                             SheetResolver sheetResolver, CellRepository repository) {
        this.sheetName = sheetName;
        this.properties = properties;
        this.sheetResolver = sheetResolver;
        this.repository = repository;
        this.parser = new FormulaParser(properties.getMaxColumns(), properties.getMaxRows());
        this.transformer = new FormulaTransformer(properties.getMaxColumns(), properties.getMaxRows());
        this.undoRedo = new UndoRedoManager(properties.getMaxUndoStackSize(), properties.getMaxRedoStackSize());
    }

    public String getSheetName() {
        return sheetName;
    }

    // ------------------------
    // Cell edits
    // ------------------------

    /**
     * Stores raw input. Text starting with "=" is a formula; anything else is a
     * literal (number, TRUE/FALSE, text, or empty).
     * While a batch is open the edit is only queued; formulas are still
     * parse-checked right away.
     */
    public void setCell(CellAddress address, String rawValue) {
        String raw = rawValue == null ? "" : rawValue;
        checkBounds(address);
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (batches.isActive()) {
                if (FormulaParser.isFormula(raw)) {
                    parser.parse(raw);
                }
                batches.queue(new SetCellCommand(address, raw));
                log.debug("[{}] Queued {} = '{}' in {}", sheetName, address, raw, batches.getActiveBatchId());
            } else {
                applyAndRecalculate(() -> {
                    undoRedo.execute(new SetCellCommand(address, raw), executor);
                    return null;
                }, null, null, events);
            }
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    public void setCell(String a1, String rawValue) {
        setCell(CellAddress.fromA1(a1), rawValue);
    }

    /**
     * Removes a cell. Formulas reading it see an empty value afterwards.
     * Deleting a cell that does not exist changes nothing and records no undo step.
     */
    public void deleteCell(CellAddress address) {
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (batches.isActive()) {
                batches.queue(new DeleteCellCommand(address));
                log.debug("[{}] Queued delete of {} in {}", sheetName, address, batches.getActiveBatchId());
            } else if (repository.contains(address)) {
                applyAndRecalculate(() -> {
                    undoRedo.execute(new DeleteCellCommand(address), executor);
                    return null;
                }, null, null, events);
            }
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    public void deleteCell(String a1) {
        deleteCell(CellAddress.fromA1(a1));
    }

    // ------------------------
    // Reads
    // ------------------------

    public Optional<Cell> getCell(CellAddress address) {
        lock.readLock().lock();
        try {
            return repository.get(address).map(Cell::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Last computed value; EMPTY for a cell that was never set.
     */
    public CellValue getCellValue(CellAddress address) {
        lock.readLock().lock();
        try {
            return currentValue(address);
        } finally {
            lock.readLock().unlock();
        }
    }

    public CellValue getCellValue(String a1) {
        return getCellValue(CellAddress.fromA1(a1));
    }

    public String getDisplayValue(CellAddress address) {
        return getCellValue(address).toDisplayString();
    }

    /**
     * Copy of every stored cell, ordered by address.
     */
    public Map<CellAddress, Cell> getCells() {
        lock.readLock().lock();
        try {
            return repository.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public SortedSet<CellAddress> getDependents(CellAddress address) {
        lock.readLock().lock();
        try {
            return graph.getDependents(address);
        } finally {
            lock.readLock().unlock();
        }
    }

    public SortedSet<CellAddress> getDependencies(CellAddress address) {
        lock.readLock().lock();
        try {
            return graph.getDependencies(address);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------
    // Recalculation
    // ------------------------

    /**
     * Recomputes everything that reads {@code address}, directly or indirectly.
     */
    public void recalculateDependents(CellAddress address) {
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Set<CellAddress> affected = graph.getTransitiveDependents(Collections.singleton(address));
            recalculate(graph.topologicalOrder(affected), events);
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    /**
     * Recomputes every formula cell in one pass, dependencies first.
     */
    public void recalculateAll() {
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            recalculate(graph.getCalculationOrder(), events);
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    // ------------------------
    // Batches
    // ------------------------

    /**
     * Opens a batch. Until commit, edits are queued with no visible effect.
     * Only one batch can be open at a time.
     */
    public String beginBatch() {
        lock.writeLock().lock();
        try {
            String batchId = batches.begin();
            log.debug("[{}] Opened {}", sheetName, batchId);
            return batchId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies the queued edits as one undo step, then recalculates once.
     * If any edit fails, the ones already applied are reverted, the batch is
     * closed and the failure is rethrown.
     */
    public void commitBatch(String batchId) {
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            BatchCommand batch = batches.close(batchId);
            int count = batch.size();
            applyAndRecalculate(() -> {
                batch.execute(executor);
                if (count > 0) {
                    undoRedo.record(batch);
                }
                return null;
            }, SpreadsheetEvent.batchStarted(batchId, count), SpreadsheetEvent.batchCompleted(batchId, count), events);
            log.info("[{}] Committed {} with {} operations", sheetName, batchId, count);
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    /**
     * Drops the queued edits. Nothing was applied, so nothing changes.
     */
    public void rollbackBatch(String batchId) {
        lock.writeLock().lock();
        try {
            int discarded = batches.discard(batchId);
            log.info("[{}] Rolled back {} ({} operations discarded)", sheetName, batchId, discarded);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isBatchActive() {
        lock.readLock().lock();
        try {
            return batches.isActive();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------
    // Undo / redo
    // ------------------------

    /**
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        return replayHistory("undo", () -> undoRedo.undo(executor));
    }

    /**
     * @return false if there was nothing to redo
     */
    public boolean redo() {
        return replayHistory("redo", () -> undoRedo.redo(executor));
    }

    public boolean canUndo() {
        return readHistory(undoRedo::canUndo);
    }

    public boolean canRedo() {
        return readHistory(undoRedo::canRedo);
    }

    public Optional<String> peekUndo() {
        return readHistory(undoRedo::peekUndo);
    }

    public Optional<String> peekRedo() {
        return readHistory(undoRedo::peekRedo);
    }

    public List<String> getUndoHistory() {
        return readHistory(undoRedo::getUndoHistory);
    }

    public List<String> getRedoHistory() {
        return readHistory(undoRedo::getRedoHistory);
    }

    public void clearHistory() {
        lock.writeLock().lock();
        try {
            undoRedo.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------
    // Structural edits (0-based indexes)
    // ------------------------

    public void insertRow(int row) {
        checkRow(row);
        structuralEdit(StructuralEdit.insertRow(row));
    }

    public void deleteRow(int row) {
        checkRow(row);
        structuralEdit(StructuralEdit.deleteRow(row));
    }

    public void insertColumn(int column) {
        checkColumn(column);
        structuralEdit(StructuralEdit.insertColumn(column));
    }

    public void deleteColumn(int column) {
        checkColumn(column);
        structuralEdit(StructuralEdit.deleteColumn(column));
    }

    /**
     * Moves the cells of {@code source} so that its top-left corner lands on
     * {@code targetTopLeft}. Whatever was in the target area is overwritten.
     */
    public void moveRange(CellRange source, CellAddress targetTopLeft) {
        checkBounds(source.getEnd());
        checkBounds(targetTopLeft.offset(source.getWidth() - 1, source.getHeight() - 1));
        structuralEdit(StructuralEdit.moveRange(source, targetTopLeft));
    }

    private void structuralEdit(StructuralEdit edit) {
        List<SpreadsheetEvent> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (batches.isActive()) {
                batches.queue(new StructuralEditCommand(edit));
                log.debug("[{}] Queued '{}' in {}", sheetName, edit.describe(), batches.getActiveBatchId());
            } else {
                applyAndRecalculate(() -> {
                    undoRedo.execute(new StructuralEditCommand(edit), executor);
                    return null;
                }, null, null, events);
                log.info("[{}] {}", sheetName, edit.describe());
            }
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
    }

    // ------------------------
    // Listeners
    // ------------------------

    public void addListener(SpreadsheetEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SpreadsheetEventListener listener) {
        listeners.remove(listener);
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private boolean replayHistory(String operation, Supplier<Boolean> action) {
        List<SpreadsheetEvent> events = new ArrayList<>();
        boolean replayed;
        lock.writeLock().lock();
        try {
            if (batches.isActive()) {
                throw new BatchStateException("Cannot " + operation + " while batch "
                        + batches.getActiveBatchId() + " is open");
            }
            replayed = applyAndRecalculate(action, null, null, events);
        } finally {
            lock.writeLock().unlock();
        }
        fire(events);
        return replayed;
    }

    /**
     * Runs one mutation and the recalculation it calls for, collecting the
     * events to publish. Caller holds the write lock and fires the events
     * once it has released it.
     */
    private <T> T applyAndRecalculate(Supplier<T> action, SpreadsheetEvent first, SpreadsheetEvent last,
                                      List<SpreadsheetEvent> events) {
        touched.clear();
        fullRecalculationNeeded = false;
        try {
            T result = action.get();
            if (first != null) {
                events.add(first);
            }
            finishMutation(events);
            if (last != null) {
                events.add(last);
            }
            return result;
        } catch (SpreadsheetException e) {
            log.warn("[{}] Rejected: {}", sheetName, e.getMessage());
            throw e;
        } finally {
            touched.clear();
            fullRecalculationNeeded = false;
        }
    }

    private void finishMutation(List<SpreadsheetEvent> events) {
        List<SpreadsheetEvent> cellEvents = new ArrayList<>();
        for (Map.Entry<CellAddress, CellValue> entry : touched.entrySet()) {
            CellAddress address = entry.getKey();
            if (!repository.contains(address)) {
                cellEvents.add(SpreadsheetEvent.cellDeleted(address, entry.getValue()));
            }
        }

        List<CellAddress> order;
        if (fullRecalculationNeeded) {
            order = graph.getCalculationOrder();
        } else if (!touched.isEmpty()) {
            Set<CellAddress> affected = new HashSet<>();
            for (CellAddress address : touched.keySet()) {
                if (graph.isFormulaCell(address)) {
                    affected.add(address);
                }
            }
            affected.addAll(graph.getTransitiveDependents(touched.keySet()));
            order = graph.topologicalOrder(affected);
        } else {
            return;
        }

        List<SpreadsheetEvent> recalculationEvents = new ArrayList<>();
        recalculate(order, recalculationEvents);

        // updated-cell events carry the value after recalculation
        for (Map.Entry<CellAddress, CellValue> entry : touched.entrySet()) {
            Optional<Cell> cell = repository.get(entry.getKey());
            if (cell.isPresent()) {
                cellEvents.add(SpreadsheetEvent.cellUpdated(entry.getKey(), entry.getValue(),
                        cell.get().getEvaluatedValue()));
            }
        }
        events.addAll(cellEvents);
        events.addAll(recalculationEvents);
    }

    /**
     * Evaluates the given formula cells in order. A cell whose evaluation throws
     * gets an error value; the pass carries on.
     */
    private void recalculate(List<CellAddress> order, List<SpreadsheetEvent> events) {
        events.add(SpreadsheetEvent.recalculationStarted(order));
        long start = System.nanoTime();
        for (CellAddress address : order) {
            Optional<Cell> cell = repository.get(address);
            if (cell.isPresent() && cell.get().hasFormula()) {
                cell.get().setEvaluatedValue(evaluateSafely(address, cell.get().getFormula()));
            }
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        events.add(SpreadsheetEvent.recalculationCompleted(order, elapsed));
        log.debug("[{}] Recalculated {} cells in {} ms", sheetName, order.size(), elapsed.toMillis());
    }

    private CellValue evaluateSafely(CellAddress address, Expr formula) {
        try {
            return evaluator.evaluateCell(address, formula, new SheetContext());
        } catch (SpreadsheetException e) {
            log.warn("[{}] Evaluation of {} failed: {}", sheetName, address, e.getMessage());
            return CellValue.error(ErrorKind.valueError("evaluable formula", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure evaluating {}", sheetName, address, e);
            return CellValue.error(ErrorKind.valueError("evaluable formula", String.valueOf(e.getMessage())));
        }
    }

    private CellValue currentValue(CellAddress address) {
        return repository.get(address).map(Cell::getEvaluatedValue).orElse(CellValue.EMPTY);
    }

    private void fire(List<SpreadsheetEvent> events) {
        for (SpreadsheetEvent event : events) {
            for (SpreadsheetEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("[{}] Listener failed on {}: {}", sheetName, event.getType(), e.getMessage(), e);
                }
            }
        }
    }

    private <T> T readHistory(Supplier<T> read) {
        lock.readLock().lock();
        try {
            return read.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void checkBounds(CellAddress address) {
        if (address.getColumn() >= properties.getMaxColumns() || address.getRow() >= properties.getMaxRows()) {
            throw new InvalidAddressException("Cell " + address.toA1() + " is outside the sheet");
        }
    }

    private void checkRow(int row) {
        if (row < 0 || row >= properties.getMaxRows()) {
            throw new InvalidAddressException("Row " + (row + 1) + " is outside the sheet");
        }
    }

    private void checkColumn(int column) {
        if (column < 0 || column >= properties.getMaxColumns()) {
            throw new InvalidAddressException("Column index " + column + " is outside the sheet");
        }
    }

    /**
     * Rebuilds every edge from the stored formulas, e.g. after cells moved.
     */
    private void rebuildGraph() {
        graph.clear();
        for (Map.Entry<CellAddress, Cell> entry : repository.snapshot().entrySet()) {
            Cell cell = entry.getValue();
            if (!cell.hasFormula()) {
                continue;
            }
            try {
                graph.setDependencies(entry.getKey(), ReferenceExtractor.extract(cell.getFormula()));
            } catch (CircularReferenceException e) {
                // keep the cell out of the loop: it stays a formula cell without edges
                log.warn("[{}] {} after structural edit; {} set to #CIRC!", sheetName, e.getMessage(),
                        entry.getKey());
                graph.setDependencies(entry.getKey(), Collections.emptySet());
                Cell broken = cell.copy();
                broken.setFormula(Expr.literal(CellValue.error(ErrorKind.circularDependency(e.getCycle()))),
                        "=" + ErrorKind.Type.CIRCULAR_DEPENDENCY.getCode());
                repository.put(entry.getKey(), broken);
            }
        }
    }

    /**
     * Values come from this sheet's store; sheet-qualified references go through the resolver.
     */
    private final class SheetContext implements EvaluationContext {
        private final Set<CellAddress> evaluating = new HashSet<>();

        @Override
        public CellValue getCellValue(CellAddress address) {
            return currentValue(address);
        }

        @Override
        public CellValue getSheetCellValue(String sheet, CellAddress address) {
            if (sheet.equalsIgnoreCase(sheetName)) {
                if (isEvaluating(address)) {
                    return CellValue.error(ErrorKind.circularDependency(List.of(address)));
                }
                return currentValue(address);
            }
            return sheetResolver.getCellValue(sheet, address);
        }

        @Override
        public boolean isEvaluating(CellAddress address) {
            return evaluating.contains(address);
        }

        @Override
        public void push(CellAddress address) {
            evaluating.add(address);
        }

        @Override
        public void pop(CellAddress address) {
            evaluating.remove(address);
        }
    }

    /**
     * The raw mutations commands are made of. Each records the touched cells
     * so the surrounding mutation knows what to recalculate.
     */
    private final class Executor implements CommandExecutor {

        @Override
        public Optional<Cell> applySetCell(CellAddress address, String rawValue) {
            Optional<Cell> previous = repository.get(address).map(Cell::copy);
            Cell newCell;
            if (FormulaParser.isFormula(rawValue)) {
                Expr formula = FormulaTransformer.localize(parser.parse(rawValue), sheetName);
                Set<CellAddress> dependencies = ReferenceExtractor.extract(formula);
                graph.validateDependencies(address, dependencies);
                // throws on a wrong argument count, before anything is stored
                CellValue value = evaluator.evaluateCell(address, formula, new SheetContext());
                graph.setDependencies(address, dependencies);
                newCell = new Cell(rawValue, formula, value);
            } else {
                graph.removeDependencies(address);
                newCell = Cell.literal(rawValue);
            }
            touched.putIfAbsent(address, previous.map(Cell::getEvaluatedValue).orElse(CellValue.EMPTY));
            repository.put(address, newCell);
            log.debug("[{}] Set {} = '{}'", sheetName, address, rawValue);
            return previous;
        }

        @Override
        public Optional<Cell> applyDeleteCell(CellAddress address) {
            Optional<Cell> removed = repository.remove(address);
            if (removed.isPresent()) {
                graph.removeDependencies(address);
                touched.putIfAbsent(address, removed.get().getEvaluatedValue());
                log.debug("[{}] Deleted {}", sheetName, address);
            }
            return removed;
        }

        @Override
        public void restoreCell(CellAddress address, Optional<Cell> previous) {
            CellValue before = currentValue(address);
            if (previous.isPresent()) {
                Cell cell = previous.get().copy();
                if (cell.hasFormula()) {
                    graph.setDependencies(address, ReferenceExtractor.extract(cell.getFormula()));
                } else {
                    graph.removeDependencies(address);
                }
                repository.put(address, cell);
            } else {
                repository.remove(address);
                graph.removeDependencies(address);
            }
            touched.putIfAbsent(address, before);
        }

        @Override
        public void applyStructuralEdit(StructuralEdit edit) {
            Map<CellAddress, Cell> relocated = new TreeMap<>();
            Map<CellAddress, Cell> movedBlock = new TreeMap<>();
            for (Map.Entry<CellAddress, Cell> entry : repository.snapshot().entrySet()) {
                Cell cell = entry.getValue();
                if (cell.hasFormula()) {
                    Expr rewritten = rewrite(edit, cell.getFormula());
                    if (!rewritten.equals(cell.getFormula())) {
                        cell.setFormula(rewritten, "=" + FormulaFormatter.format(rewritten));
                    }
                }
                CellAddress target = relocate(edit, entry.getKey());
                if (target == null) {
                    log.debug("[{}] {} dropped by '{}'", sheetName, entry.getKey(), edit.describe());
                } else if (edit.getKind() == StructuralEdit.Kind.MOVE_RANGE
                        && edit.getSource().contains(entry.getKey())) {
                    movedBlock.put(target, cell);
                } else {
                    relocated.put(target, cell);
                }
            }
            relocated.putAll(movedBlock);
            repository.replaceAll(relocated);
            rebuildGraph();
            fullRecalculationNeeded = true;
        }

        @Override
        public Map<CellAddress, Cell> snapshotCells() {
            return repository.snapshot();
        }

        @Override
        public void restoreCells(Map<CellAddress, Cell> snapshot) {
            repository.replaceAll(snapshot);
            rebuildGraph();
            fullRecalculationNeeded = true;
        }

        private Expr rewrite(StructuralEdit edit, Expr formula) {
            switch (edit.getKind()) {
                case INSERT_ROW:
                    return transformer.adjustForRowInsert(formula, edit.getIndex());
                case DELETE_ROW:
                    return transformer.adjustForRowDelete(formula, edit.getIndex());
                case INSERT_COLUMN:
                    return transformer.adjustForColumnInsert(formula, edit.getIndex());
                case DELETE_COLUMN:
                    return transformer.adjustForColumnDelete(formula, edit.getIndex());
                default:
                    return transformer.adjustForRangeMove(formula, edit.getSource(), edit.getTarget());
            }
        }

        /**
         * Where the cell at {@code address} ends up, or null if it goes away.
         */
        private CellAddress relocate(StructuralEdit edit, CellAddress address) {
            int column = address.getColumn();
            int row = address.getRow();
            int index = edit.getIndex();
            switch (edit.getKind()) {
                case INSERT_ROW:
                    return fits(column, row >= index ? row + 1 : row);
                case DELETE_ROW:
                    if (row == index) {
                        return null;
                    }
                    return fits(column, row > index ? row - 1 : row);
                case INSERT_COLUMN:
                    return fits(column >= index ? column + 1 : column, row);
                case DELETE_COLUMN:
                    if (column == index) {
                        return null;
                    }
                    return fits(column > index ? column - 1 : column, row);
                default:
                    CellRange source = edit.getSource();
                    CellAddress target = edit.getTarget();
                    if (source.contains(address)) {
                        return fits(column + target.getColumn() - source.getStart().getColumn(),
                                row + target.getRow() - source.getStart().getRow());
                    }
                    CellRange destination = new CellRange(target,
                            target.offset(source.getWidth() - 1, source.getHeight() - 1));
                    return destination.contains(address) ? null : address;
            }
        }

        private CellAddress fits(int column, int row) {
            if (column >= properties.getMaxColumns() || row >= properties.getMaxRows()) {
                return null;
            }
            return new CellAddress(column, row);
        }
    }
}
