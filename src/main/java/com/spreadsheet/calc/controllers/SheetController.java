package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.models.CellResponse;
import com.spreadsheet.calc.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for sheets and their cells.
 * "/sheet" is the base path. Cells are addressed in A1 notation,
 * rows by 1-based number and columns by letters.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /sheet
     * Body: { "name": "Budget" }. Returns the name the sheet was created under.
     */
    @PostMapping
    public ResponseEntity<String> createSheet(@RequestBody Map<String, String> request) {
        String name = workbookService.createSheet(request.get("name"));
        return ResponseEntity.ok(name);
    }

    @GetMapping
    public ResponseEntity<List<String>> listSheets() {
        return ResponseEntity.ok(workbookService.listSheets());
    }

    @DeleteMapping("/{sheet}")
    public ResponseEntity<Void> removeSheet(@PathVariable String sheet) {
        workbookService.removeSheet(sheet);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheet}
     * Returns display values of all stored cells: { "A1": "10", "C1": "30", ... }.
     */
    @GetMapping("/{sheet}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable String sheet) {
        return ResponseEntity.ok(workbookService.getSheetData(sheet));
    }

    /**
     * PUT /sheet/{sheet}/cell/{address}
     * Body: raw input, e.g. "42", "hello" or "=SUM(A1:A3)".
     * Parse errors and circular references come back as 400.
     */
    @PutMapping("/{sheet}/cell/{address}")
    public ResponseEntity<CellResponse> setCell(
            @PathVariable String sheet,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        workbookService.setCellValue(sheet, address, rawValue);
        return ResponseEntity.ok(workbookService.getCell(sheet, address));
    }

    @GetMapping("/{sheet}/cell/{address}")
    public ResponseEntity<CellResponse> getCell(@PathVariable String sheet, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getCell(sheet, address));
    }

    @DeleteMapping("/{sheet}/cell/{address}")
    public ResponseEntity<Void> deleteCell(@PathVariable String sheet, @PathVariable String address) {
        workbookService.deleteCell(sheet, address);
        return ResponseEntity.ok().build();
    }

    /**
     * Formula cells that read this cell directly.
     */
    @GetMapping("/{sheet}/cell/{address}/dependents")
    public ResponseEntity<List<String>> getDependents(@PathVariable String sheet, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getDependents(sheet, address));
    }

    /**
     * Cells this cell's formula reads directly.
     */
    @GetMapping("/{sheet}/cell/{address}/dependencies")
    public ResponseEntity<List<String>> getDependencies(@PathVariable String sheet, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getDependencies(sheet, address));
    }

    @PostMapping("/{sheet}/undo")
    public ResponseEntity<Boolean> undo(@PathVariable String sheet) {
        return ResponseEntity.ok(workbookService.undo(sheet));
    }

    @PostMapping("/{sheet}/redo")
    public ResponseEntity<Boolean> redo(@PathVariable String sheet) {
        return ResponseEntity.ok(workbookService.redo(sheet));
    }

    /**
     * POST /sheet/{sheet}/batch
     * Opens a batch and returns its id. Edits made until commit are queued.
     */
    @PostMapping("/{sheet}/batch")
    public ResponseEntity<String> beginBatch(@PathVariable String sheet) {
        return ResponseEntity.ok(workbookService.beginBatch(sheet));
    }

    @PostMapping("/{sheet}/batch/{batchId}/commit")
    public ResponseEntity<Void> commitBatch(@PathVariable String sheet, @PathVariable String batchId) {
        workbookService.commitBatch(sheet, batchId);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheet}/batch/{batchId}")
    public ResponseEntity<Void> rollbackBatch(@PathVariable String sheet, @PathVariable String batchId) {
        workbookService.rollbackBatch(sheet, batchId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheet}/rows/{rowNumber}")
    public ResponseEntity<Void> insertRow(@PathVariable String sheet, @PathVariable int rowNumber) {
        workbookService.insertRow(sheet, rowNumber);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheet}/rows/{rowNumber}")
    public ResponseEntity<Void> deleteRow(@PathVariable String sheet, @PathVariable int rowNumber) {
        workbookService.deleteRow(sheet, rowNumber);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheet}/columns/{letters}")
    public ResponseEntity<Void> insertColumn(@PathVariable String sheet, @PathVariable String letters) {
        workbookService.insertColumn(sheet, letters);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheet}/columns/{letters}")
    public ResponseEntity<Void> deleteColumn(@PathVariable String sheet, @PathVariable String letters) {
        workbookService.deleteColumn(sheet, letters);
        return ResponseEntity.ok().build();
    }

    /**
     * Forces a full recalculation, e.g. after other sheets changed.
     */
    @PostMapping("/{sheet}/recalculate")
    public ResponseEntity<Void> recalculate(@PathVariable String sheet) {
        workbookService.recalculate(sheet);
        return ResponseEntity.ok().build();
    }
}
