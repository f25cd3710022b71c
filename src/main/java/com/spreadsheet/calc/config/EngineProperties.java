package com.spreadsheet.calc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Limits and sizing for the calculation engine.
 * Bound from "spreadsheet.engine.*" when running inside Spring,
 * and created directly with defaults in unit tests.
 */
@Component
@ConfigurationProperties(prefix = "spreadsheet.engine")
public class EngineProperties {

    // Excel's XFD column / 1,048,576 rows
    private int maxColumns = 16384;
    private int maxRows = 1048576;
    private int maxUndoStackSize = 100;
    private int maxRedoStackSize = 100;
    private String defaultSheetName = "Sheet1";

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxUndoStackSize() {
        return maxUndoStackSize;
    }

    public void setMaxUndoStackSize(int maxUndoStackSize) {
        this.maxUndoStackSize = maxUndoStackSize;
    }

    public int getMaxRedoStackSize() {
        return maxRedoStackSize;
    }

    public void setMaxRedoStackSize(int maxRedoStackSize) {
        this.maxRedoStackSize = maxRedoStackSize;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }
}
