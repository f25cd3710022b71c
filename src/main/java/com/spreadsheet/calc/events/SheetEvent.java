package com.spreadsheet.calc.events;

/**
 * A {@link SpreadsheetEvent} tagged with the sheet it happened on,
 * as published through Spring's application event bus.
 */
public class SheetEvent {
    private final String sheetName;
    private final SpreadsheetEvent event;

    public SheetEvent(String sheetName, SpreadsheetEvent event) {
        this.sheetName = sheetName;
        this.event = event;
    }

    public String getSheetName() {
        return sheetName;
    }

    public SpreadsheetEvent getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return sheetName + ": " + event;
    }
}
