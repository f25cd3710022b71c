package com.spreadsheet.calc.events;

@FunctionalInterface
public interface SpreadsheetEventListener {

    void onEvent(SpreadsheetEvent event);
}
