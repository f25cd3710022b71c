package com.spreadsheet.calc.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs recalculation timings and batch boundaries for every sheet.
 */
@Slf4j
@Component
public class SheetEventLogger {

    @EventListener
    public void onSheetEvent(SheetEvent sheetEvent) {
        SpreadsheetEvent event = sheetEvent.getEvent();
        switch (event.getType()) {
            case RECALCULATION_COMPLETED:
                log.debug("[{}] Recalculation of {} cells took {} ms", sheetEvent.getSheetName(),
                        event.getAffectedCells().size(), event.getElapsed().toMillis());
                break;
            case BATCH_COMPLETED:
                log.debug("[{}] Batch {} completed ({} operations)", sheetEvent.getSheetName(),
                        event.getBatchId(), event.getOperationCount());
                break;
            default:
                log.trace("{}", sheetEvent);
                break;
        }
    }
}
