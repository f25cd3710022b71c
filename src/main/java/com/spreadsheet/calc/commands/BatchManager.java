package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.exceptions.BatchNotFoundException;
import com.spreadsheet.calc.exceptions.BatchStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the single open batch and the commands queued into it.
 * Queued commands are not executed here.
 */
public class BatchManager {
    private final AtomicLong idGenerator = new AtomicLong(1);
    private String activeBatchId;
    private final List<Command> queued = new ArrayList<>();

    public String begin() {
        if (activeBatchId != null) {
            throw new BatchStateException("Batch " + activeBatchId + " is already open");
        }
        activeBatchId = "batch_" + idGenerator.getAndIncrement();
        return activeBatchId;
    }

    public boolean isActive() {
        return activeBatchId != null;
    }

    public String getActiveBatchId() {
        return activeBatchId;
    }

    public void queue(Command command) {
        if (activeBatchId == null) {
            throw new BatchStateException("No batch is open");
        }
        queued.add(command);
    }

    public int getQueuedCount() {
        return queued.size();
    }

    /**
     * Closes the batch and hands back its queued commands as one command.
     */
    public BatchCommand close(String batchId) {
        requireActive(batchId);
        BatchCommand batch = new BatchCommand("Batch " + batchId + " (" + queued.size() + " operations)",
                queued);
        reset();
        return batch;
    }

    /**
     * Closes the batch and forgets its queued commands.
     *
     * @return how many commands were discarded
     */
    public int discard(String batchId) {
        requireActive(batchId);
        int count = queued.size();
        reset();
        return count;
    }

    private void requireActive(String batchId) {
        if (activeBatchId == null || !activeBatchId.equals(batchId)) {
            throw new BatchNotFoundException(batchId);
        }
    }

    private void reset() {
        activeBatchId = null;
        queued.clear();
    }
}
