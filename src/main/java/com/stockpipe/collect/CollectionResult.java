package com.stockpipe.collect;

import com.stockpipe.model.RunRecord;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one collection call: the run record that was (or should have been) appended,
 * and whether appending it succeeded.
 */
@Value
public class CollectionResult {
    RunRecord run;
    boolean runLogged;

    public int rowsAdded() {
        return run.getRowsAdded();
    }

    public int duplicatesSkipped() {
        return run.getDuplicatesSkipped();
    }

    public int rowsRejected() {
        return run.getRowsRejected();
    }

    public List<String> succeeded() {
        return run.getTickersSucceeded();
    }

    public List<String> failed() {
        return run.getTickersFailed();
    }

    public Map<String, String> errors() {
        return run.getErrorMessages();
    }

    public String status() {
        return run.getStatus();
    }
}
