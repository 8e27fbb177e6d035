package com.astrofiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts and per-item error messages of an aggregate operation.
 */
public class BatchResult {
    public int attempted;
    public int processed;
    public boolean cancelled;
    private final List<String> errors = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public String toString() {
        return "attempted=" + attempted + ", processed=" + processed + ", errors=" + errors.size()
                + (cancelled ? ", cancelled" : "");
    }
}
