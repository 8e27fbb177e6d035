package com.astrofiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MasterValidationReport {
    public int checked;
    public int valid;
    public final List<String> missing = new ArrayList<>();
    public final List<String> invalid = new ArrayList<>();
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
        return "checked=" + checked + ", valid=" + valid + ", missing=" + missing.size()
                + ", invalid=" + invalid.size() + ", errors=" + errors.size();
    }
}
