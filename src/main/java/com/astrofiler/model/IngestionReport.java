package com.astrofiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class IngestionReport {
    public int total;
    public int registered;
    public int duplicates;
    public int masters;
    public int ignored;
    public int rejected;
    public boolean cancelled;
    private final List<String> errors = new ArrayList<>();

    public void record(RegistrationResult result) {
        switch (result.status) {
            case REGISTERED: registered++; break;
            case DUPLICATE: duplicates++; break;
            case MASTER: masters++; break;
            case IGNORED: ignored++; break;
            case REJECTED:
                rejected++;
                errors.add(result.path + ": " + result.message);
                break;
            default: break;
        }
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public String toString() {
        return "total=" + total + ", registered=" + registered + ", duplicates=" + duplicates
                + ", masters=" + masters + ", ignored=" + ignored + ", rejected=" + rejected
                + (cancelled ? ", cancelled" : "");
    }
}
