package com.astrofiler.model;

/**
 * Replace the value of {@code field} by {@code newValue} wherever it equals
 * {@code oldValue}, ignoring case.
 */
public class HeaderMapping {
    public final long id;
    public final String field;
    public final String oldValue;
    public final String newValue;

    public HeaderMapping(long id, String field, String oldValue, String newValue) {
        this.id = id;
        this.field = field;
        this.oldValue = oldValue;
        this.newValue = newValue;
    }
}
