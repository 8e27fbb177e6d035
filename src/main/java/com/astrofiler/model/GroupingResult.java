package com.astrofiler.model;

import java.util.ArrayList;
import java.util.List;

public class GroupingResult {
    public final List<String> createdSessions = new ArrayList<>();
    public int assignedFiles;
    public boolean cancelled;

    @Override
    public String toString() {
        return "sessions=" + createdSessions.size() + ", files=" + assignedFiles + (cancelled ? ", cancelled" : "");
    }
}
