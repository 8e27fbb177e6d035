package com.astrofiler.service;

/**
 * Progress callback of long-running operations. Returning {@code false} asks the
 * operation to stop before the next unit of work.
 */
@FunctionalInterface
public interface ProgressListener {

    boolean onProgress(int current, int total, String label);
}
