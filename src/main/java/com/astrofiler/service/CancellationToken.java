package com.astrofiler.service;

/**
 * Cooperative cancellation threaded through batch operations. Operations call
 * {@link #proceed} before each file, session or master; nothing is interrupted mid-item.
 */
public final class CancellationToken {

    private final ProgressListener listener;
    private volatile boolean cancelled;

    public CancellationToken(ProgressListener listener) {
        this.listener = listener;
    }

    public static CancellationToken none() {
        return new CancellationToken((current, total, label) -> true);
    }

    /** Reports progress and returns false once cancellation has been requested. */
    public boolean proceed(int current, int total, String label) {
        if (cancelled) return false;
        if (!listener.onProgress(current, total, label)) {
            cancelled = true;
        }
        return !cancelled;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
