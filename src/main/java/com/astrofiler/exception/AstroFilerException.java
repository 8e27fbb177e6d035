package com.astrofiler.exception;

/**
 * Base type for the recoverable failures of the ingestion and calibration pipeline.
 * Callers catch it at the per-file or per-item boundary; it never aborts a batch.
 */
public class AstroFilerException extends Exception {

    public AstroFilerException(String message) {
        super(message);
    }

    public AstroFilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
