package com.astrofiler.exception;

/**
 * The stacking tool exited with a nonzero status or produced no output file.
 */
public class ExternalToolException extends AstroFilerException {

    private final int exitCode;

    public ExternalToolException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
