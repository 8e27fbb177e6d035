package com.astrofiler.exception;

/**
 * A required header field is missing or cannot be parsed.
 */
public class ValidationException extends AstroFilerException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
