package com.astrofiler.exception;

public class FitsReadException extends AstroFilerException {

    public FitsReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
