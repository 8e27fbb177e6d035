package com.astrofiler.exception;

public class VendorNormalizationException extends AstroFilerException {

    public VendorNormalizationException(String message) {
        super(message);
    }
}
