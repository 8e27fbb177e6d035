package com.astrofiler.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes an XISF container into a FITS file and returns the new path.
 */
@FunctionalInterface
public interface XisfConverter {

    Path convert(Path xisfFile) throws IOException;

    /** Converter for installations without an XISF decoder. */
    static XisfConverter unsupported() {
        return file -> {
            throw new IOException("No XISF decoder available for " + file.getFileName());
        };
    }
}
