package com.cad.dxfcleaner.exception;

import java.nio.file.Path;

/**
 * The source drawing could not be opened or read. Fatal to the run.
 */
public class DxfReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DxfReadException(Path source, Throwable cause) {
        super("Error reading file " + source + ": " + cause.getMessage(), cause);
    }
}
