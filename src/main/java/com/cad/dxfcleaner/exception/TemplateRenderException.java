package com.cad.dxfcleaner.exception;

/**
 * A bundled template could not be loaded or rendered.
 */
public class TemplateRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
