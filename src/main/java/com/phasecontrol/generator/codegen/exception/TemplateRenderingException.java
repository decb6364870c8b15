package com.phasecontrol.generator.codegen.exception;

/**
 * Raised when a FreeMarker template cannot be loaded or processed.
 */
public class TemplateRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderingException(String templateName, Throwable cause) {
        super("Failed to render template " + templateName + ": " + cause.getMessage(), cause);
    }
}
