package com.factgate.core.model;

/**
 * Engine fault raised when an input is not a valid document structure at all
 * (for example a work product whose top level is not a JSON object).
 *
 * <p>
 * Expected problems inside a well-formed document are reported as
 * {@link ValidationFinding}s; this exception is reserved for inputs that
 * cannot be validated, so that they are never mistaken for a document with
 * zero findings.
 * </p>
 *
 * @since 1.0.0
 */
public class MalformedDocumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
