package com.aacprocessors.core.exception;

/**
 * Thrown when a container opens but its documents or store do not have the
 * structure the vendor format requires (missing manifest, required field or table).
 */
public class SchemaException extends PagesetException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
