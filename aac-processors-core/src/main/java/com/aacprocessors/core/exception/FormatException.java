package com.aacprocessors.core.exception;

/**
 * Thrown when a pageset container cannot be opened at all: wrong magic bytes,
 * a truncated or corrupt archive, or an embedded store that is not a database.
 */
public class FormatException extends PagesetException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
