package com.aacprocessors.core.exception;

/**
 * Base class for failures raised while reading or building a pageset.
 *
 * <p>Filesystem problems are reported as {@link java.io.IOException} instead; this
 * hierarchy covers content that cannot be turned into a consistent tree.
 */
public class PagesetException extends RuntimeException {

    public PagesetException(String message) {
        super(message);
    }

    public PagesetException(String message, Throwable cause) {
        super(message, cause);
    }
}
