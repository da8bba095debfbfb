package com.aacprocessors.core.exception;

/**
 * Thrown when two pages of a tree, or two buttons of a page, claim the same identifier.
 */
public class DuplicateIdException extends PagesetException {

    private final String duplicateId;

    public DuplicateIdException(String message, String duplicateId) {
        super(message);
        this.duplicateId = duplicateId;
    }

    public String getDuplicateId() {
        return duplicateId;
    }
}
