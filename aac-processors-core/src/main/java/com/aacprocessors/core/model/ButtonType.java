package com.aacprocessors.core.model;

/**
 * Behaviour of a button when it is selected.
 */
public enum ButtonType {
    /** Speaks its message (or its label when the message is empty) */
    SPEAK,

    /** Opens another page */
    NAVIGATE,

    /** Runs a vendor command that is neither speech nor navigation */
    ACTION,

    /** Placeholder cell with no behaviour */
    EMPTY
}
