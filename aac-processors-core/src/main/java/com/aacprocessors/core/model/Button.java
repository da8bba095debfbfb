package com.aacprocessors.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One selectable cell on a {@link Page}.
 *
 * <p>Identifier, type, position and navigation target are fixed at construction.
 * Label and message are the only mutable fields; they are rewritten by the text
 * substitution pass and nothing else.
 *
 * <p>A navigation target is kept only for {@link ButtonType#NAVIGATE} buttons and may
 * reference a page that is not part of the tree. Such dangling targets are reported by
 * the navigation analysis rather than rejected here.
 */
public final class Button {

    private final String id;
    private final ButtonType type;
    private final GridPosition position;
    private final String targetPageId;
    private String label;
    private String message;

    /**
     * Creates a button.
     *
     * @param id identifier, unique within its page
     * @param label display text (null is stored as empty)
     * @param message spoken text (null is stored as empty)
     * @param type button behaviour
     * @param position cell on the page grid
     * @param targetPageId target page for NAVIGATE buttons, ignored for other types
     */
    public Button(String id, String label, String message, ButtonType type, GridPosition position, String targetPageId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.label = label == null ? "" : label;
        this.message = message == null ? "" : message;
        this.targetPageId = type == ButtonType.NAVIGATE && targetPageId != null && !targetPageId.isEmpty()
            ? targetPageId
            : null;
    }

    /**
     * Creates a speaking button.
     */
    public static Button speak(String id, String label, String message, GridPosition position) {
        return new Button(id, label, message, ButtonType.SPEAK, position, null);
    }

    /**
     * Creates a navigation button.
     */
    public static Button navigate(String id, String label, GridPosition position, String targetPageId) {
        return new Button(id, label, "", ButtonType.NAVIGATE, position, targetPageId);
    }

    public String getId() {
        return id;
    }

    public ButtonType getType() {
        return type;
    }

    public GridPosition getPosition() {
        return position;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label == null ? "" : label;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message == null ? "" : message;
    }

    /**
     * Returns the navigation target of a NAVIGATE button.
     *
     * @return target page identifier, or empty for other types and unset targets
     */
    public Optional<String> getTargetPageId() {
        return Optional.ofNullable(targetPageId);
    }

    @Override
    public String toString() {
        return "Button[" + id + ", " + type + " '" + label + "' @" + position + "]";
    }
}
