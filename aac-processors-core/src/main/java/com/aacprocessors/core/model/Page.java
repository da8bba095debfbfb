package com.aacprocessors.core.model;

import com.aacprocessors.core.exception.DuplicateIdException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One screen of buttons laid out on a fixed grid.
 *
 * <p>Grid size is set at construction and never changes. Every button must sit inside
 * the grid and no two buttons may share a cell; {@link #addButton(Button)} enforces both.
 * Loaders that read colliding vendor data are expected to check {@link #isOccupied} and
 * relocate with {@link #firstFreePosition()} before adding.
 */
public final class Page {

    private final String id;
    private final String name;
    private final int rows;
    private final int columns;
    private final List<Button> buttons = new ArrayList<>();
    private final Map<String, Button> buttonsById = new HashMap<>();
    private final Map<GridPosition, Button> buttonsByPosition = new HashMap<>();

    /**
     * Creates an empty page.
     *
     * @param id identifier, unique within the tree
     * @param name display name (defaults to the id when null or blank)
     * @param rows row count, at least 1
     * @param columns column count, at least 1
     */
    public Page(String id, String name, int rows, int columns) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException(
                "Grid of page '" + id + "' must be at least 1x1, got " + rows + "x" + columns);
        }
        this.name = name == null || name.isBlank() ? id : name;
        this.rows = rows;
        this.columns = columns;
    }

    /**
     * Appends a button to this page.
     *
     * @param button button to add
     * @return this page
     * @throws DuplicateIdException if a button with the same identifier exists
     * @throws IllegalArgumentException if the position is outside the grid or taken
     */
    public Page addButton(Button button) {
        Objects.requireNonNull(button, "button must not be null");
        if (buttonsById.containsKey(button.getId())) {
            throw new DuplicateIdException(
                "Duplicate button id '" + button.getId() + "' on page '" + id + "'", button.getId());
        }
        GridPosition position = button.getPosition();
        if (!contains(position)) {
            throw new IllegalArgumentException(
                "Button '" + button.getId() + "' at " + position + " is outside the "
                    + rows + "x" + columns + " grid of page '" + id + "'");
        }
        Button occupant = buttonsByPosition.get(position);
        if (occupant != null) {
            throw new IllegalArgumentException(
                "Button '" + button.getId() + "' collides with '" + occupant.getId() + "' at " + position
                    + " on page '" + id + "'");
        }
        buttons.add(button);
        buttonsById.put(button.getId(), button);
        buttonsByPosition.put(position, button);
        return this;
    }

    /**
     * Returns whether a position lies inside the grid.
     */
    public boolean contains(GridPosition position) {
        return position.row() < rows && position.column() < columns;
    }

    /**
     * Returns whether a button already claims the given cell.
     */
    public boolean isOccupied(GridPosition position) {
        return buttonsByPosition.containsKey(position);
    }

    /**
     * Returns whether a button with the given identifier exists on this page.
     */
    public boolean hasButton(String buttonId) {
        return buttonsById.containsKey(buttonId);
    }

    /**
     * Finds the first unoccupied cell in row-major order.
     *
     * @return free cell, or empty when the grid is full
     */
    public Optional<GridPosition> firstFreePosition() {
        return firstFreePosition(Set.of());
    }

    /**
     * Finds the first unoccupied cell in row-major order that is not reserved.
     *
     * <p>Loaders reserve the cells that later input explicitly claims, so relocating a
     * colliding button never displaces a button that has not been added yet.
     *
     * @param reserved cells to skip even when free
     * @return free cell, or empty when every cell is taken or reserved
     */
    public Optional<GridPosition> firstFreePosition(Set<GridPosition> reserved) {
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                GridPosition candidate = new GridPosition(row, column);
                if (!buttonsByPosition.containsKey(candidate) && !reserved.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Button> getButton(String buttonId) {
        return Optional.ofNullable(buttonsById.get(buttonId));
    }

    public Optional<Button> getButtonAt(GridPosition position) {
        return Optional.ofNullable(buttonsByPosition.get(position));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * Returns the buttons in insertion order.
     *
     * @return unmodifiable view of the buttons
     */
    public List<Button> getButtons() {
        return Collections.unmodifiableList(buttons);
    }

    @Override
    public String toString() {
        return "Page[" + id + " '" + name + "' " + rows + "x" + columns + ", " + buttons.size() + " buttons]";
    }
}
