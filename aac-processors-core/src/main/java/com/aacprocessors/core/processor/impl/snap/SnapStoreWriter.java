package com.aacprocessors.core.processor.impl.snap;

import com.aacprocessors.core.config.ProcessorConfig.SnapDefaults;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Writes a tree into a Snap store.
 *
 * <p>Pages are matched by {@code UniqueId} and buttons by row id on the same page; matches
 * are updated in place and everything else is inserted. Buttons and pages missing from
 * the tree are deleted with their references, placements, links and commands.
 */
final class SnapStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(SnapStoreWriter.class);

    /**
     * Runs an insert and returns the new row id.
     */
    @FunctionalInterface
    interface RowInserter {
        long insert(PreparedStatement statement) throws SQLException;
    }

    private final Connection connection;
    private final SnapDefaults defaults;
    private final RowInserter inserter;
    private final boolean commandSequences;
    private final boolean pageLayouts;
    private final boolean properties;

    private final Map<String, Long> pagesByUniqueId = new HashMap<>();
    private final Map<Long, ExistingButton> buttons = new HashMap<>();
    private final Map<Long, Long> placementsByReference = new HashMap<>();

    SnapStoreWriter(Connection connection, SnapDefaults defaults, RowInserter inserter,
                    boolean commandSequences, boolean pageLayouts, boolean properties) {
        this.connection = connection;
        this.defaults = defaults;
        this.inserter = inserter;
        this.commandSequences = commandSequences;
        this.pageLayouts = pageLayouts;
        this.properties = properties;
    }

    void write(Tree tree) throws SQLException {
        readExisting();

        Set<Long> keptPages = new HashSet<>();
        Set<Long> keptButtons = new HashSet<>();
        for (Page page : tree.getPages()) {
            long pageRow = writePage(page);
            keptPages.add(pageRow);
            for (Button button : page.getButtons()) {
                keptButtons.add(writeButton(pageRow, button));
            }
        }

        for (Map.Entry<Long, ExistingButton> button : buttons.entrySet()) {
            if (!keptButtons.contains(button.getKey())) {
                deleteButton(button.getKey(), button.getValue().referenceId());
            }
        }
        for (long pageRow : pagesByUniqueId.values()) {
            if (!keptPages.contains(pageRow)) {
                execute("DELETE FROM ElementPlacement WHERE ElementReferenceId IN "
                    + "(SELECT Id FROM ElementReference WHERE PageId = ?)", pageRow);
                execute("DELETE FROM ElementReference WHERE PageId = ?", pageRow);
                if (pageLayouts) {
                    execute("DELETE FROM PageLayout WHERE PageId = ?", pageRow);
                }
                execute("DELETE FROM Page WHERE Id = ?", pageRow);
            }
        }

        if (properties && tree.getRootPage().isPresent()) {
            writeHomePage(tree.getRootPage().get().getId());
        }
        log.debug("Wrote {} pages and {} buttons", keptPages.size(), keptButtons.size());
    }

    private void readExisting() throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT Id, UniqueId FROM Page ORDER BY Id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                String uniqueId = rows.getString(2);
                pagesByUniqueId.putIfAbsent(uniqueId == null || uniqueId.isEmpty()
                    ? String.valueOf(rows.getLong(1)) : uniqueId, rows.getLong(1));
            }
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT b.Id, er.Id, er.PageId FROM Button b JOIN ElementReference er ON er.Id = b.ElementReferenceId");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                buttons.put(rows.getLong(1), new ExistingButton(rows.getLong(2), rows.getLong(3)));
            }
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT Id, ElementReferenceId FROM ElementPlacement ORDER BY PageLayoutId, Id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                placementsByReference.putIfAbsent(rows.getLong(2), rows.getLong(1));
            }
        }
    }

    // ==================== Pages ====================

    private long writePage(Page page) throws SQLException {
        String dimension = page.getRows() + "," + page.getColumns();
        Long pageRow = pagesByUniqueId.get(page.getId());
        if (pageRow != null) {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE Page SET Title = ?, GridDimension = ? WHERE Id = ?")) {
                statement.setString(1, page.getName());
                statement.setString(2, dimension);
                statement.setLong(3, pageRow);
                statement.executeUpdate();
            }
            return pageRow;
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO Page (UniqueId, Title, GridDimension) VALUES (?, ?, ?)")) {
            statement.setString(1, page.getId());
            statement.setString(2, page.getName());
            statement.setString(3, dimension);
            long inserted = inserter.insert(statement);
            pagesByUniqueId.put(page.getId(), inserted);
            return inserted;
        }
    }

    private void writeHomePage(String pageId) throws SQLException {
        int updated;
        try (PreparedStatement statement = connection.prepareStatement(
            "UPDATE PageSetProperties SET DefaultHomePageUniqueId = ?")) {
            statement.setString(1, pageId);
            updated = statement.executeUpdate();
        }
        if (updated == 0) {
            execute("INSERT INTO PageSetProperties (DefaultHomePageUniqueId) VALUES (?)", pageId);
        }
    }

    // ==================== Buttons ====================

    private long writeButton(long pageRow, Button button) throws SQLException {
        Long buttonRow = parseRowId(button.getId());
        ExistingButton existing = buttonRow == null ? null : buttons.get(buttonRow);
        if (existing != null && existing.pageRow() == pageRow) {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE Button SET Label = ?, Message = ? WHERE Id = ?")) {
                statement.setString(1, button.getLabel());
                statement.setString(2, button.getMessage());
                statement.setLong(3, buttonRow);
                statement.executeUpdate();
            }
            writePlacement(existing.referenceId(), button.getPosition());
        } else {
            long reference;
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO ElementReference (PageId) VALUES (?)")) {
                statement.setLong(1, pageRow);
                reference = inserter.insert(statement);
            }
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO Button (Label, Message, ElementReferenceId) VALUES (?, ?, ?)")) {
                statement.setString(1, button.getLabel());
                statement.setString(2, button.getMessage());
                statement.setLong(3, reference);
                buttonRow = inserter.insert(statement);
            }
            writePlacement(reference, button.getPosition());
        }

        execute("DELETE FROM ButtonPageLink WHERE ButtonId = ?", buttonRow);
        if (button.getType() == ButtonType.NAVIGATE) {
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO ButtonPageLink (ButtonId, PageUniqueId) VALUES (?, ?)")) {
                statement.setLong(1, buttonRow);
                statement.setString(2, button.getTargetPageId().orElse(""));
                statement.executeUpdate();
            }
        }
        if (commandSequences) {
            writeCommands(buttonRow, button);
        }
        return buttonRow;
    }

    private void writePlacement(long reference, GridPosition position) throws SQLException {
        String gridPosition = position.row() + "," + position.column();
        Long placement = placementsByReference.get(reference);
        if (placement != null) {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE ElementPlacement SET GridPosition = ? WHERE Id = ?")) {
                statement.setString(1, gridPosition);
                statement.setLong(2, placement);
                statement.executeUpdate();
            }
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO ElementPlacement (ElementReferenceId, GridPosition) VALUES (?, ?)")) {
            statement.setLong(1, reference);
            statement.setString(2, gridPosition);
            placementsByReference.put(reference, inserter.insert(statement));
        }
    }

    private void writeCommands(long buttonRow, Button button) throws SQLException {
        switch (button.getType()) {
            case ACTION -> {
                deleteTypeMarkers(buttonRow);
                boolean present;
                try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT 1 FROM CommandSequence WHERE ButtonId = ?")) {
                    statement.setLong(1, buttonRow);
                    try (ResultSet rows = statement.executeQuery()) {
                        present = rows.next();
                    }
                }
                if (!present) {
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO CommandSequence (ButtonId, SerializedCommands) VALUES (?, ?)")) {
                        statement.setLong(1, buttonRow);
                        statement.setString(2, defaults.actionCommands());
                        statement.executeUpdate();
                    }
                }
            }
            case SPEAK, EMPTY -> {
                execute("DELETE FROM CommandSequence WHERE ButtonId = ?", buttonRow);
                boolean hasText = !button.getLabel().isEmpty() || !button.getMessage().isEmpty();
                if (hasText != (button.getType() == ButtonType.SPEAK)) {
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO CommandSequence (ButtonId, SerializedCommands) VALUES (?, ?)")) {
                        statement.setLong(1, buttonRow);
                        statement.setString(2, button.getType() == ButtonType.SPEAK
                            ? defaults.speakCommands() : defaults.emptyCommands());
                        statement.executeUpdate();
                    }
                }
            }
            case NAVIGATE -> deleteTypeMarkers(buttonRow);
        }
    }

    private void deleteTypeMarkers(long buttonRow) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "DELETE FROM CommandSequence WHERE ButtonId = ? AND SerializedCommands IN (?, ?)")) {
            statement.setLong(1, buttonRow);
            statement.setString(2, defaults.speakCommands());
            statement.setString(3, defaults.emptyCommands());
            statement.executeUpdate();
        }
    }

    private void deleteButton(long buttonRow, long reference) throws SQLException {
        execute("DELETE FROM ButtonPageLink WHERE ButtonId = ?", buttonRow);
        if (commandSequences) {
            execute("DELETE FROM CommandSequence WHERE ButtonId = ?", buttonRow);
        }
        execute("DELETE FROM ElementPlacement WHERE ElementReferenceId = ?", reference);
        execute("DELETE FROM ElementReference WHERE Id = ?", reference);
        execute("DELETE FROM Button WHERE Id = ?", buttonRow);
    }

    private static Long parseRowId(String buttonId) {
        try {
            return Long.valueOf(buttonId);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void execute(String sql, Object parameter) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setObject(1, parameter);
            statement.executeUpdate();
        }
    }

    private record ExistingButton(long referenceId, long pageRow) {
    }
}
