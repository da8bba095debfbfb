package com.aacprocessors.core.processor.impl.touchchat;

import com.aacprocessors.core.config.ProcessorConfig.TouchChatDefaults;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
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
 * Writes a tree into a TouchChat store, reusing rows that already carry the same rid.
 *
 * <p>Existing page and button resources are updated in place, new ones are inserted and
 * resources no longer present in the tree are deleted together with their cells, actions
 * and boxes. A button id used on more than one page gets the rid {@code <page>.<button>}
 * so each placement keeps its own label.
 */
final class TouchChatStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(TouchChatStoreWriter.class);

    static final int PAGE_RESOURCE = 1;
    static final int BUTTON_RESOURCE = 2;

    /**
     * Runs an insert and returns the new row id.
     */
    @FunctionalInterface
    interface RowInserter {
        long insert(PreparedStatement statement) throws SQLException;
    }

    private final Connection connection;
    private final TouchChatDefaults defaults;
    private final RowInserter inserter;

    private final Map<String, Long> pageResources = new HashMap<>();
    private final Map<String, Long> buttonResources = new HashMap<>();
    private final Map<Long, Long> pagesByResource = new HashMap<>();
    private final Map<Long, Long> buttonsByResource = new HashMap<>();
    private final Map<Long, Long> boxesByPage = new HashMap<>();

    TouchChatStoreWriter(Connection connection, TouchChatDefaults defaults, RowInserter inserter) {
        this.connection = connection;
        this.defaults = defaults;
        this.inserter = inserter;
    }

    void write(Tree tree) throws SQLException {
        readResources();
        readKeyPairs("SELECT resource_id, id FROM pages ORDER BY id", pagesByResource);
        readKeyPairs("SELECT resource_id, id FROM buttons ORDER BY id", buttonsByResource);
        readKeyPairs("SELECT page_id, button_box_id FROM button_box_instances ORDER BY id", boxesByPage);

        Map<String, Integer> buttonIdUse = new HashMap<>();
        for (Page page : tree.getPages()) {
            for (Button button : page.getButtons()) {
                buttonIdUse.merge(button.getId(), 1, Integer::sum);
            }
        }

        Set<String> writtenButtons = new HashSet<>();
        Map<String, Long> pageRows = new HashMap<>();
        for (Page page : tree.getPages()) {
            long pageRow = writePage(page);
            pageRows.put(page.getId(), pageRow);
            long box = writeBox(pageRow, page);
            for (Button button : page.getButtons()) {
                String rid = buttonIdUse.get(button.getId()) > 1 ? page.getId() + "." + button.getId() : button.getId();
                writtenButtons.add(rid);
                writeButton(box, rid, button, page.getColumns());
            }
        }

        deleteVanishedButtons(writtenButtons);
        deleteVanishedPages(pageRows.keySet());

        execute("DELETE FROM special_pages WHERE name = ?", defaults.homePageName());
        if (tree.getRootPage().isPresent()) {
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO special_pages (name, page_id) VALUES (?, ?)")) {
                statement.setString(1, defaults.homePageName());
                statement.setLong(2, pageRows.get(tree.getRootPage().get().getId()));
                statement.executeUpdate();
            }
        }
        log.debug("Wrote {} pages and {} buttons", pageRows.size(), writtenButtons.size());
    }

    // ==================== Pages ====================

    private long writePage(Page page) throws SQLException {
        long resource = upsertResource(pageResources, page.getId(), page.getName(), PAGE_RESOURCE);
        Long pageRow = pagesByResource.get(resource);
        if (pageRow != null) {
            return pageRow;
        }
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO pages (resource_id) VALUES (?)")) {
            statement.setLong(1, resource);
            long id = inserter.insert(statement);
            pagesByResource.put(resource, id);
            return id;
        }
    }

    private long writeBox(long pageRow, Page page) throws SQLException {
        Long box = boxesByPage.get(pageRow);
        if (box != null) {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE button_boxes SET init_size_x = ?, init_size_y = ? WHERE id = ?")) {
                statement.setInt(1, page.getColumns());
                statement.setInt(2, page.getRows());
                statement.setLong(3, box);
                statement.executeUpdate();
            }
            execute("DELETE FROM button_box_cells WHERE button_box_id = ?", box);
            return box;
        }
        long id;
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO button_boxes (init_size_x, init_size_y) VALUES (?, ?)")) {
            statement.setInt(1, page.getColumns());
            statement.setInt(2, page.getRows());
            id = inserter.insert(statement);
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO button_box_instances (button_box_id, page_id) VALUES (?, ?)")) {
            statement.setLong(1, id);
            statement.setLong(2, pageRow);
            statement.executeUpdate();
        }
        boxesByPage.put(pageRow, id);
        return id;
    }

    private void deleteVanishedPages(Set<String> keptPages) throws SQLException {
        for (Map.Entry<String, Long> resource : pageResources.entrySet()) {
            if (keptPages.contains(resource.getKey())) {
                continue;
            }
            Long pageRow = pagesByResource.get(resource.getValue());
            if (pageRow != null) {
                Long box = boxesByPage.get(pageRow);
                if (box != null) {
                    execute("DELETE FROM button_box_cells WHERE button_box_id = ?", box);
                    execute("DELETE FROM button_boxes WHERE id = ?", box);
                }
                execute("DELETE FROM button_box_instances WHERE page_id = ?", pageRow);
                execute("DELETE FROM special_pages WHERE page_id = ?", pageRow);
                execute("DELETE FROM pages WHERE id = ?", pageRow);
            }
            execute("DELETE FROM resources WHERE id = ?", resource.getValue());
        }
    }

    // ==================== Buttons ====================

    private void writeButton(long box, String rid, Button button, int columns) throws SQLException {
        long resource = upsertResource(buttonResources, rid, button.getLabel(), BUTTON_RESOURCE);
        Long buttonRow = buttonsByResource.get(resource);
        if (buttonRow != null) {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE buttons SET label = ?, message = ? WHERE id = ?")) {
                statement.setString(1, button.getLabel());
                statement.setString(2, button.getMessage());
                statement.setLong(3, buttonRow);
                statement.executeUpdate();
            }
        } else {
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO buttons (resource_id, label, message) VALUES (?, ?, ?)")) {
                statement.setLong(1, resource);
                statement.setString(2, button.getLabel());
                statement.setString(3, button.getMessage());
                buttonsByResource.put(resource, inserter.insert(statement));
            }
        }

        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO button_box_cells (button_box_id, resource_id, location, span_x, span_y) VALUES (?, ?, ?, 1, 1)")) {
            statement.setLong(1, box);
            statement.setLong(2, resource);
            statement.setInt(3, button.getPosition().toIndex(columns));
            statement.executeUpdate();
        }
        writeActions(resource, button);
    }

    private void writeActions(long resource, Button button) throws SQLException {
        switch (button.getType()) {
            case NAVIGATE -> {
                deleteActions(resource, true);
                long action;
                try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO actions (resource_id, code) VALUES (?, ?)")) {
                    statement.setLong(1, resource);
                    statement.setInt(2, defaults.navigateActionCode());
                    action = inserter.insert(statement);
                }
                if (button.getTargetPageId().isPresent()) {
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO action_data (action_id, key, value) VALUES (?, ?, ?)")) {
                        statement.setLong(1, action);
                        statement.setInt(2, defaults.targetDataKey());
                        statement.setString(3, button.getTargetPageId().get());
                        statement.executeUpdate();
                    }
                }
            }
            case ACTION -> {
                deleteActions(resource, true);
                if (!hasActions(resource)) {
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO actions (resource_id, code) VALUES (?, ?)")) {
                        statement.setLong(1, resource);
                        statement.setInt(2, defaults.actionCode());
                        statement.executeUpdate();
                    }
                }
            }
            case SPEAK, EMPTY -> {
                deleteActions(resource, false);
                if (misreadByTexts(button)) {
                    long action;
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO actions (resource_id, code) VALUES (?, ?)")) {
                        statement.setLong(1, resource);
                        statement.setInt(2, defaults.typeActionCode());
                        action = inserter.insert(statement);
                    }
                    try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO action_data (action_id, key, value) VALUES (?, ?, ?)")) {
                        statement.setLong(1, action);
                        statement.setInt(2, defaults.targetDataKey());
                        statement.setString(3, button.getType().name());
                        statement.executeUpdate();
                    }
                }
            }
        }
    }

    /**
     * A button without actions loads as SPEAK when it has text and as EMPTY otherwise.
     */
    private static boolean misreadByTexts(Button button) {
        boolean hasText = !button.getLabel().isEmpty() || !button.getMessage().isEmpty();
        return hasText != (button.getType() == ButtonType.SPEAK);
    }

    /**
     * Deletes all actions of a resource, or only its navigation and type actions.
     */
    private void deleteActions(long resource, boolean navigationAndTypeOnly) throws SQLException {
        String filter = navigationAndTypeOnly
            ? " AND code IN (" + defaults.navigateActionCode() + ", " + defaults.typeActionCode() + ")"
            : "";
        execute("DELETE FROM action_data WHERE action_id IN (SELECT id FROM actions WHERE resource_id = ?" + filter + ")",
            resource);
        execute("DELETE FROM actions WHERE resource_id = ?" + filter, resource);
    }

    private boolean hasActions(long resource) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM actions WHERE resource_id = ?")) {
            statement.setLong(1, resource);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next();
            }
        }
    }

    private void deleteVanishedButtons(Set<String> keptButtons) throws SQLException {
        for (Map.Entry<String, Long> resource : buttonResources.entrySet()) {
            if (keptButtons.contains(resource.getKey())) {
                continue;
            }
            deleteActions(resource.getValue(), false);
            execute("DELETE FROM button_box_cells WHERE resource_id = ?", resource.getValue());
            execute("DELETE FROM buttons WHERE resource_id = ?", resource.getValue());
            execute("DELETE FROM resources WHERE id = ?", resource.getValue());
        }
    }

    // ==================== Rows ====================

    private void readResources() throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT id, rid, type FROM resources WHERE rid IS NOT NULL ORDER BY id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                Map<String, Long> target = switch (rows.getInt(3)) {
                    case PAGE_RESOURCE -> pageResources;
                    case BUTTON_RESOURCE -> buttonResources;
                    default -> null;
                };
                if (target != null) {
                    target.putIfAbsent(rows.getString(2), rows.getLong(1));
                }
            }
        }
    }

    private void readKeyPairs(String sql, Map<Long, Long> target) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                target.putIfAbsent(rows.getLong(1), rows.getLong(2));
            }
        }
    }

    private long upsertResource(Map<String, Long> existing, String rid, String name, int type) throws SQLException {
        Long id = existing.get(rid);
        if (id != null) {
            try (PreparedStatement statement = connection.prepareStatement("UPDATE resources SET name = ? WHERE id = ?")) {
                statement.setString(1, name);
                statement.setLong(2, id);
                statement.executeUpdate();
            }
            return id;
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO resources (rid, name, type) VALUES (?, ?, ?)")) {
            statement.setString(1, rid);
            statement.setString(2, name);
            statement.setInt(3, type);
            long inserted = inserter.insert(statement);
            existing.put(rid, inserted);
            return inserted;
        }
    }

    private void execute(String sql, Object parameter) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setObject(1, parameter);
            statement.executeUpdate();
        }
    }
}
