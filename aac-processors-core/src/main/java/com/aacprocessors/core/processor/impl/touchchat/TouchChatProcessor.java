package com.aacprocessors.core.processor.impl.touchchat;

import com.aacprocessors.core.config.ProcessorConfig.TouchChatDefaults;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.base.AbstractEmbeddedStoreProcessor;
import com.aacprocessors.core.translation.TextSubstitution;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Processor for TouchChat vocabularies ({@code .touchChat}, {@code .ce}).
 *
 * <p>A vocabulary is a zip archive holding one {@code .c4v} SQLite store. Pages and
 * buttons are both rows of {@code resources} (type 1 and 2) identified by their
 * {@code rid}; a page lays out its buttons in a button box whose cells number positions
 * row-major ({@code location = row * columns + column}).
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>Page: {@code resources.rid} / {@code resources.name}; grid from {@code button_boxes}</li>
 *   <li>Button: {@code resources.rid}; label and message from {@code buttons}</li>
 *   <li>Navigation: action code 1 whose {@code action_data} key 1 holds the target rid</li>
 *   <li>Type action (code 9000): key 1 names SPEAK or EMPTY where the texts would say otherwise</li>
 *   <li>Any other action: ACTION</li>
 *   <li>Root: the page named {@code Home} in {@code special_pages}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class TouchChatProcessor extends AbstractEmbeddedStoreProcessor {

    private static final String PROCESSOR_ID = "touchchat";
    private static final String STORE_SUFFIX = ".c4v";

    private static final List<String> REQUIRED_TABLES = List.of(
        "resources", "pages", "buttons", "button_boxes", "button_box_instances",
        "button_box_cells", "actions", "action_data", "special_pages"
    );

    private static final String SELECT_PAGES = """
        SELECT p.id, r.rid, r.name, bb.init_size_x, bb.init_size_y, bb.id
        FROM pages p
        JOIN resources r ON r.id = p.resource_id
        LEFT JOIN button_box_instances bbi
            ON bbi.id = (SELECT MIN(i.id) FROM button_box_instances i WHERE i.page_id = p.id)
        LEFT JOIN button_boxes bb ON bb.id = bbi.button_box_id
        ORDER BY p.id
        """;

    private static final String SELECT_CELLS = """
        SELECT c.location, r.id, r.rid, b.label, b.message
        FROM button_box_cells c
        JOIN resources r ON r.id = c.resource_id
        JOIN buttons b ON b.resource_id = r.id
        WHERE c.button_box_id = ?
        ORDER BY c.location, c.id
        """;

    private static final String SELECT_ACTIONS = """
        SELECT a.resource_id, a.code, d.key, d.value
        FROM actions a
        LEFT JOIN action_data d ON d.action_id = a.id
        ORDER BY a.id, d.id
        """;

    @Override
    public String getId() {
        return PROCESSOR_ID;
    }

    @Override
    public String getDisplayName() {
        return "TouchChat";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("touchchat", "ce");
    }

    // ==================== Store Layout ====================

    @Override
    protected boolean isStoreEntry(String entryName) {
        return entryName.toLowerCase(Locale.ROOT).endsWith(STORE_SUFFIX);
    }

    @Override
    protected String defaultStoreEntry() {
        return config().touchChat().storeEntry();
    }

    @Override
    protected List<String> requiredTables() {
        return REQUIRED_TABLES;
    }

    @Override
    protected String schemaTemplate() {
        return "/templates/touchchat-schema.sql";
    }

    @Override
    protected boolean writesArchive(Path output, Optional<StoreSource> source) {
        return true;
    }

    // ==================== Loading ====================

    @Override
    protected Tree readTree(Connection connection, String storeName) throws SQLException {
        TouchChatDefaults defaults = config().touchChat();
        Map<Long, ButtonActions> actions = readActions(connection, defaults);
        Map<Long, String> ridsByPageRow = new HashMap<>();
        Tree tree = new Tree();

        for (PageRow row : readPages(connection, storeName)) {
            List<CellRow> cells = row.boxId() == null ? List.of() : readCells(connection, row.boxId(), storeName);
            tree.addPage(buildPage(row, cells, actions, tree));
            ridsByPageRow.put(row.pageRowId(), row.rid());
        }

        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT page_id FROM special_pages WHERE name = ? ORDER BY id")) {
            statement.setString(1, defaults.homePageName());
            try (ResultSet rows = statement.executeQuery()) {
                if (rows.next()) {
                    String home = ridsByPageRow.get(rows.getLong(1));
                    if (home != null) {
                        tree.setRootId(home);
                    } else {
                        warn(tree, "Special page '" + defaults.homePageName() + "' points to unknown page row "
                            + rows.getLong(1));
                    }
                }
            }
        }
        return tree;
    }

    private List<PageRow> readPages(Connection connection, String storeName) throws SQLException {
        List<PageRow> pages = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_PAGES);
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                String rid = rows.getString(2);
                if (rid == null || rid.isEmpty()) {
                    throw new SchemaException(storeName + " has page row " + rows.getLong(1) + " without a rid");
                }
                long boxId = rows.getLong(6);
                Long box = rows.wasNull() ? null : boxId;
                pages.add(new PageRow(rows.getLong(1), rid, rows.getString(3), rows.getInt(4), rows.getInt(5), box));
            }
        }
        return pages;
    }

    private List<CellRow> readCells(Connection connection, long boxId, String storeName) throws SQLException {
        List<CellRow> cells = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_CELLS)) {
            statement.setLong(1, boxId);
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    int location = rows.getInt(1);
                    Integer declared = rows.wasNull() ? null : location;
                    if (declared != null && declared < 0) {
                        throw new SchemaException(storeName + " has a negative cell location in button box " + boxId);
                    }
                    String rid = rows.getString(3);
                    if (rid == null || rid.isEmpty()) {
                        throw new SchemaException(storeName + " has button resource " + rows.getLong(2)
                            + " without a rid");
                    }
                    cells.add(new CellRow(declared, rows.getLong(2), rid,
                        nullToEmpty(rows.getString(4)), nullToEmpty(rows.getString(5))));
                }
            }
        }
        return cells;
    }

    private Map<Long, ButtonActions> readActions(Connection connection, TouchChatDefaults defaults)
        throws SQLException {
        Map<Long, ButtonActions> actions = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_ACTIONS);
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                long resourceId = rows.getLong(1);
                int code = rows.getInt(2);
                int key = rows.getInt(3);
                boolean hasData = !rows.wasNull();
                String value = rows.getString(4);
                ButtonActions current = actions.getOrDefault(resourceId, ButtonActions.NONE);
                boolean targetData = hasData && key == defaults.targetDataKey() && value != null && !value.isEmpty();
                if (code == defaults.navigateActionCode()) {
                    current = current.withNavigation(targetData ? value : null);
                } else if (code == defaults.typeActionCode()) {
                    current = current.withMarker(targetData ? markedType(value) : null);
                } else {
                    current = current.withOther();
                }
                actions.put(resourceId, current);
            }
        }
        return actions;
    }

    private static ButtonType markedType(String value) {
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SPEAK" -> ButtonType.SPEAK;
            case "EMPTY" -> ButtonType.EMPTY;
            default -> null;
        };
    }

    private Page buildPage(PageRow row, List<CellRow> cells, Map<Long, ButtonActions> actions, Tree tree) {
        int columns = Math.max(row.columns(), 1);
        int rows = Math.max(row.rows(), 1);
        for (CellRow cell : cells) {
            if (cell.location() != null) {
                rows = Math.max(rows, cell.location() / columns + 1);
            }
        }
        if ((long) rows * columns < cells.size()) {
            rows = (cells.size() + columns - 1) / columns;
        }

        Page page = new Page(row.rid(), row.name(), rows, columns);
        Set<GridPosition> declared = new HashSet<>();
        for (CellRow cell : cells) {
            if (cell.location() != null) {
                declared.add(GridPosition.fromIndex(cell.location(), columns));
            }
        }
        for (CellRow cell : cells) {
            if (page.hasButton(cell.rid())) {
                warn(tree, "Button '" + cell.rid() + "' is placed twice on page '" + row.rid() + "'; keeping the first");
                continue;
            }
            GridPosition position = cell.location() == null ? null : GridPosition.fromIndex(cell.location(), columns);
            if (position == null || page.isOccupied(position)) {
                GridPosition free = page.firstFreePosition(declared).or(page::firstFreePosition).orElseThrow();
                warn(tree, "Button '" + cell.rid() + "' on page '" + row.rid() + "' has no free cell at "
                    + position + "; placed at " + free);
                position = free;
            }
            page.addButton(toButton(cell, position, actions.getOrDefault(cell.resourceId(), ButtonActions.NONE)));
        }
        return page;
    }

    private Button toButton(CellRow cell, GridPosition position, ButtonActions actions) {
        ButtonType type;
        if (actions.navigate()) {
            type = ButtonType.NAVIGATE;
        } else if (actions.other()) {
            type = ButtonType.ACTION;
        } else if (actions.marker() != null) {
            type = actions.marker();
        } else if (!cell.label().isEmpty() || !cell.message().isEmpty()) {
            type = ButtonType.SPEAK;
        } else {
            type = ButtonType.EMPTY;
        }
        return new Button(cell.rid(), cell.label(), cell.message(), type, position, actions.target());
    }

    private void warn(Tree tree, String warning) {
        log.warn(warning);
        tree.addWarning(warning);
    }

    // ==================== Saving ====================

    @Override
    protected void writeTree(Connection connection, Tree tree) throws SQLException {
        new TouchChatStoreWriter(connection, config().touchChat(), this::insert).write(tree);
    }

    // ==================== Text Rewriting ====================

    @Override
    protected int rewriteStoreTexts(Connection connection, Map<String, String> translations) throws SQLException {
        int replaced = 0;
        try (PreparedStatement select = connection.prepareStatement("SELECT id, label, message FROM buttons ORDER BY id");
             PreparedStatement update = connection.prepareStatement(
                 "UPDATE buttons SET label = ?, message = ? WHERE id = ?");
             ResultSet rows = select.executeQuery()) {
            while (rows.next()) {
                String label = rows.getString(2);
                String message = rows.getString(3);
                Optional<String> newLabel = TextSubstitution.lookup(label, translations);
                Optional<String> newMessage = TextSubstitution.lookup(message, translations);
                if (newLabel.isEmpty() && newMessage.isEmpty()) {
                    continue;
                }
                update.setString(1, newLabel.orElse(label));
                update.setString(2, newMessage.orElse(message));
                update.setLong(3, rows.getLong(1));
                update.addBatch();
                replaced += (newLabel.isPresent() ? 1 : 0) + (newMessage.isPresent() ? 1 : 0);
            }
            update.executeBatch();
        }
        return replaced;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record PageRow(long pageRowId, String rid, String name, int columns, int rows, Long boxId) {
    }

    private record CellRow(Integer location, long resourceId, String rid, String label, String message) {
    }

    private record ButtonActions(boolean navigate, String target, boolean other, ButtonType marker) {
        static final ButtonActions NONE = new ButtonActions(false, null, false, null);

        ButtonActions withNavigation(String newTarget) {
            return new ButtonActions(true, target != null ? target : newTarget, other, marker);
        }

        ButtonActions withOther() {
            return new ButtonActions(navigate, target, true, marker);
        }

        ButtonActions withMarker(ButtonType type) {
            return new ButtonActions(navigate, target, other, marker != null ? marker : type);
        }
    }
}
