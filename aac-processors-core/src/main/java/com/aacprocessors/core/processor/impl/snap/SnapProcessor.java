package com.aacprocessors.core.processor.impl.snap;

import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.base.AbstractEmbeddedStoreProcessor;
import com.aacprocessors.core.translation.TextSubstitution;
import com.aacprocessors.core.util.FileUtils;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Processor for Snap pagesets ({@code .spb}, {@code .sps}).
 *
 * <p>A pageset is a SQLite store, either bare or zipped. Buttons hang off pages through
 * {@code ElementReference}; a button placed in several page layouts is read at the
 * placement of the lowest layout id.
 *
 * <p>A button linked to a page is NAVIGATE, even when the link names no page. Command
 * sequences make it ACTION, except the configured speak and empty sequences, which only
 * mark the type of a button whose texts would suggest the other one.
 *
 * @since 1.0.0
 */
public class SnapProcessor extends AbstractEmbeddedStoreProcessor {

    private static final String PROCESSOR_ID = "snap";
    private static final String STORE_EXTENSION = "sps";

    private static final List<String> REQUIRED_TABLES = List.of(
        "Page", "Button", "ElementReference", "ElementPlacement", "ButtonPageLink"
    );

    private static final String SELECT_BUTTONS = """
        SELECT b.Id, b.Label, b.Message, er.PageId, ep.GridPosition
        FROM Button b
        JOIN ElementReference er ON er.Id = b.ElementReferenceId
        LEFT JOIN ElementPlacement ep ON ep.ElementReferenceId = er.Id
        ORDER BY b.Id, ep.PageLayoutId, ep.Id
        """;

    @Override
    public String getId() {
        return PROCESSOR_ID;
    }

    @Override
    public String getDisplayName() {
        return "Snap Pageset";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("spb", STORE_EXTENSION);
    }

    // ==================== Store Layout ====================

    @Override
    protected boolean isStoreEntry(String entryName) {
        return entryName.toLowerCase(Locale.ROOT).endsWith("." + STORE_EXTENSION);
    }

    @Override
    protected String defaultStoreEntry() {
        return config().snap().storeEntry();
    }

    @Override
    protected List<String> requiredTables() {
        return REQUIRED_TABLES;
    }

    @Override
    protected String schemaTemplate() {
        return "/templates/snap-schema.sql";
    }

    @Override
    protected boolean writesArchive(Path output, Optional<StoreSource> source) {
        if (STORE_EXTENSION.equals(FileUtils.getNormalizedExtension(output))) {
            return false;
        }
        return source.map(StoreSource::isArchived).orElse(config().snap().archived());
    }

    // ==================== Loading ====================

    @Override
    protected Tree readTree(Connection connection, String storeName) throws SQLException {
        Tree tree = new Tree();
        Map<Long, PageRow> pages = readPages(connection, storeName);
        Map<Long, String> links = readLinks(connection);
        Map<Long, List<String>> commands = readCommandSequences(connection);

        Map<Long, List<ButtonRow>> buttonsByPage = new HashMap<>();
        Set<Long> seen = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_BUTTONS);
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                long buttonId = rows.getLong(1);
                if (!seen.add(buttonId)) {
                    continue;
                }
                long pageRow = rows.getLong(4);
                if (!pages.containsKey(pageRow)) {
                    warn(tree, "Button " + buttonId + " references unknown page row " + pageRow + "; skipped");
                    continue;
                }
                GridPosition position = parsePosition(rows.getString(5), "button " + buttonId, storeName);
                buttonsByPage.computeIfAbsent(pageRow, key -> new ArrayList<>())
                    .add(new ButtonRow(buttonId, nullToEmpty(rows.getString(2)), nullToEmpty(rows.getString(3)),
                        position));
            }
        }

        for (PageRow row : pages.values()) {
            List<ButtonRow> buttons = buttonsByPage.getOrDefault(row.rowId(), List.of());
            tree.addPage(buildPage(row, buttons, links, commands, tree));
        }

        if (hasTable(connection, "PageSetProperties")) {
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT DefaultHomePageUniqueId FROM PageSetProperties ORDER BY Id LIMIT 1");
                 ResultSet rows = statement.executeQuery()) {
                String home = rows.next() ? rows.getString(1) : null;
                if (home != null && !home.isEmpty()) {
                    if (tree.containsPage(home)) {
                        tree.setRootId(home);
                    } else {
                        warn(tree, "Default home page '" + home + "' is not in the pageset; using the first page");
                    }
                }
            }
        }
        return tree;
    }

    private Map<Long, PageRow> readPages(Connection connection, String storeName) throws SQLException {
        Map<Long, PageRow> pages = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT Id, UniqueId, Title, GridDimension FROM Page ORDER BY Id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                long rowId = rows.getLong(1);
                String uniqueId = rows.getString(2);
                String pageId = uniqueId == null || uniqueId.isEmpty() ? String.valueOf(rowId) : uniqueId;
                GridPosition dimension = parsePosition(rows.getString(4), "page " + pageId, storeName);
                int gridRows = dimension == null ? 1 : Math.max(dimension.row(), 1);
                int gridColumns = dimension == null ? 1 : Math.max(dimension.column(), 1);
                pages.put(rowId, new PageRow(rowId, pageId, rows.getString(3), gridRows, gridColumns));
            }
        }
        return pages;
    }

    private Map<Long, String> readLinks(Connection connection) throws SQLException {
        Map<Long, String> links = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT ButtonId, PageUniqueId FROM ButtonPageLink ORDER BY Id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                // A link without a target page still marks a navigation button
                links.merge(rows.getLong(1), nullToEmpty(rows.getString(2)),
                    (first, next) -> first.isEmpty() ? next : first);
            }
        }
        return links;
    }

    private Map<Long, List<String>> readCommandSequences(Connection connection) throws SQLException {
        Map<Long, List<String>> sequences = new HashMap<>();
        if (!hasTable(connection, "CommandSequence")) {
            return sequences;
        }
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT ButtonId, SerializedCommands FROM CommandSequence ORDER BY Id");
             ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                sequences.computeIfAbsent(rows.getLong(1), key -> new ArrayList<>())
                    .add(nullToEmpty(rows.getString(2)).trim());
            }
        }
        return sequences;
    }

    private Page buildPage(PageRow row, List<ButtonRow> buttons, Map<Long, String> links,
                           Map<Long, List<String>> commands, Tree tree) {
        int rows = row.rows();
        int columns = row.columns();
        Set<GridPosition> declared = new HashSet<>();
        for (ButtonRow button : buttons) {
            if (button.position() != null) {
                rows = Math.max(rows, button.position().row() + 1);
                columns = Math.max(columns, button.position().column() + 1);
                declared.add(button.position());
            }
        }
        if ((long) rows * columns < buttons.size()) {
            rows = (buttons.size() + columns - 1) / columns;
        }

        Page page = new Page(row.pageId(), row.title(), rows, columns);
        for (ButtonRow button : buttons) {
            GridPosition position = button.position();
            if (position == null || page.isOccupied(position)) {
                GridPosition free = page.firstFreePosition(declared).or(page::firstFreePosition).orElseThrow();
                warn(tree, "Button " + button.rowId() + " on page '" + row.pageId() + "' has no free cell at "
                    + position + "; placed at " + free);
                position = free;
            }
            String target = links.get(button.rowId());
            List<String> sequences = commands.getOrDefault(button.rowId(), List.of());
            ButtonType type;
            if (target != null) {
                type = ButtonType.NAVIGATE;
            } else if (isOnly(sequences, config().snap().speakCommands())) {
                type = ButtonType.SPEAK;
            } else if (isOnly(sequences, config().snap().emptyCommands())) {
                type = ButtonType.EMPTY;
            } else if (!sequences.isEmpty()) {
                type = ButtonType.ACTION;
            } else if (!button.label().isEmpty() || !button.message().isEmpty()) {
                type = ButtonType.SPEAK;
            } else {
                type = ButtonType.EMPTY;
            }
            page.addButton(new Button(String.valueOf(button.rowId()), button.label(), button.message(), type,
                position, target));
        }
        return page;
    }

    private static boolean isOnly(List<String> sequences, String marker) {
        return !sequences.isEmpty() && sequences.stream().allMatch(marker.trim()::equals);
    }

    /**
     * Parses a {@code "row,column"} pair; null or blank means absent.
     *
     * @throws SchemaException if the value is not two non-negative integers
     */
    static GridPosition parsePosition(String value, String owner, String storeName) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.split(",");
        try {
            if (parts.length == 2) {
                return new GridPosition(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            }
        } catch (IllegalArgumentException e) {
            throw new SchemaException(storeName + " has malformed grid value '" + value + "' for " + owner, e);
        }
        throw new SchemaException(storeName + " has malformed grid value '" + value + "' for " + owner);
    }

    private void warn(Tree tree, String warning) {
        log.warn(warning);
        tree.addWarning(warning);
    }

    // ==================== Saving ====================

    @Override
    protected void writeTree(Connection connection, Tree tree) throws SQLException {
        boolean commandSequences = hasTable(connection, "CommandSequence");
        boolean pageLayouts = hasTable(connection, "PageLayout");
        boolean properties = hasTable(connection, "PageSetProperties");
        new SnapStoreWriter(connection, config().snap(), this::insert, commandSequences, pageLayouts, properties)
            .write(tree);
    }

    // ==================== Text Rewriting ====================

    @Override
    protected int rewriteStoreTexts(Connection connection, Map<String, String> translations) throws SQLException {
        int replaced = 0;
        try (PreparedStatement select = connection.prepareStatement("SELECT Id, Label, Message FROM Button ORDER BY Id");
             PreparedStatement update = connection.prepareStatement(
                 "UPDATE Button SET Label = ?, Message = ? WHERE Id = ?");
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

    private record PageRow(long rowId, String pageId, String title, int rows, int columns) {
    }

    private record ButtonRow(long rowId, String label, String message, GridPosition position) {
    }
}
