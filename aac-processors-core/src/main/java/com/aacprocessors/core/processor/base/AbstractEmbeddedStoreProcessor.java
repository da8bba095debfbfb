package com.aacprocessors.core.processor.base;

import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.exception.PagesetException;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.util.FileUtils;
import org.sqlite.SQLiteErrorCode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Abstract base class for processors whose pagesets are SQLite stores, usually wrapped
 * in a zip archive.
 *
 * <p>Every operation works on a private copy of the store inside a {@link TempWorkspace}:
 * <ul>
 *   <li>Loading copies the store out, checks the required tables and reads the tree</li>
 *   <li>Exporting starts from the same-format source store, or from the bundled schema
 *       template, writes the tree into it and repackages the container</li>
 *   <li>Text rewriting updates matching rows and repackages the container; a pageset
 *       with no matching text is copied byte for byte</li>
 * </ul>
 *
 * <p>SQLite failures are mapped to {@link FormatException} when the store itself is
 * unreadable and to {@link SchemaException} otherwise.
 *
 * @see AbstractProcessor
 * @since 1.0.0
 */
public abstract class AbstractEmbeddedStoreProcessor extends AbstractProcessor {

    /**
     * Header every SQLite database file starts with.
     */
    protected static final byte[] SQLITE_MAGIC = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private static final String JDBC_PREFIX = "jdbc:sqlite:";
    private static final String WORKING_STORE = "store.db";

    /**
     * Where a store was found: inside an archive, or as the pageset file itself.
     *
     * @param archive enclosing archive, or null for a bare store
     * @param entryName archive entry holding the store, or the file name of a bare store
     */
    protected record StoreSource(ZipContainer archive, String entryName) {

        public boolean isArchived() {
            return archive != null;
        }
    }

    // ==================== Format Hooks ====================

    /**
     * Returns true if an archive entry holds this format's store.
     */
    protected abstract boolean isStoreEntry(String entryName);

    /**
     * Returns the entry name used when a new archive is written.
     */
    protected abstract String defaultStoreEntry();

    /**
     * Returns the tables a readable store must contain.
     */
    protected abstract List<String> requiredTables();

    /**
     * Returns the classpath location of the DDL for an empty store.
     */
    protected abstract String schemaTemplate();

    /**
     * Returns true if a pageset written to {@code output} wraps its store in an archive.
     *
     * @param output file about to be written
     * @param source container of the same-format source, if any
     */
    protected abstract boolean writesArchive(Path output, Optional<StoreSource> source);

    /**
     * Reads the tree from an open store whose required tables are present.
     */
    protected abstract Tree readTree(Connection connection, String storeName) throws SQLException;

    /**
     * Writes the tree into a store that holds either the source pageset or the empty
     * schema. Runs inside a transaction committed by the caller.
     */
    protected abstract void writeTree(Connection connection, Tree tree) throws SQLException;

    /**
     * Replaces exactly matching labels and messages. Runs inside a transaction committed
     * by the caller.
     *
     * @return number of fields replaced
     */
    protected abstract int rewriteStoreTexts(Connection connection, Map<String, String> translations)
        throws SQLException;

    // ==================== Operations ====================

    @Override
    public Tree loadIntoTree(Path file) throws IOException {
        requireReadable(file);
        try (TempWorkspace workspace = openWorkspace()) {
            StoreSource source = locateStore(file);
            Path store = extractStore(file, source, workspace);
            try (Connection connection = connect(store)) {
                requireTables(connection, source.entryName());
                Tree tree = readTree(connection, source.entryName());
                log.info("Loaded {} pages from {}", tree.size(), file);
                return tree;
            } catch (SQLException e) {
                throw storeFailure(e, describe(file));
            }
        }
    }

    @Override
    public void exportTree(Tree tree, Path output) throws IOException {
        Optional<Path> sourceFile = sameFormatSource(output);
        writeAtomically(output, target -> {
            try (TempWorkspace workspace = openWorkspace()) {
                Optional<StoreSource> source = Optional.empty();
                Path store;
                if (sourceFile.isPresent()) {
                    source = Optional.of(locateStore(sourceFile.get()));
                    store = extractStore(sourceFile.get(), source.get(), workspace);
                } else {
                    store = workspace.resolve(WORKING_STORE);
                }
                try (Connection connection = connect(store)) {
                    if (source.isPresent()) {
                        requireTables(connection, source.get().entryName());
                    } else {
                        createSchema(connection);
                    }
                    connection.setAutoCommit(false);
                    writeTree(connection, tree);
                    connection.commit();
                } catch (SQLException e) {
                    throw storeFailure(e, describe(output));
                }
                repackage(source, store, writesArchive(output, source), target);
            }
        });
        log.info("Wrote {} pages to {}", tree.size(), output);
    }

    @Override
    protected void rewriteTexts(Path file, Map<String, String> translations, Path target) throws IOException {
        try (TempWorkspace workspace = openWorkspace()) {
            StoreSource source = locateStore(file);
            Path store = extractStore(file, source, workspace);
            int replaced;
            try (Connection connection = connect(store)) {
                requireTables(connection, source.entryName());
                connection.setAutoCommit(false);
                replaced = rewriteStoreTexts(connection, translations);
                connection.commit();
            } catch (SQLException e) {
                throw storeFailure(e, describe(file));
            }
            log.debug("Replaced {} texts in {}", replaced, file);
            if (replaced == 0) {
                Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                repackage(Optional.of(source), store, source.isArchived(), target);
            }
        }
    }

    // ==================== Container Handling ====================

    /**
     * Finds the store in a pageset file.
     *
     * @throws FormatException if the file is neither a zip archive nor a SQLite store
     * @throws SchemaException if the archive holds no store
     */
    protected StoreSource locateStore(Path file) throws IOException {
        if (FileUtils.startsWith(file, SQLITE_MAGIC)) {
            return new StoreSource(null, file.getFileName().toString());
        }
        ZipContainer archive = ZipContainer.read(file, getDisplayName());
        String entry = archive.contains(defaultStoreEntry())
            ? defaultStoreEntry()
            : archive.names(this::isStoreEntry).stream()
                .findFirst()
                .orElseThrow(() -> new SchemaException(describe(file) + " contains no store"));
        return new StoreSource(archive, entry);
    }

    private Path extractStore(Path file, StoreSource source, TempWorkspace workspace) throws IOException {
        Path store = workspace.resolve(WORKING_STORE);
        if (source.isArchived()) {
            Files.write(store, source.archive().get(source.entryName()).orElseThrow());
        } else {
            Files.copy(file, store, StandardCopyOption.REPLACE_EXISTING);
        }
        if (!FileUtils.startsWith(store, SQLITE_MAGIC)) {
            throw new FormatException(source.entryName() + " in " + describe(file) + " is not a SQLite store");
        }
        return store;
    }

    private void repackage(Optional<StoreSource> source, Path store, boolean archived, Path target)
        throws IOException {
        if (!archived) {
            Files.copy(store, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        ZipContainer archive = source.map(StoreSource::archive).orElseGet(ZipContainer::new);
        String entryName = source.filter(StoreSource::isArchived)
            .map(StoreSource::entryName)
            .orElse(defaultStoreEntry());
        archive.put(entryName, Files.readAllBytes(store));
        archive.write(target);
    }

    // ==================== JDBC Helpers ====================

    /**
     * Opens a connection to a store file.
     */
    protected Connection connect(Path store) throws SQLException {
        return DriverManager.getConnection(JDBC_PREFIX + store.toAbsolutePath());
    }

    /**
     * Returns true if the store has a table with the given name.
     */
    protected boolean hasTable(Connection connection, String table) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            statement.setString(1, table);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next();
            }
        }
    }

    private void requireTables(Connection connection, String storeName) throws SQLException {
        Set<String> present = new LinkedHashSet<>();
        try (Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
            while (rows.next()) {
                present.add(rows.getString(1).toLowerCase(Locale.ROOT));
            }
        }
        List<String> missing = requiredTables().stream()
            .filter(table -> !present.contains(table.toLowerCase(Locale.ROOT)))
            .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException(storeName + " is missing tables " + missing);
        }
    }

    private void createSchema(Connection connection) throws SQLException, IOException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : readSchemaTemplate()) {
                statement.executeUpdate(ddl);
            }
        }
    }

    private List<String> readSchemaTemplate() throws IOException {
        String script;
        try (InputStream in = AbstractEmbeddedStoreProcessor.class.getResourceAsStream(schemaTemplate())) {
            if (in == null) {
                throw new IOException("Schema template not found on classpath: " + schemaTemplate());
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        StringBuilder withoutComments = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (!line.strip().startsWith("--")) {
                withoutComments.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String statement : withoutComments.toString().split(";")) {
            if (!statement.isBlank()) {
                statements.add(statement.strip());
            }
        }
        return statements;
    }

    /**
     * Executes an insert and returns the row id SQLite assigned.
     */
    protected long insert(PreparedStatement statement) throws SQLException {
        statement.executeUpdate();
        try (Statement query = statement.getConnection().createStatement();
             ResultSet rows = query.executeQuery("SELECT last_insert_rowid()")) {
            if (!rows.next()) {
                throw new SQLException("No row id returned for insert");
            }
            return rows.getLong(1);
        }
    }

    /**
     * Maps a SQLite failure to the pageset exception hierarchy.
     *
     * @param e failure
     * @param location pageset or store named in the message
     */
    protected PagesetException storeFailure(SQLException e, String location) {
        int code = e.getErrorCode() & 0xFF;
        if (code == SQLiteErrorCode.SQLITE_NOTADB.code || code == SQLiteErrorCode.SQLITE_CORRUPT.code) {
            return new FormatException(location + " has an unreadable store: " + e.getMessage(), e);
        }
        return new SchemaException(location + " has an unexpected store layout: " + e.getMessage(), e);
    }
}
