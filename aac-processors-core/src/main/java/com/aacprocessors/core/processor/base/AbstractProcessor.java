package com.aacprocessors.core.processor.base;

import com.aacprocessors.core.config.ProcessorConfig;
import com.aacprocessors.core.processor.AACProcessor;
import com.aacprocessors.core.translation.TextSubstitution;
import com.aacprocessors.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Abstract base class for processor implementations providing common functionality.
 *
 * <p>This class reduces code duplication across processor implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per processor class)</li>
 *   <li>Configuration and source file bookkeeping</li>
 *   <li>Scoped scratch directories ({@link #openWorkspace()})</li>
 *   <li>All-or-nothing output writing ({@link #writeAtomically(Path, OutputWriter)})</li>
 *   <li>Text extraction on top of {@link #loadIntoTree(Path)}</li>
 * </ul>
 *
 * @see AACProcessor
 * @since 1.0.0
 */
public abstract class AbstractProcessor implements AACProcessor {

    /**
     * Logger instance for this processor.
     * Automatically initialized with the concrete processor class name.
     */
    protected final Logger log;

    private final Set<TempWorkspace> openWorkspaces = ConcurrentHashMap.newKeySet();
    private ProcessorConfig config = ProcessorConfig.defaults();
    private Path sourceFile;

    /**
     * Constructor that initializes the logger for the concrete processor class.
     */
    protected AbstractProcessor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public void configure(ProcessorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns the active configuration.
     */
    protected ProcessorConfig config() {
        return config;
    }

    @Override
    public void setSourceFile(Path file) {
        this.sourceFile = file;
    }

    @Override
    public Optional<Path> getSourceFile() {
        return Optional.ofNullable(sourceFile);
    }

    /**
     * Returns the registered source file when it can serve as a template for writing
     * {@code output}: it must exist and share the output's extension.
     *
     * @param output file about to be written
     * @return usable source file, or empty
     */
    protected Optional<Path> sameFormatSource(Path output) {
        if (sourceFile == null || !Files.isRegularFile(sourceFile)) {
            return Optional.empty();
        }
        String sourceExtension = FileUtils.getNormalizedExtension(sourceFile);
        if (!sourceExtension.equals(FileUtils.getNormalizedExtension(output)) || !canProcess(sourceFile)) {
            return Optional.empty();
        }
        return Optional.of(sourceFile);
    }

    // ==================== Text Operations ====================

    @Override
    public List<String> extractTexts(Path file) throws IOException {
        List<String> texts = TextSubstitution.collect(loadIntoTree(file));
        log.debug("Extracted {} texts from {}", texts.size(), file);
        return texts;
    }

    @Override
    public Path processTexts(Path file, Map<String, String> translations, Path output) throws IOException {
        Objects.requireNonNull(output, "output must not be null");
        requireReadable(file);
        Map<String, String> effective = translations == null ? Map.of() : translations;
        writeAtomically(output, target -> rewriteTexts(file, effective, target));
        log.info("Wrote translated {} to {}", getDisplayName(), output);
        return output;
    }

    /**
     * Writes a copy of {@code file} to {@code target} with exactly matching labels and
     * messages replaced. Everything not rewritten must be copied unchanged.
     *
     * @param file source pageset
     * @param translations exact original text to replacement text
     * @param target file to write
     * @throws IOException if reading or writing fails
     */
    protected abstract void rewriteTexts(Path file, Map<String, String> translations, Path target) throws IOException;

    // ==================== Output Helpers ====================

    /**
     * Writes a file completely or not at all.
     *
     * <p>Content goes to a hidden sibling file that is moved over {@code output} only after
     * the writer returns. Any failure deletes the partial file and leaves {@code output}
     * untouched.
     *
     * @param output destination file
     * @param writer writes the complete file to the path it is given
     * @throws IOException if writing or moving fails
     */
    protected void writeAtomically(Path output, OutputWriter writer) throws IOException {
        Path absolute = output.toAbsolutePath();
        Path parent = absolute.getParent();
        Files.createDirectories(parent);
        Path partial = Files.createTempFile(parent, "." + absolute.getFileName(), ".part");
        boolean moved = false;
        try {
            writer.write(partial);
            try {
                Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(partial);
            }
        }
    }

    /**
     * Fails with {@link NoSuchFileException} unless {@code file} is a readable regular file.
     */
    protected void requireReadable(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new NoSuchFileException(file.toString());
        }
    }

    // ==================== Scratch Directories ====================

    /**
     * Creates a scratch directory tracked by this processor until it is closed.
     *
     * @return open workspace; close it with try-with-resources
     * @throws IOException if the directory cannot be created
     */
    protected TempWorkspace openWorkspace() throws IOException {
        TempWorkspace workspace = TempWorkspace.create(config.workspace(), openWorkspaces::remove);
        openWorkspaces.add(workspace);
        return workspace;
    }

    /**
     * Returns the number of scratch directories not yet released.
     */
    public int openWorkspaceCount() {
        return openWorkspaces.size();
    }

    @Override
    @Deprecated(since = "1.0.0")
    public void cleanupTempFiles() {
        for (TempWorkspace workspace : List.copyOf(openWorkspaces)) {
            workspace.close();
        }
    }

    /**
     * Writes a complete file to the given path.
     */
    @FunctionalInterface
    protected interface OutputWriter {
        void write(Path target) throws IOException;
    }

    /**
     * Names a file in error messages, e.g. "Snap Pageset file board.spb".
     */
    protected String describe(Path file) {
        return getDisplayName() + " file " + file.getFileName();
    }
}
