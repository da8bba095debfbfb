package com.aacprocessors.core.processor;

import com.aacprocessors.core.config.ProcessorConfig;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Interface for format adapters that read and write one family of AAC pageset files.
 *
 * <p>Processors are discovered via Java Service Provider Interface (SPI). Each processor
 * understands one vendor encoding and converts it to and from the vendor-neutral
 * {@link Tree}. Callers that only need text (for translation) use {@link #extractTexts}
 * and {@link #processTexts(Path, Map, Path)}, which work on the vendor file directly and
 * leave everything they do not rewrite untouched.
 *
 * <p>Calls are synchronous and self-contained. A processor instance keeps only its
 * configuration and the optional source file registered with {@link #setSourceFile};
 * use one instance per conversion when running conversions concurrently.
 *
 * <p><b>Errors:</b> loading fails with
 * {@link com.aacprocessors.core.exception.FormatException} when the container cannot be
 * opened and with {@link com.aacprocessors.core.exception.SchemaException} when it opens
 * but lacks required structure. Filesystem problems surface as {@link IOException}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.aacprocessors.core.processor.AACProcessor}
 *
 * @see ProcessorRegistry
 */
public interface AACProcessor {

    /**
     * Returns unique identifier for this processor.
     *
     * <p>Should be kebab-case (e.g., "gridset", "touchchat").
     *
     * @return unique processor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this processor (e.g., "Grid 3 Gridset").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extensions this processor reads and writes, lower case and without dot.
     *
     * @return supported extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Checks whether a file has one of the supported extensions.
     *
     * @param file file to check
     * @return true if this processor handles the file
     */
    default boolean canProcess(Path file) {
        return getSupportedExtensions().contains(FileUtils.getNormalizedExtension(file));
    }

    /**
     * Applies a configuration table. Processors created by {@link java.util.ServiceLoader}
     * start with {@link ProcessorConfig#defaults()}.
     *
     * @param config configuration to use for subsequent calls
     */
    void configure(ProcessorConfig config);

    /**
     * Collects every non-empty label and message, page by page and button by button.
     *
     * <p>The list is not deduplicated. The source file is never modified.
     *
     * @param file pageset file
     * @return texts in traversal order
     * @throws IOException if the file cannot be read
     */
    List<String> extractTexts(Path file) throws IOException;

    /**
     * Parses a pageset file into a tree.
     *
     * @param file pageset file
     * @return a freshly built tree owned by the caller
     * @throws IOException if the file cannot be read
     */
    Tree loadIntoTree(Path file) throws IOException;

    /**
     * Writes a tree in this processor's format.
     *
     * <p>The tree may come from any processor. Vendor fields it does not carry are
     * synthesized from the configured defaults. When a source file of the same format is
     * registered via {@link #setSourceFile(Path)}, content the tree does not model (images,
     * sounds, settings, unmodelled store rows) is carried over from it.
     *
     * @param tree tree to write
     * @param output destination file
     * @throws IOException if the output cannot be written
     */
    void exportTree(Tree tree, Path output) throws IOException;

    /**
     * Extracts texts without translating; same as {@link #extractTexts(Path)}.
     *
     * @param file pageset file
     * @return texts in traversal order
     * @throws IOException if the file cannot be read
     */
    default List<String> processTexts(Path file) throws IOException {
        return extractTexts(file);
    }

    /**
     * Writes a copy of a pageset with labels and messages replaced.
     *
     * <p>Only fields whose whole value equals a key of {@code translations} are rewritten;
     * everything else is copied unchanged. The output is either written completely or not
     * created at all.
     *
     * @param file source pageset
     * @param translations exact original text to replacement text
     * @param output destination file
     * @return {@code output}
     * @throws IOException if reading or writing fails
     */
    Path processTexts(Path file, Map<String, String> translations, Path output) throws IOException;

    /**
     * Registers the file a tree was loaded from, so {@link #exportTree} can carry over
     * content the tree does not model.
     *
     * @param file source pageset, or null to clear
     */
    void setSourceFile(Path file);

    /**
     * Returns the registered source file.
     *
     * @return source file, or empty when none is registered
     */
    Optional<Path> getSourceFile();

    /**
     * Derives the conventional output path for a translated copy:
     * {@code <dir>/<base>_<language><ext>}.
     *
     * @param source source pageset
     * @param languageCode target language code (e.g., "es")
     * @return sibling path of the source
     */
    default Path outputPathFor(Path source, String languageCode) {
        String extension = FileUtils.getExtension(source);
        String fileName = FileUtils.getBaseName(source) + "_" + languageCode
            + (extension.isEmpty() ? "" : "." + extension);
        Path parent = source.toAbsolutePath().getParent();
        return parent == null ? Path.of(fileName) : parent.resolve(fileName);
    }

    /**
     * Releases scratch directories that are still held by this processor.
     *
     * <p>Every operation already releases its own scratch directory on exit, including on
     * failure. This only reclaims directories whose release failed. Idempotent.
     *
     * @deprecated scratch directories are scoped to each call; there is normally nothing to release
     */
    @Deprecated(since = "1.0.0")
    void cleanupTempFiles();
}
