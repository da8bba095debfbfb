package com.aacprocessors.core.conversion;

import com.aacprocessors.core.analysis.NavigationAnalysis;
import com.aacprocessors.core.analysis.NavigationAnalyzer;
import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.AACProcessor;
import com.aacprocessors.core.translation.TextSubstitution;
import com.aacprocessors.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads pagesets with one format and saves them with another.
 *
 * <p>The format of every file is chosen by its extension. When source and target share a
 * format, the source is handed to the writing processor so content the tree does not
 * model survives the conversion.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PagesetConverter converter = new PagesetConverter(new ProcessorRegistry());
 * converter.convert(Path.of("core.gridset"), Path.of("core.obz"));
 * NavigationAnalysis analysis = converter.analyze(Path.of("core.obz"));
 * }</pre>
 */
public class PagesetConverter {

    private static final Logger log = LoggerFactory.getLogger(PagesetConverter.class);

    private final ProcessorRegistry registry;
    private final NavigationAnalyzer analyzer = new NavigationAnalyzer();

    public PagesetConverter(ProcessorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Returns a new processor for a file.
     *
     * @throws FormatException if no processor handles the file's extension
     */
    public AACProcessor processorFor(Path file) {
        return registry.forFile(file)
            .orElseThrow(() -> new FormatException("No processor handles " + file.getFileName()));
    }

    public Tree load(Path source) throws IOException {
        return processorFor(source).loadIntoTree(source);
    }

    public List<String> extractTexts(Path source) throws IOException {
        return processorFor(source).extractTexts(source);
    }

    public NavigationAnalysis analyze(Path source) throws IOException {
        return analyzer.analyze(load(source));
    }

    /**
     * Converts a pageset to the format implied by the target's extension.
     *
     * @return the loaded tree, as written
     */
    public Tree convert(Path source, Path target) throws IOException {
        AACProcessor reader = processorFor(source);
        AACProcessor writer = processorFor(target);
        Tree tree = reader.loadIntoTree(source);
        if (reader.getId().equals(writer.getId())) {
            writer.setSourceFile(source);
        }
        writer.exportTree(tree, target);
        log.info("Converted {} ({}) to {} ({})", source, reader.getId(), target, writer.getId());
        return tree;
    }

    /**
     * Writes a translated copy of a pageset.
     *
     * <p>Between files of the same extension the source is rewritten in place of the tree round trip, so
     * everything except the matched labels and messages is kept byte for byte. Across
     * formats the tree is translated and exported.
     *
     * @return target
     */
    public Path translate(Path source, Map<String, String> translations, Path target) throws IOException {
        AACProcessor reader = processorFor(source);
        AACProcessor writer = processorFor(target);
        if (FileUtils.getNormalizedExtension(source).equals(FileUtils.getNormalizedExtension(target))) {
            return reader.processTexts(source, translations, target);
        }
        Tree tree = reader.loadIntoTree(source);
        int replaced = TextSubstitution.apply(tree, translations);
        writer.exportTree(tree, target);
        log.info("Translated {} texts from {} into {}", replaced, source, target);
        return target;
    }
}
