package com.aacprocessors.cli;

import com.aacprocessors.core.config.ConfigLoader;
import com.aacprocessors.core.conversion.PagesetConverter;
import com.aacprocessors.core.conversion.ProcessorRegistry;
import com.aacprocessors.core.processor.AACProcessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to write a translated copy of a pageset.
 *
 * <p>The translation map is a JSON object of exact original text to replacement. Texts
 * not in the map are kept.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes core_fr.gridset next to the source
 * aac-processors translate core.gridset --map fr.json --lang fr
 *
 * # Translate and convert in one step
 * aac-processors translate core.gridset --map fr.json -o core_fr.obz
 * }</pre>
 */
@Command(
    name = "translate",
    description = "Write a copy of a pageset with labels and messages replaced",
    mixinStandardHelpOptions = true
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    @Parameters(index = "0", description = "Source pageset file")
    private Path source;

    @Option(names = {"-m", "--map"}, required = true, description = "JSON translation map")
    private Path mapFile;

    @Option(names = {"-o", "--output"}, description = "Output file (format chosen by extension)")
    private Path output;

    @Option(names = {"-l", "--lang"}, description = "Language code used to name the output when -o is absent")
    private String language;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: aac-processors.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            if (output == null && language == null) {
                log.error("Either --output or --lang is required");
                System.err.println("✗ Either --output or --lang is required");
                return 1;
            }
            Map<String, String> translations = new ObjectMapper()
                .readValue(mapFile.toFile(), new TypeReference<Map<String, String>>() { });
            log.debug("Read {} translations from {}", translations.size(), mapFile);

            PagesetConverter converter = new PagesetConverter(new ProcessorRegistry(ConfigLoader.load(configPath)));
            Path target = output;
            if (target == null) {
                AACProcessor processor = converter.processorFor(source);
                target = processor.outputPathFor(source, language);
            }
            converter.translate(source, translations, target);
            System.out.println("✓ Wrote " + target);
            return 0;
        } catch (Exception e) {
            log.error("Translation failed", e);
            System.err.println("✗ Translation failed: " + e.getMessage());
            return 1;
        }
    }
}
