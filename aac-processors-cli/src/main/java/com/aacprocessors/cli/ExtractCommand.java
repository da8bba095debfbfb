package com.aacprocessors.cli;

import com.aacprocessors.core.config.ConfigLoader;
import com.aacprocessors.core.conversion.PagesetConverter;
import com.aacprocessors.core.conversion.ProcessorRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to print the translatable texts of a pageset.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # One text per line
 * aac-processors extract core.gridset
 *
 * # Translation template: every distinct text mapped to itself
 * aac-processors extract core.gridset --template -o fr.json
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Print the labels and messages of a pageset",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(index = "0", description = "Pageset file")
    private Path file;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: aac-processors.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--template"}, description = "Write a JSON translation map of distinct texts")
    private boolean template;

    @Option(names = {"-o", "--output"}, description = "Write the JSON template to a file instead of stdout")
    private Path output;

    @Override
    public Integer call() {
        try {
            PagesetConverter converter = new PagesetConverter(new ProcessorRegistry(ConfigLoader.load(configPath)));
            List<String> texts = converter.extractTexts(file);
            log.debug("Extracted {} texts from {}", texts.size(), file);

            if (!template) {
                texts.forEach(System.out::println);
                return 0;
            }
            Map<String, String> identity = new LinkedHashMap<>();
            texts.forEach(text -> identity.putIfAbsent(text, text));
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            if (output == null) {
                System.out.println(mapper.writeValueAsString(identity));
            } else {
                mapper.writeValue(output.toFile(), identity);
                System.out.println("✓ Wrote " + identity.size() + " texts to " + output);
            }
            return 0;
        } catch (Exception e) {
            log.error("Extraction failed", e);
            System.err.println("✗ Extraction failed: " + e.getMessage());
            return 1;
        }
    }
}
