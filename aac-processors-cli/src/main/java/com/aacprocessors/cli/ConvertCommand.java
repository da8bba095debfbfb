package com.aacprocessors.cli;

import com.aacprocessors.core.config.ConfigLoader;
import com.aacprocessors.core.conversion.PagesetConverter;
import com.aacprocessors.core.conversion.ProcessorRegistry;
import com.aacprocessors.core.model.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to convert a pageset between formats.
 *
 * <p>Formats are chosen by file extension. Load warnings (relocated buttons, unresolved
 * root pages) are printed after the conversion.
 */
@Command(
    name = "convert",
    description = "Convert a pageset to the format of the target extension",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(index = "0", description = "Source pageset file")
    private Path source;

    @Parameters(index = "1", description = "Target pageset file")
    private Path target;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: aac-processors.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            PagesetConverter converter = new PagesetConverter(new ProcessorRegistry(ConfigLoader.load(configPath)));
            Tree tree = converter.convert(source, target);
            tree.getWarnings().forEach(warning -> System.out.println("⚠ " + warning));
            System.out.println("✓ Converted " + tree.size() + " pages to " + target);
            return 0;
        } catch (Exception e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }
}
