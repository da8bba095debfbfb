package com.aacprocessors.cli;

import com.aacprocessors.core.analysis.NavigationAnalysis;
import com.aacprocessors.core.config.ConfigLoader;
import com.aacprocessors.core.conversion.PagesetConverter;
import com.aacprocessors.core.conversion.ProcessorRegistry;
import com.aacprocessors.core.model.ButtonType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to report the navigation structure of a pageset.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * aac-processors analyze core.obz
 * aac-processors analyze core.obz --json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Report reachable, orphaned and dead-end pages and navigation cycles",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "Pageset file")
    private Path file;

    @Option(names = {"--json"}, description = "Print the analysis as JSON")
    private boolean json;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: aac-processors.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            PagesetConverter converter = new PagesetConverter(new ProcessorRegistry(ConfigLoader.load(configPath)));
            NavigationAnalysis analysis = converter.analyze(file);
            if (json) {
                System.out.println(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(analysis));
            } else {
                printSummary(analysis);
            }
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(NavigationAnalysis analysis) {
        System.out.println("Navigation Analysis:");
        System.out.println();
        System.out.printf("  Pages: %d (root: %s)%n", analysis.totalPages(),
            analysis.rootId() == null ? "none" : analysis.rootId());
        System.out.printf("  Reachable: %d%n", analysis.reachablePages().size());
        System.out.printf("  Orphaned: %s%n", analysis.orphanedPages());
        System.out.printf("  Dead ends: %s%n", analysis.deadEndPages());
        System.out.printf("  Cycles through: %s%n", analysis.cyclePages());
        System.out.printf("  Maximum depth: %d%n", analysis.maxDepth());
        for (NavigationAnalysis.DanglingTarget dangling : analysis.danglingTargets()) {
            System.out.printf("  Dangling link: %s/%s -> %s%n",
                dangling.pageId(), dangling.buttonId(), dangling.targetPageId());
        }
        System.out.println();
        System.out.println("  Buttons:");
        for (ButtonType type : ButtonType.values()) {
            System.out.printf("    %s: %d%n", type, analysis.countOf(type));
        }
    }
}
