package com.aacprocessors;

import ch.qos.logback.classic.Level;
import com.aacprocessors.cli.AnalyzeCommand;
import com.aacprocessors.cli.ConvertCommand;
import com.aacprocessors.cli.ExtractCommand;
import com.aacprocessors.cli.ListCommand;
import com.aacprocessors.cli.TranslateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for AAC Processors.
 *
 * <p>Reads, translates, converts and analyzes AAC pagesets in Grid 3, Open Board,
 * TouchChat, Snap and DOT formats.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Print the labels and messages of a pageset</li>
 *   <li>{@code translate} - Write a copy with labels and messages replaced</li>
 *   <li>{@code convert} - Convert a pageset to another format</li>
 *   <li>{@code analyze} - Report reachability, dead ends and cycles</li>
 *   <li>{@code list} - List the supported formats</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * aac-processors extract core.gridset
 * aac-processors translate core.obz --map fr.json --lang fr
 * aac-processors -v convert core.gridset core.obz
 * }</pre>
 */
@Command(
    name = "aac-processors",
    mixinStandardHelpOptions = true,
    version = "AAC Processors 1.0.0-SNAPSHOT",
    description = "Read, translate and convert AAC pagesets",
    subcommands = {
        ExtractCommand.class,
        TranslateCommand.class,
        ConvertCommand.class,
        AnalyzeCommand.class,
        ListCommand.class
    }
)
public class AacProcessorsCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("AAC Processors - pageset reader, translator and converter");
        System.out.println();
        System.out.println("Use 'aac-processors --help' to see available commands");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     */
    public static CommandLine commandLine() {
        AacProcessorsCLI cli = new AacProcessorsCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
