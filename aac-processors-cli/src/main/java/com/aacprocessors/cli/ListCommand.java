package com.aacprocessors.cli;

import com.aacprocessors.core.conversion.ProcessorRegistry;
import com.aacprocessors.core.processor.AACProcessor;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list the supported pageset formats.
 *
 * <p>Discovers processors via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List the supported pageset formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available Processors:");
        System.out.println();

        List<AACProcessor> processors = new ProcessorRegistry().all();
        for (AACProcessor processor : processors) {
            System.out.printf("  • %s (ID: %s)%n", processor.getDisplayName(), processor.getId());
            System.out.printf("    Extensions: %s%n", new TreeSet<>(processor.getSupportedExtensions()));
            System.out.println();
        }

        if (processors.isEmpty()) {
            System.out.println("  No processors found.");
        }
        return 0;
    }
}
