package com.aacprocessors.core.processor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for processor implementations.
 *
 * <p>This test ensures that:
 * <ul>
 *   <li>All processors registered in META-INF/services can be discovered via ServiceLoader</li>
 *   <li>Processor IDs are unique</li>
 *   <li>No two processors claim the same file extension</li>
 * </ul>
 *
 * <p>Expected processor count: 5 (Grid 3, Open Board, TouchChat, Snap, DOT)
 *
 * @see AACProcessor
 * @see ServiceLoader
 */
class ProcessorServiceLoaderTest {

    /**
     * Expected number of processor implementations.
     * Update this constant when adding new processors.
     */
    private static final int EXPECTED_PROCESSOR_COUNT = 5;

    @Test
    void serviceLoader_discoversAllRegisteredProcessors() {
        List<AACProcessor> processors = loadAll();

        assertThat(processors)
            .as("ServiceLoader should discover all %d registered processors", EXPECTED_PROCESSOR_COUNT)
            .hasSize(EXPECTED_PROCESSOR_COUNT)
            .allMatch(processor -> processor.getId() != null, "All processors should have non-null ID")
            .allMatch(processor -> !processor.getDisplayName().isBlank(), "All processors should have a name");
    }

    @Test
    void serviceLoader_processorsHaveUniqueIds() {
        List<AACProcessor> processors = loadAll();

        Set<String> ids = processors.stream()
            .map(AACProcessor::getId)
            .collect(Collectors.toSet());

        assertThat(ids).containsExactlyInAnyOrder("gridset", "obf", "touchchat", "snap", "dot");
    }

    @Test
    void serviceLoader_extensionsDoNotOverlap() {
        List<AACProcessor> processors = loadAll();

        List<String> extensions = processors.stream()
            .flatMap(processor -> processor.getSupportedExtensions().stream())
            .toList();

        assertThat(extensions)
            .doesNotHaveDuplicates()
            .allMatch(extension -> extension.equals(extension.toLowerCase()), "Extensions should be lower case")
            .contains("gridset", "obf", "obz", "touchchat", "ce", "spb", "sps", "dot", "gv");
    }

    private static List<AACProcessor> loadAll() {
        return ServiceLoader.load(AACProcessor.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }
}
