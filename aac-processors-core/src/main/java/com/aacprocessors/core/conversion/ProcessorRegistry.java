package com.aacprocessors.core.conversion;

import com.aacprocessors.core.config.ProcessorConfig;
import com.aacprocessors.core.processor.AACProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers format processors via the Java Service Provider Interface.
 *
 * <p>Processors carry per-call state (configuration, source file, scratch directories),
 * so every lookup returns new, configured instances.
 */
public final class ProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private final ProcessorConfig config;

    public ProcessorRegistry() {
        this(ProcessorConfig.defaults());
    }

    public ProcessorRegistry(ProcessorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns one new instance of every registered processor, in registration order.
     */
    public List<AACProcessor> all() {
        List<AACProcessor> processors = new ArrayList<>();
        for (AACProcessor processor : ServiceLoader.load(AACProcessor.class)) {
            processor.configure(config);
            processors.add(processor);
        }
        log.debug("Discovered {} processors", processors.size());
        return processors;
    }

    /**
     * Finds the processor handling a file, by extension.
     */
    public Optional<AACProcessor> forFile(Path file) {
        return all().stream()
            .filter(processor -> processor.canProcess(file))
            .findFirst();
    }

    /**
     * Finds a processor by its id, e.g. {@code "gridset"}.
     */
    public Optional<AACProcessor> byId(String id) {
        return all().stream()
            .filter(processor -> processor.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
