package com.aacprocessors.core.conversion;

import com.aacprocessors.core.config.ProcessorConfig;
import com.aacprocessors.core.processor.AACProcessor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcessorRegistry}.
 */
class ProcessorRegistryTest {

    private final ProcessorRegistry registry = new ProcessorRegistry(ProcessorConfig.defaults());

    @Test
    void all_returnsNewInstancesOnEveryCall() {
        AACProcessor first = registry.all().get(0);
        AACProcessor second = registry.all().get(0);

        assertThat(first).isNotSameAs(second);
        assertThat(first.getId()).isEqualTo(second.getId());
    }

    @Test
    void byId_isCaseInsensitive() {
        assertThat(registry.byId("TouchChat")).map(AACProcessor::getId).contains("touchchat");
        assertThat(registry.byId("unknown")).isEmpty();
    }

    @Test
    void forFile_withoutExtension_returnsEmpty() {
        assertThat(registry.forFile(Path.of("README"))).isEmpty();
        assertThat(registry.forFile(Path.of("board.obf"))).map(AACProcessor::getId).contains("obf");
    }

    @Test
    void constructor_withNullConfig_throwsException() {
        assertThatThrownBy(() -> new ProcessorRegistry(null)).isInstanceOf(NullPointerException.class);
    }
}
