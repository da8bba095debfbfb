package com.aacprocessors.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_overridesConfiguredFields() throws IOException {
        Path configFile = tempDir.resolve("aac-processors.yaml");
        Files.writeString(configFile, """
            workspace:
              prefix: "scratch-"

            obf:
              locale: "nb_NO"

            touchchat:
              homePageName: "Start"
              actionCode: 7

            snap:
              archived: false
            """);

        ProcessorConfig config = ConfigLoader.load(configFile);

        assertThat(config.workspace().prefix()).isEqualTo("scratch-");
        assertThat(config.obf().locale()).isEqualTo("nb_NO");
        assertThat(config.obf().format()).isEqualTo("open-board-0.1");
        assertThat(config.touchChat().homePageName()).isEqualTo("Start");
        assertThat(config.touchChat().actionCode()).isEqualTo(7);
        assertThat(config.touchChat().navigateActionCode()).isEqualTo(1);
        assertThat(config.snap().archived()).isFalse();
        assertThat(config.snap().storeEntry()).isEqualTo("pageset.sps");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("aac-processors.yaml");
        Files.writeString(configFile, """
            gridset:
              jumpCommand: "Jump.Page"
              colour: "blue"
            plugins:
              - something
            """);

        ProcessorConfig config = ConfigLoader.load(configFile);

        assertThat(config.gridset().jumpCommand()).isEqualTo("Jump.Page");
        assertThat(config.gridset().speakCommand()).isEqualTo("Action.InsertText");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProcessorConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProcessorConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        ProcessorConfig config = ConfigLoader.load(null);

        assertThat(config).isEqualTo(ProcessorConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, """
            obf:
              locale: [unclosed
            """);

        ProcessorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProcessorConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        ProcessorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProcessorConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        ProcessorConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(ProcessorConfig.defaults());
    }
}
