package com.aacprocessors.core.processor.impl.obf;

import com.aacprocessors.core.analysis.NavigationAnalysis;
import com.aacprocessors.core.analysis.NavigationAnalyzer;
import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.ProcessorTestBase;
import com.aacprocessors.core.processor.base.ZipContainer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link ObfProcessor}.
 */
class ObfProcessorTest extends ProcessorTestBase {

    private final ObjectMapper mapper = new ObjectMapper();
    private ObfProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ObfProcessor();
    }

    @Test
    void getSupportedExtensions_coversBoardAndArchive() {
        assertThat(processor.getSupportedExtensions()).containsExactlyInAnyOrder("obf", "obz");
    }

    @Test
    void loadIntoTree_withArchive_buildsBoardsAndRoot() throws IOException {
        // Given
        Path obz = createObzFixture("sample.obz");

        // When
        Tree tree = processor.loadIntoTree(obz);

        // Then
        assertThat(tree.getPageIds()).containsExactly("start", "family");
        assertThat(tree.getRootId()).contains("start");
        assertThat(tree.getWarnings()).isEmpty();

        Page start = tree.getPage("start").orElseThrow();
        assertThat(start.getButton("1").orElseThrow().getTargetPageId()).contains("family");
        assertThat(start.getButton("2").orElseThrow().getMessage()).isEqualTo("Hello there");
        assertThat(start.getButton("3")).map(Button::getType).contains(ButtonType.ACTION);
        assertThat(start.getButton("4")).map(Button::getType).contains(ButtonType.EMPTY);
        assertThat(start.getButton("4")).map(Button::getPosition).contains(new GridPosition(1, 1));
    }

    @Test
    void loadIntoTree_withPathOnlyLink_resolvesThroughManifest() throws IOException {
        Tree tree = processor.loadIntoTree(createObzFixture("sample.obz"));

        Button back = tree.getPage("family").orElseThrow().getButton("back").orElseThrow();

        assertThat(back.getType()).isEqualTo(ButtonType.NAVIGATE);
        assertThat(back.getTargetPageId()).contains("start");
    }

    @Test
    void loadIntoTree_analysis_findsCycleBetweenBoards() throws IOException {
        Tree tree = processor.loadIntoTree(createObzFixture("sample.obz"));

        NavigationAnalysis analysis = new NavigationAnalyzer().analyze(tree);

        assertThat(analysis.cyclePages()).containsExactly("start", "family");
        assertThat(analysis.deadEndPages()).isEmpty();
        assertThat(analysis.orphanedPages()).isEmpty();
    }

    @Test
    void loadIntoTree_withSingleBoard_usesItAsRoot() throws IOException {
        Path obf = createFile("start.obf", START_BOARD);

        Tree tree = processor.loadIntoTree(obf);

        assertThat(tree.getPageIds()).containsExactly("start");
        assertThat(tree.getRootId()).contains("start");
        assertThat(tree.getPage("start").orElseThrow().getName()).isEqualTo("Start");
    }

    @Test
    void loadIntoTree_withUnplacedButton_placesItWithWarning() throws IOException {
        Path obf = createFile("loose.obf", """
            {"id": "b", "buttons": [{"id": "x", "label": "X"}, {"id": "y", "label": "Y"}],
             "grid": {"rows": 1, "columns": 2, "order": [[null, "x"]]}}
            """);

        Tree tree = processor.loadIntoTree(obf);

        Page page = tree.getPage("b").orElseThrow();
        assertThat(page.getButton("x")).map(Button::getPosition).contains(new GridPosition(0, 1));
        assertThat(page.getButton("y")).map(Button::getPosition).contains(new GridPosition(0, 0));
        assertThat(tree.getWarnings()).singleElement().asString().contains("'y'");
    }

    @Test
    void loadIntoTree_withoutManifest_throwsSchemaException() throws IOException {
        Path obz = createZip("nomanifest.obz", Map.of("boards/start.obf", START_BOARD));

        assertThatThrownBy(() -> processor.loadIntoTree(obz))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("manifest.json");
    }

    @Test
    void loadIntoTree_withBoardMissingGrid_throwsSchemaException() throws IOException {
        Path obf = createFile("nogrid.obf", "{\"id\": \"b\", \"buttons\": []}");

        assertThatThrownBy(() -> processor.loadIntoTree(obf))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("grid");
    }

    @Test
    void loadIntoTree_withMalformedJson_throwsFormatException() throws IOException {
        Path obf = createFile("broken.obf", "{\"id\": ");

        assertThatThrownBy(() -> processor.loadIntoTree(obf)).isInstanceOf(FormatException.class);
    }

    @Test
    void loadIntoTree_withTruncatedArchive_throwsFormatException() throws IOException {
        Path truncated = truncate(createObzFixture("sample.obz"), "truncated.obz");

        assertThatThrownBy(() -> processor.loadIntoTree(truncated)).isInstanceOf(FormatException.class);
    }

    @Test
    void processTexts_rewritesLabelsAndKeepsUnknownFields() throws IOException {
        // Given
        Path obz = createObzFixture("sample.obz");
        Path output = tempDir.resolve("sample_fr.obz");

        // When
        processor.processTexts(obz, Map.of("Hello", "Bonjour", "Mum", "Maman"), output);

        // Then
        ZipContainer before = ZipContainer.read(obz, "test");
        ZipContainer after = ZipContainer.read(output, "test");
        JsonNode start = mapper.readTree(after.get("boards/start.obf").orElseThrow());
        JsonNode hello = start.path("buttons").get(1);
        assertThat(hello.path("label").asText()).isEqualTo("Bonjour");
        assertThat(hello.path("vocalization").asText()).isEqualTo("Hello there");
        assertThat(hello.path("background_color").asText()).isEqualTo("rgb(1, 2, 3)");
        assertThat(start.path("ext_custom").asText()).isEqualTo("keep me");
        assertThat(after.get("manifest.json").orElseThrow()).isEqualTo(before.get("manifest.json").orElseThrow());
        assertThat(after.get("images/logo.png").orElseThrow()).isEqualTo(before.get("images/logo.png").orElseThrow());
        assertThat(new String(after.get("boards/start.obf").orElseThrow(), StandardCharsets.UTF_8))
            .isEqualTo(START_BOARD.replace("\"label\": \"Hello\"", "\"label\": \"Bonjour\""));
        assertThat(new String(after.get("boards/family.obf").orElseThrow(), StandardCharsets.UTF_8))
            .isEqualTo(new String(before.get("boards/family.obf").orElseThrow(), StandardCharsets.UTF_8)
                .replace("\"label\": \"Mum\"", "\"label\": \"Maman\""));
    }

    @Test
    void processTexts_singleBoard_keepsFormattingAroundReplacement() throws IOException {
        Path obf = createFile("start.obf", START_BOARD);
        Path output = tempDir.resolve("start_fr.obf");

        processor.processTexts(obf, Map.of("Hello there", "Bonjour \"toi\""), output);

        assertThat(Files.readString(output)).isEqualTo(START_BOARD.replace(
            "\"vocalization\": \"Hello there\"", "\"vocalization\": \"Bonjour \\\"toi\\\"\""));
    }

    @Test
    void processTexts_ignoresTextsOutsideButtons() throws IOException {
        Path obf = createFile("start.obf", START_BOARD);
        Path output = tempDir.resolve("start_x.obf");

        processor.processTexts(obf, Map.of("Start", "Debut", "keep me", "changed"), output);

        assertThat(Files.readAllBytes(output)).isEqualTo(Files.readAllBytes(obf));
    }

    @Test
    void extractTexts_skipsEmptyButton() throws IOException {
        Path obf = createFile("start.obf", START_BOARD);

        List<String> texts = processor.extractTexts(obf);

        assertThat(texts).containsExactly("Family", "Hello", "Hello there", "Clear");
    }

    @Test
    void processTexts_singleBoardWithoutMatches_copiesBytes() throws IOException {
        Path obf = createFile("start.obf", START_BOARD);
        Path output = tempDir.resolve("start_es.obf");

        processor.processTexts(obf, Map.of("Nothing", "Nada"), output);

        assertThat(Files.readAllBytes(output)).isEqualTo(Files.readAllBytes(obf));
    }

    @Test
    void exportTree_withSource_preservesVendorFieldsAndAssets() throws IOException {
        // Given
        Path source = createObzFixture("sample.obz");
        Tree tree = processor.loadIntoTree(source);
        tree.getPage("start").orElseThrow().getButton("2").orElseThrow().setLabel("Hi");
        processor.setSourceFile(source);
        Path output = tempDir.resolve("exported.obz");

        // When
        processor.exportTree(tree, output);

        // Then
        ZipContainer archive = ZipContainer.read(output, "test");
        assertThat(archive.get("images/logo.png")).isPresent();
        JsonNode start = mapper.readTree(archive.get("boards/start.obf").orElseThrow());
        assertThat(start.path("ext_custom").asText()).isEqualTo("keep me");
        assertThat(start.path("buttons").get(1).path("label").asText()).isEqualTo("Hi");
        assertThat(start.path("buttons").get(1).path("background_color").asText()).isEqualTo("rgb(1, 2, 3)");
        JsonNode manifest = mapper.readTree(archive.get("manifest.json").orElseThrow());
        assertThat(manifest.path("root").asText()).isEqualTo("boards/start.obf");
        assertThat(manifest.path("paths").path("images").path("logo").asText()).isEqualTo("images/logo.png");
    }

    @Test
    void exportTree_withoutSource_roundTripsTree() throws IOException {
        Tree tree = processor.loadIntoTree(createObzFixture("sample.obz"));
        Path output = tempDir.resolve("fresh.obz");

        processor.exportTree(tree, output);
        Tree reloaded = processor.loadIntoTree(output);

        assertThat(reloaded.getPageIds()).containsExactly("start", "family");
        assertThat(reloaded.getRootId()).contains("start");
        for (Page page : tree.getPages()) {
            Page copy = reloaded.getPage(page.getId()).orElseThrow();
            assertThat(copy.getButtons())
                .extracting(Button::getId, Button::getType, Button::getPosition, Button::getTargetPageId)
                .containsExactlyElementsOf(page.getButtons().stream()
                    .map(b -> tuple(b.getId(), b.getType(), b.getPosition(), b.getTargetPageId()))
                    .toList());
        }
        JsonNode board = mapper.readTree(ZipContainer.read(output, "test").get("boards/start.obf").orElseThrow());
        assertThat(board.path("format").asText()).isEqualTo("open-board-0.1");
        assertThat(board.path("grid").path("order").get(1).get(1).asText()).isEqualTo("4");
    }

    @Test
    void exportTree_withAmbiguousButtonTypes_keepsTypes() throws IOException {
        // Given
        Tree tree = createMixedTypeTree();
        Path output = tempDir.resolve("types.obz");

        // When
        processor.exportTree(tree, output);
        Tree reloaded = processor.loadIntoTree(output);

        // Then
        assertThat(describeRootButtons(reloaded)).containsExactlyElementsOf(MIXED_TYPE_ROOT);
        JsonNode board = mapper.readTree(ZipContainer.read(output, "test").get("boards/root.obf").orElseThrow());
        assertThat(board.path("buttons").get(0).path("ext_aacprocessors_type").asText()).isEqualTo("empty");
        assertThat(board.path("buttons").get(1).path("ext_aacprocessors_type").asText()).isEqualTo("speak");
        assertThat(board.path("buttons").get(3).has("ext_aacprocessors_type")).isFalse();
    }

    @Test
    void exportTree_toSingleBoard_writesRootOnly() throws IOException {
        Tree tree = processor.loadIntoTree(createObzFixture("sample.obz"));
        Path output = tempDir.resolve("root.obf");

        processor.exportTree(tree, output);
        Tree reloaded = processor.loadIntoTree(output);

        assertThat(reloaded.getPageIds()).containsExactly("start");
        assertThat(reloaded.getPage("start").orElseThrow().getButton("1").orElseThrow().getTargetPageId())
            .contains("family");
    }

    @Test
    void exportTree_withEmptyTreeToSingleBoard_throwsException() {
        Path output = tempDir.resolve("empty.obf");

        assertThatThrownBy(() -> processor.exportTree(new Tree(), output))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(output).doesNotExist();
    }
}
