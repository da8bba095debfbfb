package com.aacprocessors.core.processor.impl.snap;

import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.ProcessorTestBase;
import com.aacprocessors.core.processor.base.ZipContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link SnapProcessor}.
 */
class SnapProcessorTest extends ProcessorTestBase {

    private SnapProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new SnapProcessor();
    }

    @Test
    void loadIntoTree_withArchivedStore_readsPagesAndButtons() throws IOException, SQLException {
        // Given
        Path pageset = createSnapFixture("sample.spb");

        // When
        Tree tree = processor.loadIntoTree(pageset);

        // Then
        assertThat(tree.getPageIds()).containsExactly("home-uid", "food-uid");
        assertThat(tree.getRootId()).contains("home-uid");

        Page home = tree.getPage("home-uid").orElseThrow();
        assertThat(home.getName()).isEqualTo("Home");
        assertThat(home.getButtons()).extracting(Button::getId).containsExactly("1", "2", "3");
        assertThat(home.getButton("1").orElseThrow().getTargetPageId()).contains("food-uid");
        assertThat(home.getButton("3")).map(Button::getType).contains(ButtonType.ACTION);

        Page food = tree.getPage("food-uid").orElseThrow();
        assertThat(food.getRows()).isEqualTo(1);
        assertThat(food.getColumns()).isEqualTo(2);
    }

    @Test
    void loadIntoTree_withSeveralLayouts_usesLowestLayout() throws IOException, SQLException {
        Tree tree = processor.loadIntoTree(createSnapFixture("sample.spb"));

        assertThat(tree.getPage("home-uid").orElseThrow().getButton("2"))
            .map(Button::getPosition).contains(new GridPosition(0, 1));
    }

    @Test
    void loadIntoTree_withBareStore_readsSameTree() throws IOException, SQLException {
        Path bare = createSqliteStore("bare.sps", concat(SNAP_SCHEMA, SNAP_DATA));

        Tree tree = processor.loadIntoTree(bare);

        assertThat(tree.getPageIds()).containsExactly("home-uid", "food-uid");
        assertThat(processor.extractTexts(bare))
            .containsExactly("Food", "Hello", "Hello there", "Clear", "Apple", "I want an apple");
    }

    @Test
    void loadIntoTree_withUnknownHomePage_warnsAndFallsBack() throws IOException, SQLException {
        String[] data = Arrays.copyOf(SNAP_DATA, SNAP_DATA.length - 1);
        Path bare = createSqliteStore("nohome.sps", concat(concat(SNAP_SCHEMA, data),
            "INSERT INTO PageSetProperties VALUES (1, 'gone')"));

        Tree tree = processor.loadIntoTree(bare);

        assertThat(tree.getRootId()).isEmpty();
        assertThat(tree.getRootPage()).map(Page::getId).contains("home-uid");
        assertThat(tree.getWarnings()).anySatisfy(warning -> assertThat(warning).contains("gone"));
    }

    @Test
    void loadIntoTree_withMalformedGridPosition_throwsSchemaException() throws IOException, SQLException {
        Path bare = createSqliteStore("malformed.sps", concat(concat(SNAP_SCHEMA, SNAP_DATA),
            "UPDATE ElementPlacement SET GridPosition = 'two,three' WHERE Id = 1"));

        assertThatThrownBy(() -> processor.loadIntoTree(bare))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("two,three");
    }

    @Test
    void parsePosition_withBlankValue_returnsNull() {
        assertThat(SnapProcessor.parsePosition(" ", "page p", "store")).isNull();
        assertThat(SnapProcessor.parsePosition("3, 4", "page p", "store")).isEqualTo(new GridPosition(3, 4));
        assertThatThrownBy(() -> SnapProcessor.parsePosition("-1,2", "page p", "store"))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void loadIntoTree_withMissingTables_throwsSchemaException() throws IOException, SQLException {
        Path bare = createSqliteStore("partial.sps", SNAP_SCHEMA[0]);

        assertThatThrownBy(() -> processor.loadIntoTree(bare))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("ButtonPageLink");
    }

    @Test
    void loadIntoTree_withTruncatedArchive_throwsFormatException() throws IOException, SQLException {
        Path truncated = truncate(createSnapFixture("sample.spb"), "truncated.spb");

        assertThatThrownBy(() -> processor.loadIntoTree(truncated)).isInstanceOf(FormatException.class);
    }

    @Test
    void processTexts_rewritesButtonsAndKeepsOtherEntries() throws IOException, SQLException {
        // Given
        Path pageset = createSnapFixture("sample.spb");
        Path output = tempDir.resolve("sample_de.spb");

        // When
        processor.processTexts(pageset, Map.of("Apple", "Apfel", "Hello there", "Hallo"), output);

        // Then
        Tree translated = processor.loadIntoTree(output);
        assertThat(translated.getPage("food-uid").orElseThrow().getButton("4"))
            .map(Button::getLabel).contains("Apfel");
        Button hello = translated.getPage("home-uid").orElseThrow().getButton("2").orElseThrow();
        assertThat(hello.getLabel()).isEqualTo("Hello");
        assertThat(hello.getMessage()).isEqualTo("Hallo");
        assertThat(ZipContainer.read(output, "test").get("readme.txt"))
            .hasValueSatisfying(content -> assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("kept"));
    }

    @Test
    void processTexts_bareStoreWithoutMatches_copiesBytes() throws IOException, SQLException {
        Path bare = createSqliteStore("bare.sps", concat(SNAP_SCHEMA, SNAP_DATA));
        Path output = tempDir.resolve("bare_es.sps");

        processor.processTexts(bare, Map.of("Nothing", "Nada"), output);

        assertThat(Files.readAllBytes(output)).isEqualTo(Files.readAllBytes(bare));
    }

    @Test
    void exportTree_withSource_keepsCommandSequences() throws IOException, SQLException {
        // Given
        Path source = createSnapFixture("sample.spb");
        Tree tree = processor.loadIntoTree(source);
        tree.getPage("home-uid").orElseThrow().getButton("2").orElseThrow().setMessage("Hi there");
        processor.setSourceFile(source);
        Path output = tempDir.resolve("exported.spb");

        // When
        processor.exportTree(tree, output);

        // Then
        Tree reloaded = processor.loadIntoTree(output);
        assertThat(reloaded.getPage("home-uid").orElseThrow().getButton("2"))
            .map(Button::getMessage).contains("Hi there");
        assertThat(reloaded.getPage("home-uid").orElseThrow().getButton("1").orElseThrow().getTargetPageId())
            .contains("food-uid");
        Path store = extractEntry(output, "pageset.sps");
        assertThat(queryColumn(store, "SELECT SerializedCommands FROM CommandSequence WHERE ButtonId = 3"))
            .containsExactly("[{\"$type\":\"ClearMessageWindowCommand\"}]");
        assertThat(queryColumn(store, "SELECT COUNT(*) FROM Button")).containsExactly("4");
    }

    @Test
    void exportTree_withReducedTree_deletesVanishedRows() throws IOException, SQLException {
        Path source = createSnapFixture("sample.spb");
        Page home = new Page("home-uid", "Home", 2, 2)
            .addButton(Button.speak("2", "Hello", "Hello there", new GridPosition(0, 1)));
        processor.setSourceFile(source);
        Path output = tempDir.resolve("reduced.spb");

        processor.exportTree(new Tree().addPage(home), output);

        Path store = extractEntry(output, "pageset.sps");
        assertThat(queryColumn(store, "SELECT COUNT(*) FROM Page")).containsExactly("1");
        assertThat(queryColumn(store, "SELECT Id FROM Button")).containsExactly("2");
        assertThat(queryColumn(store, "SELECT COUNT(*) FROM ButtonPageLink")).containsExactly("0");
        assertThat(queryColumn(store, "SELECT COUNT(*) FROM CommandSequence")).containsExactly("0");
        assertThat(queryColumn(store, "SELECT COUNT(*) FROM ElementReference")).containsExactly("1");
    }

    @Test
    void exportTree_withForeignTree_writesArchivedStore() throws IOException {
        // Given
        Page start = new Page("start", "Start", 1, 2)
            .addButton(Button.navigate("go", "More", new GridPosition(0, 0), "more"))
            .addButton(new Button("stop", "Stop", "", ButtonType.ACTION, new GridPosition(0, 1), null));
        Page more = new Page("more", "More", 1, 1)
            .addButton(Button.speak("yes", "Yes", "Yes please", new GridPosition(0, 0)));
        Tree tree = new Tree().addPage(start).addPage(more);
        Path output = tempDir.resolve("new.spb");

        // When
        processor.exportTree(tree, output);
        Tree reloaded = processor.loadIntoTree(output);

        // Then
        assertThat(ZipContainer.read(output, "test").names()).containsExactly("pageset.sps");
        assertThat(reloaded.getPageIds()).containsExactly("start", "more");
        assertThat(reloaded.getRootId()).contains("start");
        Page copy = reloaded.getPage("start").orElseThrow();
        assertThat(copy.getButtonAt(new GridPosition(0, 0)).orElseThrow().getTargetPageId()).contains("more");
        assertThat(copy.getButtonAt(new GridPosition(0, 1))).map(Button::getType).contains(ButtonType.ACTION);
        assertThat(reloaded.getPage("more").orElseThrow().getButtonAt(new GridPosition(0, 0)))
            .map(Button::getMessage).contains("Yes please");
    }

    @Test
    void exportTree_withAmbiguousButtonTypes_keepsTypes() throws IOException, SQLException {
        // Given
        Tree tree = createMixedTypeTree();
        Path output = tempDir.resolve("types.sps");

        // When
        processor.exportTree(tree, output);
        Tree reloaded = processor.loadIntoTree(output);

        // Then
        assertThat(describeRootButtons(reloaded)).containsExactlyElementsOf(MIXED_TYPE_ROOT);
        assertThat(queryColumn(output, "SELECT SerializedCommands FROM CommandSequence"))
            .containsExactlyInAnyOrder("[]", "[{\"$type\":\"SpeakMessageCommand\"}]");
        assertThat(queryColumn(output, "SELECT PageUniqueId FROM ButtonPageLink"))
            .containsExactlyInAnyOrder("", "other");
    }

    @Test
    void loadIntoTree_withMarkerAndRealCommands_readsAction() throws IOException, SQLException {
        Path store = createSqliteStore("mixed.sps", concat(SNAP_SCHEMA,
            "INSERT INTO Page VALUES (1, 'home-uid', 'Home', '1,1')",
            "INSERT INTO ElementReference VALUES (1, 1)",
            "INSERT INTO Button VALUES (1, 'Clear', '', 1)",
            "INSERT INTO ElementPlacement VALUES (1, 1, '0,0', 1)",
            "INSERT INTO CommandSequence VALUES (1, 1, '[]'), "
                + "(2, 1, '[{\"$type\":\"ClearMessageWindowCommand\"}]')"));

        Tree tree = processor.loadIntoTree(store);

        assertThat(tree.getPage("home-uid").orElseThrow().getButton("1"))
            .map(Button::getType).contains(ButtonType.ACTION);
    }

    @Test
    void exportTree_toStoreExtension_writesBareStore() throws IOException {
        Tree tree = new Tree().addPage(new Page("only", "Only", 1, 1)
            .addButton(Button.speak("hi", "Hi", "", new GridPosition(0, 0))));
        Path output = tempDir.resolve("bare.sps");

        processor.exportTree(tree, output);

        byte[] head = Arrays.copyOf(Files.readAllBytes(output), 15);
        assertThat(new String(head, StandardCharsets.US_ASCII)).isEqualTo("SQLite format 3");
        assertThat(processor.loadIntoTree(output).getPageIds()).containsExactly("only");
    }
}
