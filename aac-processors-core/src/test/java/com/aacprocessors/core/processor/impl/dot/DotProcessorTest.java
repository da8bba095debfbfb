package com.aacprocessors.core.processor.impl.dot;

import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.ProcessorTestBase;
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
 * Functional tests for {@link DotProcessor}.
 */
class DotProcessorTest extends ProcessorTestBase {

    private static final String MENU_GRAPH = """
        // Home screen navigation
        digraph menu {
            node [shape=box];
            home [label=Home];
            food [label="Food"];
            drinks;

            home -> food [label="I'm hungry"];
            home -> drinks;
            food -> home; /* back to the start */
        }
        """;

    private DotProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DotProcessor();
    }

    @Test
    void getSupportedExtensions_coversDotAndGv() {
        assertThat(processor.getSupportedExtensions()).containsExactlyInAnyOrder("dot", "gv");
        assertThat(processor.canProcess(Path.of("menu.GV"))).isTrue();
    }

    @Test
    void loadIntoTree_buildsPagesFromNodesAndButtonsFromEdges() throws IOException {
        // Given
        Path dot = createFile("menu.dot", MENU_GRAPH);

        // When
        Tree tree = processor.loadIntoTree(dot);

        // Then
        assertThat(tree.getPageIds()).containsExactly("home", "food", "drinks");
        assertThat(tree.getRootPage()).map(Page::getId).contains("home");
        assertThat(tree.getPage("drinks")).map(Page::getName).contains("drinks");

        Page home = tree.getPage("home").orElseThrow();
        assertThat(home.getName()).isEqualTo("Home");
        assertThat(home.getRows()).isEqualTo(2);
        assertThat(home.getColumns()).isEqualTo(1);

        Button hungry = home.getButton("button_home_food").orElseThrow();
        assertThat(hungry.getType()).isEqualTo(ButtonType.NAVIGATE);
        assertThat(hungry.getLabel()).isEqualTo("I'm hungry");
        assertThat(hungry.getTargetPageId()).contains("food");
        assertThat(hungry.getPosition()).isEqualTo(new GridPosition(0, 0));

        Button drinks = home.getButton("button_home_drinks").orElseThrow();
        assertThat(drinks.getLabel()).isEqualTo("Go to drinks");
        assertThat(drinks.getPosition()).isEqualTo(new GridPosition(1, 0));

        assertThat(tree.getPage("food").orElseThrow().getButton("button_food_home").orElseThrow().getLabel())
            .isEqualTo("Go to Home");
        assertThat(tree.getPage("drinks").orElseThrow().getButtons()).isEmpty();
    }

    @Test
    void loadIntoTree_withUndirectedGraph_linksBothWays() throws IOException {
        Path dot = createFile("pair.gv", "graph { a -- b [label=\"Swap\"] }");

        Tree tree = processor.loadIntoTree(dot);

        assertThat(tree.getPage("a").orElseThrow().getButtons())
            .extracting(Button::getLabel, button -> button.getTargetPageId().orElse(null))
            .containsExactly(tuple("Swap", "b"));
        assertThat(tree.getPage("b").orElseThrow().getButtons())
            .extracting(Button::getLabel, button -> button.getTargetPageId().orElse(null))
            .containsExactly(tuple("Swap", "a"));
    }

    @Test
    void loadIntoTree_withQuotedIdsAndRootAttribute_usesRoot() throws IOException {
        Path dot = createFile("quoted.dot", """
            strict digraph "Main" {
                root="Main menu";
                "Start" -> "Main menu";
                "Main menu" -> "Start" [label="Back \\"home\\""];
            }
            """);

        Tree tree = processor.loadIntoTree(dot);

        assertThat(tree.getRootId()).contains("Main menu");
        assertThat(tree.getPage("Main menu").orElseThrow().getButtons())
            .extracting(Button::getLabel)
            .containsExactly("Back \"home\"");
        assertThat(tree.getWarnings()).isEmpty();
    }

    @Test
    void loadIntoTree_withUnknownRoot_warnsAndKeepsFirstNode() throws IOException {
        Path dot = createFile("root.dot", "digraph { graph [root=missing]; a -> b; }");

        Tree tree = processor.loadIntoTree(dot);

        assertThat(tree.getRootPage()).map(Page::getId).contains("a");
        assertThat(tree.getWarnings()).hasSize(1);
        assertThat(tree.getWarnings().get(0)).contains("missing");
    }

    @Test
    void loadIntoTree_withSubgraphEndpointAndRepeatedEdge_addsOneButtonPerEdge() throws IOException {
        Path dot = createFile("fan.dot", """
            digraph {
                a -> { b c };
                subgraph cluster_x { d; }
                a -> b;
                a:n -> d:s;
            }
            """);

        Tree tree = processor.loadIntoTree(dot);

        assertThat(tree.getPageIds()).containsExactly("a", "b", "c", "d");
        assertThat(tree.getPage("a").orElseThrow().getButtons())
            .extracting(Button::getId)
            .containsExactly("button_a_b", "button_a_c", "button_a_b_2", "button_a_d");
    }

    @Test
    void loadIntoTree_withoutGraphHeader_throwsFormatException() throws IOException {
        Path dot = createFile("notes.dot", "hello world");

        assertThatThrownBy(() -> processor.loadIntoTree(dot))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("Not a DOT graph")
            .hasMessageContaining("notes.dot");
    }

    @Test
    void loadIntoTree_withUnterminatedBody_throwsFormatException() throws IOException {
        Path dot = createFile("cut.dot", "digraph {\n  a -> b;\n");

        assertThatThrownBy(() -> processor.loadIntoTree(dot))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("Unterminated graph body");
    }

    @Test
    void loadIntoTree_withUndirectedOperatorInDigraph_throwsFormatException() throws IOException {
        Path dot = createFile("mixed.dot", "digraph {\n  a -- b;\n}");

        assertThatThrownBy(() -> processor.loadIntoTree(dot))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("line 2");
    }

    @Test
    void exportTree_writesPagesAndTargetedNavigation() throws IOException {
        // Given
        Tree tree = createMixedTypeTree();
        Path output = tempDir.resolve("out/mixed.dot");

        // When
        processor.exportTree(tree, output);

        // Then
        String written = Files.readString(output);
        assertThat(written)
            .startsWith("digraph pageset {\n")
            .contains("root=\"root\";")
            .contains("\"root\" [label=\"Root\"];")
            .contains("\"root\" -> \"other\" [label=\"Other\"];")
            .doesNotContain("Nowhere", "Note");

        Tree reloaded = processor.loadIntoTree(output);
        assertThat(reloaded.getPageIds()).containsExactly("root", "other");
        assertThat(describeRootButtons(reloaded)).containsExactly("NAVIGATE(Other)->Other");
    }

    @Test
    void exportTree_escapesQuotesInNames() throws IOException {
        Page quoted = new Page("say", "Say \"hi\"", 1, 1)
            .addButton(Button.navigate("self", "Again", new GridPosition(0, 0), "say"));
        Path output = tempDir.resolve("quoted.gv");

        processor.exportTree(new Tree().addPage(quoted), output);

        assertThat(Files.readString(output)).contains("\"say\" [label=\"Say \\\"hi\\\"\"];");
        assertThat(processor.loadIntoTree(output).getPage("say")).map(Page::getName).contains("Say \"hi\"");
    }

    @Test
    void extractTexts_returnsNodeAndEdgeLabelsInDocumentOrder() throws IOException {
        Path dot = createFile("menu.dot", MENU_GRAPH);

        List<String> texts = processor.extractTexts(dot);

        assertThat(texts).containsExactly("Home", "Food", "I'm hungry");
    }

    @Test
    void processTexts_replacesLabelsAndKeepsEverythingElse() throws IOException {
        // Given
        Path dot = createFile("menu.dot", MENU_GRAPH);
        Path output = tempDir.resolve("menu_fr.dot");

        // When
        processor.processTexts(dot, Map.of("Home", "Accueil", "I'm hungry", "J'ai \"faim\""), output);

        // Then
        String expected = MENU_GRAPH
            .replace("[label=Home]", "[label=\"Accueil\"]")
            .replace("[label=\"I'm hungry\"]", "[label=\"J'ai \\\"faim\\\"\"]");
        assertThat(Files.readString(output)).isEqualTo(expected);
        assertThat(processor.extractTexts(output)).containsExactly("Accueil", "Food", "J'ai \"faim\"");
    }

    @Test
    void processTexts_withoutMatches_copiesFileUnchanged() throws IOException {
        Path dot = createFile("menu.dot", MENU_GRAPH);
        Path output = tempDir.resolve("menu_de.dot");

        processor.processTexts(dot, Map.of("drinks", "Getränke"), output);

        assertThat(Files.readAllBytes(output)).isEqualTo(MENU_GRAPH.getBytes(StandardCharsets.UTF_8));
    }
}
