package com.aacprocessors.core.translation;

import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TextSubstitution}.
 */
class TextSubstitutionTest {

    @Test
    void collect_returnsLabelThenMessageInPageOrder() {
        Tree tree = sampleTree();

        assertThat(TextSubstitution.collect(tree))
            .containsExactly("Hello", "Hello there", "Yes", "Yes", "No");
    }

    @Test
    void apply_replacesExactMatchesOnly() {
        // Given
        Tree tree = sampleTree();

        // When
        int replaced = TextSubstitution.apply(tree, Map.of("Hello", "Hola"));

        // Then
        assertThat(replaced).isEqualTo(1);
        Button hello = tree.getPage("home").orElseThrow().getButton("hello").orElseThrow();
        assertThat(hello.getLabel()).isEqualTo("Hola");
        assertThat(hello.getMessage()).isEqualTo("Hello there");
    }

    @Test
    void apply_withSwappingMap_swapsOnce() {
        Tree tree = sampleTree();

        TextSubstitution.apply(tree, Map.of("Yes", "No", "No", "Yes"));

        Page answers = tree.getPage("answers").orElseThrow();
        assertThat(answers.getButton("yes").orElseThrow().getLabel()).isEqualTo("No");
        assertThat(answers.getButton("yes").orElseThrow().getMessage()).isEqualTo("No");
        assertThat(answers.getButton("no").orElseThrow().getLabel()).isEqualTo("Yes");
    }

    @Test
    void apply_neverMatchesEmptyFields() {
        Tree tree = sampleTree();

        int replaced = TextSubstitution.apply(tree, Map.of("", "filled"));

        assertThat(replaced).isZero();
        assertThat(tree.getPage("answers").orElseThrow().getButton("blank").orElseThrow().getLabel()).isEmpty();
    }

    @Test
    void apply_isCaseSensitive() {
        Tree tree = sampleTree();

        assertThat(TextSubstitution.apply(tree, Map.of("hello", "hola"))).isZero();
    }

    @Test
    void lookup_withNullMappedValue_returnsEmpty() {
        Map<String, String> translations = new HashMap<>();
        translations.put("Hello", null);

        assertThat(TextSubstitution.lookup("Hello", translations)).isEmpty();
        assertThat(TextSubstitution.lookup(null, translations)).isEmpty();
        assertThat(TextSubstitution.lookup("Hello", null)).isEmpty();
    }

    @Test
    void translate_withUnmatchedValue_returnsValue() {
        assertThat(TextSubstitution.translate("Hello", Map.of("Bye", "Adios"))).isEqualTo("Hello");
        assertThat(TextSubstitution.translate("Bye", Map.of("Bye", "Adios"))).isEqualTo("Adios");
    }

    private static Tree sampleTree() {
        Page home = new Page("home", "Home", 1, 1)
            .addButton(Button.speak("hello", "Hello", "Hello there", new GridPosition(0, 0)));
        Page answers = new Page("answers", "Answers", 1, 3)
            .addButton(Button.speak("yes", "Yes", "Yes", new GridPosition(0, 0)))
            .addButton(Button.speak("no", "No", "", new GridPosition(0, 1)))
            .addButton(new Button("blank", "", "", ButtonType.EMPTY, new GridPosition(0, 2), null));
        return new Tree().addPage(home).addPage(answers);
    }
}
