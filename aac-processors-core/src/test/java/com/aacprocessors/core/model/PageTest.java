package com.aacprocessors.core.model;

import com.aacprocessors.core.exception.DuplicateIdException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Page}.
 */
class PageTest {

    @Test
    void constructor_withBlankName_usesId() {
        Page page = new Page("home", " ", 2, 2);

        assertThat(page.getName()).isEqualTo("home");
    }

    @Test
    void constructor_withEmptyGrid_throwsException() {
        assertThatThrownBy(() -> new Page("home", "Home", 0, 3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 1x1");
    }

    @Test
    void addButton_withFreeCell_keepsInsertionOrder() {
        Page page = new Page("home", "Home", 2, 2);

        page.addButton(Button.speak("b", "Bye", "", new GridPosition(1, 1)));
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThat(page.getButtons()).extracting(Button::getId).containsExactly("b", "a");
        assertThat(page.getButtonAt(new GridPosition(1, 1))).hasValueSatisfying(
            button -> assertThat(button.getLabel()).isEqualTo("Bye"));
    }

    @Test
    void addButton_withDuplicateId_throwsDuplicateIdException() {
        Page page = new Page("home", "Home", 2, 2);
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThatThrownBy(() -> page.addButton(Button.speak("a", "Again", "", new GridPosition(0, 1))))
            .isInstanceOf(DuplicateIdException.class)
            .hasMessageContaining("'a'");
    }

    @Test
    void addButton_outsideGrid_throwsException() {
        Page page = new Page("home", "Home", 2, 2);

        assertThatThrownBy(() -> page.addButton(Button.speak("a", "Hi", "", new GridPosition(2, 0))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("outside");
    }

    @Test
    void addButton_onOccupiedCell_throwsException() {
        Page page = new Page("home", "Home", 2, 2);
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThatThrownBy(() -> page.addButton(Button.speak("b", "Bye", "", new GridPosition(0, 0))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("collides");
        assertThat(page.getButtons()).hasSize(1);
    }

    @Test
    void firstFreePosition_scansRowMajor() {
        Page page = new Page("home", "Home", 2, 2);
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThat(page.firstFreePosition()).contains(new GridPosition(0, 1));
    }

    @Test
    void firstFreePosition_withReservedCells_skipsThem() {
        Page page = new Page("home", "Home", 2, 2);
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThat(page.firstFreePosition(Set.of(new GridPosition(0, 1)))).contains(new GridPosition(1, 0));
    }

    @Test
    void firstFreePosition_onFullGrid_returnsEmpty() {
        Page page = new Page("home", "Home", 1, 1);
        page.addButton(Button.speak("a", "Hi", "", new GridPosition(0, 0)));

        assertThat(page.firstFreePosition()).isEmpty();
    }

    @Test
    void navigateButton_keepsTarget_otherTypesDropIt() {
        Button navigate = Button.navigate("n", "Go", new GridPosition(0, 0), "food");
        Button speak = new Button("s", "Hi", null, ButtonType.SPEAK, new GridPosition(0, 1), "food");

        assertThat(navigate.getTargetPageId()).contains("food");
        assertThat(speak.getTargetPageId()).isEmpty();
        assertThat(speak.getMessage()).isEmpty();
    }
}
