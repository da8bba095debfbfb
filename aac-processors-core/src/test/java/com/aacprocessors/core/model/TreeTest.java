package com.aacprocessors.core.model;

import com.aacprocessors.core.exception.DuplicateIdException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Tree}.
 */
class TreeTest {

    @Test
    void addPage_keepsInsertionOrder() {
        Tree tree = new Tree()
            .addPage(new Page("zeta", "Zeta", 1, 1))
            .addPage(new Page("alpha", "Alpha", 1, 1));

        assertThat(tree.getPageIds()).containsExactly("zeta", "alpha");
        assertThat(tree.size()).isEqualTo(2);
    }

    @Test
    void addPage_withDuplicateId_throwsDuplicateIdException() {
        Tree tree = new Tree().addPage(new Page("home", "Home", 1, 1));

        assertThatThrownBy(() -> tree.addPage(new Page("home", "Other", 1, 1)))
            .isInstanceOf(DuplicateIdException.class)
            .satisfies(e -> assertThat(((DuplicateIdException) e).getDuplicateId()).isEqualTo("home"));
    }

    @Test
    void getRootPage_withoutRoot_fallsBackToFirstPage() {
        Tree tree = new Tree()
            .addPage(new Page("first", "First", 1, 1))
            .addPage(new Page("second", "Second", 1, 1));

        assertThat(tree.getRootId()).isEmpty();
        assertThat(tree.getRootPage()).map(Page::getId).contains("first");
    }

    @Test
    void setRootId_withExistingPage_setsRoot() {
        Tree tree = new Tree()
            .addPage(new Page("first", "First", 1, 1))
            .addPage(new Page("second", "Second", 1, 1))
            .setRootId("second");

        assertThat(tree.getRootPage()).map(Page::getId).contains("second");
    }

    @Test
    void setRootId_withUnknownPage_throwsException() {
        Tree tree = new Tree().addPage(new Page("first", "First", 1, 1));

        assertThatThrownBy(() -> tree.setRootId("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void getRootPage_onEmptyTree_returnsEmpty() {
        Tree tree = new Tree();

        assertThat(tree.isEmpty()).isTrue();
        assertThat(tree.getRootPage()).isEmpty();
    }

    @Test
    void getPages_isUnmodifiable() {
        Tree tree = new Tree().addPage(new Page("first", "First", 1, 1));

        assertThatThrownBy(() -> tree.getPages().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
