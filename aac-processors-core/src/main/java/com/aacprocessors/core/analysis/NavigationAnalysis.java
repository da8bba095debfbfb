package com.aacprocessors.core.analysis;

import com.aacprocessors.core.model.ButtonType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Findings of a navigation analysis.
 *
 * <p>None of these findings are errors: authored pagesets routinely contain pages that
 * cannot be reached, dead ends and loops. All page lists except {@code reachablePages}
 * follow the tree's page insertion order.
 *
 * @param totalPages number of pages in the tree
 * @param rootId page the traversal started from (null for an empty tree)
 * @param reachablePages pages reachable from the root, in breadth-first order
 * @param orphanedPages pages not reachable from the root
 * @param deadEndPages reachable pages with no edge back to a page on their path from the root
 * @param cyclePages pages on at least one cycle closed by a back-edge
 * @param danglingTargets navigation buttons whose target page is not in the tree
 * @param buttonCounts number of buttons per type over the whole tree
 * @param maxDepth largest breadth-first distance from the root
 */
public record NavigationAnalysis(
    int totalPages,
    String rootId,
    List<String> reachablePages,
    List<String> orphanedPages,
    List<String> deadEndPages,
    List<String> cyclePages,
    List<DanglingTarget> danglingTargets,
    Map<ButtonType, Integer> buttonCounts,
    int maxDepth
) {
    /**
     * Compact constructor with defensive copies.
     */
    public NavigationAnalysis {
        reachablePages = reachablePages == null ? List.of() : List.copyOf(reachablePages);
        orphanedPages = orphanedPages == null ? List.of() : List.copyOf(orphanedPages);
        deadEndPages = deadEndPages == null ? List.of() : List.copyOf(deadEndPages);
        cyclePages = cyclePages == null ? List.of() : List.copyOf(cyclePages);
        danglingTargets = danglingTargets == null ? List.of() : List.copyOf(danglingTargets);
        Map<ButtonType, Integer> counts = new EnumMap<>(ButtonType.class);
        for (ButtonType type : ButtonType.values()) {
            counts.put(type, buttonCounts == null ? 0 : buttonCounts.getOrDefault(type, 0));
        }
        buttonCounts = Map.copyOf(counts);
    }

    public boolean isReachable(String pageId) {
        return reachablePages.contains(pageId);
    }

    public boolean hasCycles() {
        return !cyclePages.isEmpty();
    }

    /**
     * Returns the number of buttons of one type.
     */
    public int countOf(ButtonType type) {
        return buttonCounts.getOrDefault(type, 0);
    }

    /**
     * A navigation button pointing at a page the tree does not contain.
     *
     * @param pageId page holding the button
     * @param buttonId button identifier
     * @param targetPageId missing target
     */
    public record DanglingTarget(String pageId, String buttonId, String targetPageId) {
        public DanglingTarget {
            Objects.requireNonNull(pageId, "pageId must not be null");
            Objects.requireNonNull(buttonId, "buttonId must not be null");
            Objects.requireNonNull(targetPageId, "targetPageId must not be null");
        }
    }
}
