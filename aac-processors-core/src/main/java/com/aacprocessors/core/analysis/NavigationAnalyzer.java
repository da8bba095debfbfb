package com.aacprocessors.core.analysis;

import com.aacprocessors.core.analysis.NavigationAnalysis.DanglingTarget;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Analyzes the navigation graph of a tree.
 *
 * <p>Nodes are page identifiers; there is one edge per distinct (page, target) pair of a
 * NAVIGATE button whose target exists in the tree. Each page's outgoing edges are visited
 * in the insertion order of their target pages, so results depend only on the tree's
 * page order.
 *
 * <ul>
 *   <li><b>Reachable</b>: breadth-first from the root, root included.</li>
 *   <li><b>Orphaned</b>: every page outside the reachable set.</li>
 *   <li><b>Dead end</b>: a reachable page other than the root none of whose edges targets
 *       a strict ancestor on its depth-first path from the root.</li>
 *   <li><b>Cycle</b>: an edge to a page on the current depth-first path (self-loops
 *       included) closes a cycle; every page on that path segment is reported.</li>
 * </ul>
 *
 * <p>When the tree has no root set, the first inserted page is used.
 */
public class NavigationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(NavigationAnalyzer.class);

    /**
     * Runs the analysis. The tree is not modified.
     *
     * @param tree tree to analyze
     * @return findings
     */
    public NavigationAnalysis analyze(Tree tree) {
        List<String> pageOrder = tree.getPageIds();
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < pageOrder.size(); i++) {
            rank.put(pageOrder.get(i), i);
        }

        List<DanglingTarget> dangling = new ArrayList<>();
        Map<ButtonType, Integer> counts = new EnumMap<>(ButtonType.class);
        Map<String, List<String>> edges = buildEdges(tree, rank, dangling, counts);

        String rootId = tree.getRootPage().map(Page::getId).orElse(null);
        if (rootId == null) {
            return new NavigationAnalysis(0, null, List.of(), List.of(), List.of(), List.of(), dangling, counts, 0);
        }

        Map<String, Integer> depths = breadthFirst(rootId, edges);
        List<String> reachable = List.copyOf(depths.keySet());
        List<String> orphaned = pageOrder.stream()
            .filter(pageId -> !depths.containsKey(pageId))
            .toList();

        Set<String> deadEnds = new HashSet<>();
        Set<String> cycles = new HashSet<>();
        depthFirst(rootId, edges, deadEnds, cycles);

        Comparator<String> byRank = Comparator.comparing(rank::get);
        NavigationAnalysis analysis = new NavigationAnalysis(
            pageOrder.size(),
            rootId,
            reachable,
            orphaned,
            deadEnds.stream().sorted(byRank).toList(),
            cycles.stream().sorted(byRank).toList(),
            dangling,
            counts,
            depths.values().stream().mapToInt(Integer::intValue).max().orElse(0)
        );

        log.debug("Analyzed {} pages from root {}: {} orphaned, {} dead ends, {} in cycles",
            analysis.totalPages(), rootId, orphaned.size(), analysis.deadEndPages().size(),
            analysis.cyclePages().size());
        return analysis;
    }

    private Map<String, List<String>> buildEdges(Tree tree, Map<String, Integer> rank,
                                                 List<DanglingTarget> dangling,
                                                 Map<ButtonType, Integer> counts) {
        Map<String, List<String>> edges = new HashMap<>();
        for (Page page : tree.getPages()) {
            Set<String> targets = new LinkedHashSet<>();
            for (Button button : page.getButtons()) {
                counts.merge(button.getType(), 1, Integer::sum);
                if (button.getType() != ButtonType.NAVIGATE || button.getTargetPageId().isEmpty()) {
                    continue;
                }
                String target = button.getTargetPageId().get();
                if (rank.containsKey(target)) {
                    targets.add(target);
                } else {
                    dangling.add(new DanglingTarget(page.getId(), button.getId(), target));
                }
            }
            List<String> ordered = new ArrayList<>(targets);
            ordered.sort(Comparator.comparing(rank::get));
            edges.put(page.getId(), ordered);
        }
        return edges;
    }

    private Map<String, Integer> breadthFirst(String rootId, Map<String, List<String>> edges) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depths.put(rootId, 0);
        queue.add(rootId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depths.get(current) + 1;
            for (String target : edges.getOrDefault(current, List.of())) {
                if (!depths.containsKey(target)) {
                    depths.put(target, next);
                    queue.add(target);
                }
            }
        }
        return depths;
    }

    // Iterative so long navigation chains do not grow the call stack.
    private void depthFirst(String rootId, Map<String, List<String>> edges,
                            Set<String> deadEnds, Set<String> cycles) {
        List<Frame> path = new ArrayList<>();
        Map<String, Integer> pathIndex = new HashMap<>();
        Set<String> visited = new HashSet<>();

        path.add(new Frame(rootId, edges.getOrDefault(rootId, List.of())));
        pathIndex.put(rootId, 0);
        visited.add(rootId);

        while (!path.isEmpty()) {
            Frame frame = path.get(path.size() - 1);
            if (frame.hasNext()) {
                String target = frame.next();
                Integer ancestorIndex = pathIndex.get(target);
                if (ancestorIndex != null) {
                    for (int i = ancestorIndex; i < path.size(); i++) {
                        cycles.add(path.get(i).pageId);
                    }
                    if (!target.equals(frame.pageId)) {
                        frame.hasWayBack = true;
                    }
                } else if (visited.add(target)) {
                    pathIndex.put(target, path.size());
                    path.add(new Frame(target, edges.getOrDefault(target, List.of())));
                }
                continue;
            }

            path.remove(path.size() - 1);
            pathIndex.remove(frame.pageId);
            if (!frame.pageId.equals(rootId) && !frame.hasWayBack) {
                deadEnds.add(frame.pageId);
            }
        }
    }

    private static final class Frame {
        private final String pageId;
        private final List<String> targets;
        private int nextTarget;
        private boolean hasWayBack;

        private Frame(String pageId, List<String> targets) {
            this.pageId = pageId;
            this.targets = targets;
        }

        private boolean hasNext() {
            return nextTarget < targets.size();
        }

        private String next() {
            return targets.get(nextTarget++);
        }
    }
}
