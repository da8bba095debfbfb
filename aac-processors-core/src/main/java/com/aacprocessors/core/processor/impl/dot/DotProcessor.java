package com.aacprocessors.core.processor.impl.dot;

import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.base.AbstractProcessor;
import com.aacprocessors.core.processor.impl.dot.DotParser.Edge;
import com.aacprocessors.core.processor.impl.dot.DotParser.Graph;
import com.aacprocessors.core.processor.impl.dot.DotParser.Token;
import com.aacprocessors.core.translation.TextSubstitution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Processor for navigation graphs written in Graphviz DOT ({@code .dot}, {@code .gv}).
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>Node: page; its {@code label} is the page name, otherwise the node id</li>
 *   <li>Edge {@code a -> b}: NAVIGATE button on {@code a} targeting {@code b}, labelled with the
 *       edge {@code label} or "Go to <i>b</i>"; an undirected {@code a -- b} adds both directions</li>
 *   <li>Graph attribute {@code root}: root page, otherwise the first node</li>
 *   <li>Each page is one column with a row per outgoing edge</li>
 * </ul>
 *
 * <p>DOT holds only the navigation structure. Writing keeps pages, their names and
 * NAVIGATE buttons that have a target; every other button is dropped with a warning.
 * Translating rewrites node and edge labels in place and copies the rest of the file unchanged.
 *
 * @since 1.0.0
 */
public class DotProcessor extends AbstractProcessor {

    private static final String PROCESSOR_ID = "dot";
    private static final String INDENT = "    ";

    @Override
    public String getId() {
        return PROCESSOR_ID;
    }

    @Override
    public String getDisplayName() {
        return "DOT Graph";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("dot", "gv");
    }

    // ==================== Loading ====================

    @Override
    public Tree loadIntoTree(Path file) throws IOException {
        Graph graph = read(file);
        Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
        for (String nodeId : graph.nodes().keySet()) {
            outgoing.put(nodeId, new ArrayList<>());
        }
        for (Edge edge : graph.edges()) {
            outgoing.get(edge.source()).add(edge);
        }

        Tree tree = new Tree();
        for (Map.Entry<String, List<Edge>> node : outgoing.entrySet()) {
            tree.addPage(buildPage(node.getKey(), graph, node.getValue()));
        }
        if (graph.root() != null) {
            if (tree.containsPage(graph.root())) {
                tree.setRootId(graph.root());
            } else {
                String warning = "Graph root '" + graph.root() + "' is not a node; using the first node";
                log.warn(warning);
                tree.addWarning(warning);
            }
        }
        log.info("Loaded {} pages and {} edges from {}", tree.size(), graph.edges().size(), file);
        return tree;
    }

    private Page buildPage(String nodeId, Graph graph, List<Edge> edges) {
        Page page = new Page(nodeId, graph.nodes().get(nodeId), Math.max(1, edges.size()), 1);
        Set<String> buttonIds = new HashSet<>();
        for (int row = 0; row < edges.size(); row++) {
            Edge edge = edges.get(row);
            String label = edge.label() == null || edge.label().isEmpty()
                ? "Go to " + pageName(graph, edge.target())
                : edge.label();
            String buttonId = uniqueId("button_" + edge.source() + "_" + edge.target(), buttonIds);
            page.addButton(Button.navigate(buttonId, label, new GridPosition(row, 0), edge.target()));
        }
        return page;
    }

    private static String pageName(Graph graph, String nodeId) {
        String label = graph.nodes().get(nodeId);
        return label == null || label.isBlank() ? nodeId : label;
    }

    private static String uniqueId(String base, Set<String> taken) {
        String id = base;
        for (int suffix = 2; !taken.add(id); suffix++) {
            id = base + "_" + suffix;
        }
        return id;
    }

    private Graph read(Path file) throws IOException {
        requireReadable(file);
        return DotParser.parse(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString());
    }

    // ==================== Writing ====================

    @Override
    public void exportTree(Tree tree, Path output) throws IOException {
        String document = toDot(tree);
        writeAtomically(output, target -> Files.writeString(target, document, StandardCharsets.UTF_8));
        log.info("Wrote {} pages to {}", tree.size(), output);
    }

    String toDot(Tree tree) {
        StringBuilder dot = new StringBuilder("digraph pageset {\n");
        tree.getRootId().ifPresent(root -> dot.append(INDENT).append("root=").append(DotParser.quote(root)).append(";\n"));
        for (Page page : tree.getPages()) {
            dot.append(INDENT).append(DotParser.quote(page.getId()))
                .append(" [label=").append(DotParser.quote(page.getName())).append("];\n");
        }

        int dropped = 0;
        StringBuilder edges = new StringBuilder();
        for (Page page : tree.getPages()) {
            for (Button button : page.getButtons()) {
                Optional<String> target = button.getTargetPageId();
                if (button.getType() != ButtonType.NAVIGATE || target.isEmpty()) {
                    dropped++;
                    continue;
                }
                edges.append(INDENT).append(DotParser.quote(page.getId()))
                    .append(" -> ").append(DotParser.quote(target.get()));
                if (!button.getLabel().isEmpty()) {
                    edges.append(" [label=").append(DotParser.quote(button.getLabel())).append(']');
                }
                edges.append(";\n");
            }
        }
        if (edges.length() > 0) {
            dot.append('\n').append(edges);
        }
        if (dropped > 0) {
            log.warn("{} buttons without a navigation target cannot be written to DOT and were dropped", dropped);
        }
        return dot.append("}\n").toString();
    }

    // ==================== Text Operations ====================

    /**
     * Returns the non-empty node and edge labels in document order.
     */
    @Override
    public List<String> extractTexts(Path file) throws IOException {
        List<String> texts = new ArrayList<>();
        for (Token label : read(file).labels()) {
            if (!label.text().isEmpty()) {
                texts.add(label.text());
            }
        }
        log.debug("Extracted {} texts from {}", texts.size(), file);
        return texts;
    }

    @Override
    protected void rewriteTexts(Path file, Map<String, String> translations, Path target) throws IOException {
        String document = Files.readString(file, StandardCharsets.UTF_8);
        Graph graph = DotParser.parse(document, file.getFileName().toString());

        StringBuilder rewritten = new StringBuilder(document.length());
        int copied = 0;
        int replacements = 0;
        for (Token label : graph.labels()) {
            Optional<String> replacement = TextSubstitution.lookup(label.text(), translations);
            if (replacement.isEmpty()) {
                continue;
            }
            rewritten.append(document, copied, label.start()).append(DotParser.quote(replacement.get()));
            copied = label.end();
            replacements++;
        }

        if (replacements == 0) {
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        rewritten.append(document, copied, document.length());
        Files.writeString(target, rewritten, StandardCharsets.UTF_8);
        log.debug("Replaced {} labels in {}", replacements, file);
    }
}
