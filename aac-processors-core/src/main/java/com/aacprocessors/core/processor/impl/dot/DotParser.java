package com.aacprocessors.core.processor.impl.dot;

import com.aacprocessors.core.exception.FormatException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the navigation graph out of a Graphviz DOT document.
 *
 * <p><b>Parsing Strategy:</b>
 * <ol>
 *   <li>Split the text into tokens with the patterns below, skipping whitespace and
 *       {@code //}, {@code /* *}{@code /} and {@code #} comments</li>
 *   <li>Require a {@code [strict] graph|digraph [name] { ... }} header</li>
 *   <li>Walk node, edge, attribute and assignment statements; subgraphs are flattened
 *       and stand for all nodes they contain when used as an edge endpoint</li>
 *   <li>Keep the {@code label} of node and edge statements together with its source offsets
 *       so it can be replaced without touching the rest of the document</li>
 * </ol>
 *
 * <p>Nodes are kept in order of first mention, as a node statement or as an edge endpoint.
 * Default attribute statements ({@code node [...]}, {@code edge [...]}) are read and ignored,
 * except for the graph's {@code root} attribute.
 */
final class DotParser {

    /**
     * Whitespace, byte order mark and comments, as one skippable run.
     */
    private static final Pattern SKIP_PATTERN = Pattern.compile(
        "(?:[\\s\\uFEFF]+|//[^\\n]*|/\\*.*?\\*/|#[^\\n]*)+", Pattern.DOTALL);

    /**
     * Bare identifier or numeral.
     */
    private static final Pattern ID_PATTERN = Pattern.compile(
        "[A-Za-z_\\u0080-\\uFFFF][A-Za-z0-9_\\u0080-\\uFFFF]*|-?(?:\\.[0-9]+|[0-9]+(?:\\.[0-9]*)?)");

    /**
     * Double-quoted string; group 1 is the raw body.
     */
    private static final Pattern STRING_PATTERN = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"", Pattern.DOTALL);

    private static final Pattern EDGE_OP_PATTERN = Pattern.compile("->|--");

    private static final String PUNCTUATION = "{}[];,=:";

    enum Kind { ID, STRING, HTML, EDGE_OP, PUNCT, EOF }

    /**
     * One lexical token.
     *
     * @param kind token class
     * @param text identifier, unescaped string or HTML body, or the operator itself
     * @param start offset of the first character
     * @param end offset just past the last character
     */
    record Token(Kind kind, String text, int start, int end) {

        boolean isPunct(String punct) {
            return kind == Kind.PUNCT && text.equals(punct);
        }

        boolean isKeyword(String keyword) {
            return kind == Kind.ID && text.equalsIgnoreCase(keyword);
        }

        boolean isValue() {
            return kind == Kind.ID || kind == Kind.STRING || kind == Kind.HTML;
        }
    }

    /**
     * One directed edge; both directions are listed for an undirected graph.
     *
     * @param label edge label, or null
     */
    record Edge(String source, String target, String label) {
    }

    /**
     * Parsed document.
     *
     * @param directed whether the graph is a {@code digraph}
     * @param root value of the graph's {@code root} attribute, or null
     * @param nodes node id to label (null when the node has none), in order of first mention
     * @param edges edges in document order
     * @param labels rewritable labels of node and edge statements in document order
     */
    record Graph(boolean directed, String root, Map<String, String> nodes, List<Edge> edges, List<Token> labels) {
    }

    private record Attribute(String name, Token value) {
    }

    private final String text;
    private final String documentName;
    private final List<Token> tokens = new ArrayList<>();
    private int cursor;

    private boolean directed;
    private String root;
    private final Map<String, String> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Token> labels = new ArrayList<>();
    private final Deque<Set<String>> openSubgraphs = new ArrayDeque<>();

    private DotParser(String text, String documentName) {
        this.text = text;
        this.documentName = documentName;
    }

    /**
     * Parses a whole document.
     *
     * @param text document text
     * @param documentName name used in error messages
     * @return parsed graph
     * @throws FormatException if the text is not a DOT graph
     */
    static Graph parse(String text, String documentName) {
        DotParser parser = new DotParser(text, documentName);
        parser.tokenize();
        return parser.graph();
    }

    /**
     * Quotes a value as a DOT string.
     */
    static String quote(String value) {
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }

    // ==================== Tokens ====================

    private void tokenize() {
        Matcher skip = SKIP_PATTERN.matcher(text);
        Matcher id = ID_PATTERN.matcher(text);
        Matcher string = STRING_PATTERN.matcher(text);
        Matcher edgeOp = EDGE_OP_PATTERN.matcher(text);
        int position = 0;
        while (position < text.length()) {
            if (lookingAt(skip, position)) {
                position = skip.end();
                continue;
            }
            char c = text.charAt(position);
            if (c == '<') {
                int end = endOfHtml(position);
                tokens.add(new Token(Kind.HTML, text.substring(position + 1, end - 1), position, end));
                position = end;
            } else if (lookingAt(string, position)) {
                tokens.add(new Token(Kind.STRING, unescape(string.group(1)), position, string.end()));
                position = string.end();
            } else if (lookingAt(edgeOp, position)) {
                tokens.add(new Token(Kind.EDGE_OP, edgeOp.group(), position, edgeOp.end()));
                position = edgeOp.end();
            } else if (lookingAt(id, position)) {
                tokens.add(new Token(Kind.ID, id.group(), position, id.end()));
                position = id.end();
            } else if (PUNCTUATION.indexOf(c) >= 0) {
                tokens.add(new Token(Kind.PUNCT, String.valueOf(c), position, position + 1));
                position++;
            } else {
                throw error("Unexpected character '" + c + "'", position);
            }
        }
        tokens.add(new Token(Kind.EOF, "", text.length(), text.length()));
    }

    private boolean lookingAt(Matcher matcher, int position) {
        matcher.region(position, text.length());
        return matcher.lookingAt();
    }

    private int endOfHtml(int start) {
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>' && --depth == 0) {
                return i + 1;
            }
        }
        throw error("Unterminated HTML string", start);
    }

    /**
     * Resolves {@code \"} and removes escaped line breaks; every other backslash is kept.
     */
    private static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder result = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                result.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            if (next == '"') {
                result.append('"');
                i += 2;
            } else if (next == '\n') {
                i += 2;
            } else if (next == '\r') {
                i += i + 2 < body.length() && body.charAt(i + 2) == '\n' ? 3 : 2;
            } else {
                result.append(c).append(next);
                i += 2;
            }
        }
        return result.toString();
    }

    private Token peek() {
        return tokens.get(cursor);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(cursor + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(cursor);
        if (token.kind() != Kind.EOF) {
            cursor++;
        }
        return token;
    }

    private Token expectPunct(String punct) {
        Token token = next();
        if (!token.isPunct(punct)) {
            throw error("Expected '" + punct + "' but found " + describe(token), token.start());
        }
        return token;
    }

    private Token expectValue() {
        Token token = next();
        if (!token.isValue()) {
            throw error("Expected an identifier but found " + describe(token), token.start());
        }
        return token;
    }

    // ==================== Statements ====================

    private Graph graph() {
        Token header = next();
        if (header.isKeyword("strict")) {
            header = next();
        }
        if (header.isKeyword("digraph")) {
            directed = true;
        } else if (!header.isKeyword("graph")) {
            throw error("Not a DOT graph: expected 'graph' or 'digraph'", header.start());
        }
        if (peek().isValue()) {
            next();
        }
        expectPunct("{");
        statements();
        expectPunct("}");
        if (peek().kind() != Kind.EOF) {
            throw error("Unexpected " + describe(peek()) + " after the graph body", peek().start());
        }
        return new Graph(directed, root, nodes, edges, labels);
    }

    private void statements() {
        while (!peek().isPunct("}")) {
            if (peek().kind() == Kind.EOF) {
                throw error("Unterminated graph body", peek().start());
            }
            statement();
            if (peek().isPunct(";") || peek().isPunct(",")) {
                next();
            }
        }
    }

    private void statement() {
        Token first = peek();
        if ((first.isKeyword("graph") || first.isKeyword("node") || first.isKeyword("edge"))
            && peek(1).isPunct("[")) {
            next();
            List<Attribute> attributes = attributes();
            if (first.isKeyword("graph")) {
                find(attributes, "root").ifPresent(value -> root = value.text());
            }
            return;
        }
        if (first.isKeyword("subgraph") || first.isPunct("{")) {
            Set<String> members = subgraph();
            if (peek().kind() == Kind.EDGE_OP) {
                edges(members);
            }
            return;
        }
        if (!first.isValue()) {
            throw error("Unexpected " + describe(first), first.start());
        }
        if (peek(1).isPunct("=")) {
            Token name = next();
            next();
            Token value = expectValue();
            if (name.text().equals("root")) {
                root = value.text();
            }
            return;
        }
        String nodeId = nodeReference();
        if (peek().kind() == Kind.EDGE_OP) {
            edges(Set.of(nodeId));
            return;
        }
        Optional<Token> label = find(attributes(), "label");
        if (label.isPresent()) {
            nodes.put(nodeId, label.get().text());
            rememberLabel(label.get());
        }
    }

    /**
     * Reads an edge chain after its first endpoint, e.g. {@code -> b -> {c d} [label=x]}.
     */
    private void edges(Set<String> firstEndpoint) {
        List<Set<String>> endpoints = new ArrayList<>();
        endpoints.add(firstEndpoint);
        while (peek().kind() == Kind.EDGE_OP) {
            Token operator = next();
            if (!operator.text().equals(directed ? "->" : "--")) {
                throw error("Edge operator '" + operator.text() + "' used in a "
                    + (directed ? "digraph" : "graph"), operator.start());
            }
            if (peek().isKeyword("subgraph") || peek().isPunct("{")) {
                endpoints.add(subgraph());
            } else {
                endpoints.add(Set.of(nodeReference()));
            }
        }
        Optional<Token> label = find(attributes(), "label");
        label.ifPresent(this::rememberLabel);
        String labelText = label.map(Token::text).orElse(null);
        for (int i = 0; i + 1 < endpoints.size(); i++) {
            for (String source : endpoints.get(i)) {
                for (String target : endpoints.get(i + 1)) {
                    edges.add(new Edge(source, target, labelText));
                    if (!directed && !source.equals(target)) {
                        edges.add(new Edge(target, source, labelText));
                    }
                }
            }
        }
    }

    /**
     * Reads {@code [subgraph [name]] { ... }} and returns the nodes mentioned inside.
     */
    private Set<String> subgraph() {
        if (peek().isKeyword("subgraph")) {
            next();
            if (peek().isValue()) {
                next();
            }
        }
        expectPunct("{");
        Set<String> members = new LinkedHashSet<>();
        openSubgraphs.push(members);
        try {
            statements();
        } finally {
            openSubgraphs.pop();
        }
        expectPunct("}");
        return members;
    }

    /**
     * Reads {@code id [: port [: compass]]} and declares the node.
     */
    private String nodeReference() {
        Token id = expectValue();
        if (peek().isPunct(":")) {
            next();
            expectValue();
            if (peek().isPunct(":")) {
                next();
                expectValue();
            }
        }
        String nodeId = id.text();
        nodes.putIfAbsent(nodeId, null);
        for (Set<String> members : openSubgraphs) {
            members.add(nodeId);
        }
        return nodeId;
    }

    private List<Attribute> attributes() {
        List<Attribute> attributes = new ArrayList<>();
        while (peek().isPunct("[")) {
            next();
            while (!peek().isPunct("]")) {
                Token name = expectValue();
                expectPunct("=");
                attributes.add(new Attribute(name.text(), expectValue()));
                if (peek().isPunct(";") || peek().isPunct(",")) {
                    next();
                }
            }
            expectPunct("]");
        }
        return attributes;
    }

    private static Optional<Token> find(List<Attribute> attributes, String name) {
        Token found = null;
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                found = attribute.value();
            }
        }
        return Optional.ofNullable(found);
    }

    private void rememberLabel(Token label) {
        if (label.kind() != Kind.HTML) {
            labels.add(label);
        }
    }

    // ==================== Errors ====================

    private static String describe(Token token) {
        return token.kind() == Kind.EOF ? "end of file" : "'" + token.text() + "'";
    }

    private FormatException error(String message, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return new FormatException(message + " at line " + line + " of " + documentName);
    }
}
