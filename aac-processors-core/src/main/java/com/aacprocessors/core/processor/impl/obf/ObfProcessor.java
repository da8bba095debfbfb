package com.aacprocessors.core.processor.impl.obf;

import com.aacprocessors.core.config.ProcessorConfig.ObfDefaults;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.base.AbstractDocumentArchiveProcessor;
import com.aacprocessors.core.processor.base.ZipContainer;
import com.aacprocessors.core.translation.TextSubstitution;
import com.aacprocessors.core.util.FileUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Processor for Open Board Format boards ({@code .obf}) and board sets ({@code .obz}).
 *
 * <p>An {@code .obf} file is a single JSON board. An {@code .obz} file is a zip archive
 * whose {@code manifest.json} names the root board and maps board ids to archive paths;
 * images and sounds referenced by the manifest are carried through unchanged.
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>Board {@code id}/{@code name}: page id/name; {@code grid.rows}/{@code grid.columns}: grid size</li>
 *   <li>{@code grid.order}: button positions; unplaced buttons fill free cells</li>
 *   <li>Button {@code label}: label; {@code vocalization}: message</li>
 *   <li>{@code load_board}: NAVIGATE (by board id, or by path through the manifest)</li>
 *   <li>{@code action}/{@code actions}: ACTION; no label and no vocalization: EMPTY</li>
 *   <li>{@code ext_aacprocessors_type} ({@code speak}/{@code empty}): overrides the text-based type</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ObfProcessor extends AbstractDocumentArchiveProcessor {

    private static final String PROCESSOR_ID = "obf";
    private static final String ARCHIVE_EXTENSION = "obz";
    private static final String BOARD_SUFFIX = ".obf";

    @Override
    public String getId() {
        return PROCESSOR_ID;
    }

    @Override
    public String getDisplayName() {
        return "Open Board Format";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("obf", ARCHIVE_EXTENSION);
    }

    private boolean isArchive(Path file) {
        return ARCHIVE_EXTENSION.equals(FileUtils.getNormalizedExtension(file));
    }

    // ==================== Loading ====================

    @Override
    public Tree loadIntoTree(Path file) throws IOException {
        requireReadable(file);
        Tree tree = new Tree();

        if (!isArchive(file)) {
            JsonNode board = parseJson(Files.readAllBytes(file), file.getFileName().toString());
            Page page = buildPage(board, file.getFileName().toString(), path -> Optional.empty(), tree);
            tree.addPage(page).setRootId(page.getId());
            return tree;
        }

        ZipContainer archive = ZipContainer.read(file, getDisplayName());
        ObzManifest manifest = readManifest(archive, file);
        Map<String, JsonNode> boards = readBoards(archive, manifest);
        Map<String, String> idsByPath = new HashMap<>();

        List<Map.Entry<String, JsonNode>> parsed = new ArrayList<>(boards.entrySet());
        for (Map.Entry<String, JsonNode> board : parsed) {
            idsByPath.put(board.getKey(), extractAttribute(board.getValue(), "id"));
        }
        Function<String, Optional<String>> resolvePath = path -> Optional.ofNullable(idsByPath.get(path))
            .or(() -> manifest.boardIdForPath(path));

        for (Map.Entry<String, JsonNode> board : parsed) {
            tree.addPage(buildPage(board.getValue(), board.getKey(), resolvePath, tree));
        }

        if (manifest.root() != null) {
            Optional<String> rootId = resolvePath.apply(manifest.root()).filter(tree::containsPage);
            if (rootId.isPresent()) {
                tree.setRootId(rootId.get());
            } else {
                warn(tree, "Manifest root '" + manifest.root() + "' is not a board in the archive; using the first board");
            }
        }
        log.info("Loaded {} boards from {}", tree.size(), file);
        return tree;
    }

    private ObzManifest readManifest(ZipContainer archive, Path file) {
        String manifestEntry = config().obf().manifestEntry();
        byte[] manifest = archive.get(manifestEntry)
            .orElseThrow(() -> new SchemaException(describe(file) + " has no " + manifestEntry));
        return ObzManifest.from(parseJson(manifest, manifestEntry), manifestEntry);
    }

    /**
     * Reads boards listed by the manifest, or every {@code .obf} entry when it lists none.
     *
     * @return archive path to parsed board, in manifest or archive order
     */
    private Map<String, JsonNode> readBoards(ZipContainer archive, ObzManifest manifest) {
        Map<String, JsonNode> boards = new LinkedHashMap<>();
        for (String path : boardEntries(archive, manifest)) {
            byte[] content = archive.get(path)
                .orElseThrow(() -> new SchemaException("Manifest references missing board " + path));
            boards.put(path, parseJson(content, path));
        }
        return boards;
    }

    private List<String> boardEntries(ZipContainer archive, ObzManifest manifest) {
        if (!manifest.boardPaths().isEmpty()) {
            return List.copyOf(new LinkedHashMap<>(manifest.boardPaths()).values());
        }
        return archive.names(name -> name.toLowerCase(Locale.ROOT).endsWith(BOARD_SUFFIX));
    }

    private Page buildPage(JsonNode board, String documentName,
                           Function<String, Optional<String>> resolvePath, Tree tree) {
        if (!board.isObject()) {
            throw new SchemaException(documentName + " is not a board object");
        }
        String pageId = requireText(board, "id", documentName);
        JsonNode grid = board.get("grid");
        if (grid == null || !grid.isObject()) {
            throw new SchemaException(documentName + " is missing the 'grid' object");
        }
        int rows = Math.max(requireInt(grid, "rows", documentName), 1);
        int columns = Math.max(requireInt(grid, "columns", documentName), 1);
        JsonNode buttons = board.get("buttons");
        if (buttons == null || !buttons.isArray()) {
            throw new SchemaException(documentName + " is missing the 'buttons' array");
        }

        Set<String> buttonIds = new HashSet<>();
        for (JsonNode button : buttons) {
            buttonIds.add(requireText(button, "id", documentName));
        }

        Map<String, GridPosition> placements = new HashMap<>();
        JsonNode order = grid.path("order");
        if (order.isArray()) {
            rows = Math.max(rows, order.size());
            for (int row = 0; row < order.size(); row++) {
                JsonNode cells = order.get(row);
                if (!cells.isArray()) {
                    continue;
                }
                columns = Math.max(columns, cells.size());
                for (int column = 0; column < cells.size(); column++) {
                    JsonNode cell = cells.get(column);
                    if (cell == null || cell.isNull() || !buttonIds.contains(cell.asText())) {
                        continue;
                    }
                    GridPosition previous = placements.putIfAbsent(cell.asText(), new GridPosition(row, column));
                    if (previous != null) {
                        warn(tree, "Button '" + cell.asText() + "' appears twice in grid.order of " + documentName
                            + "; keeping " + previous);
                    }
                }
            }
        }
        if ((long) rows * columns < buttons.size()) {
            rows = (buttons.size() + columns - 1) / columns;
        }

        Page page = new Page(pageId, extractAttribute(board, "name"), rows, columns);
        Set<GridPosition> reserved = new HashSet<>(placements.values());
        for (JsonNode node : buttons) {
            String buttonId = requireText(node, "id", documentName);
            GridPosition position = placements.get(buttonId);
            if (position == null || page.isOccupied(position)) {
                position = page.firstFreePosition(reserved).or(page::firstFreePosition).orElseThrow();
                warn(tree, "Button '" + buttonId + "' of " + documentName + " has no cell in grid.order; placed at "
                    + position);
            }
            page.addButton(toButton(node, buttonId, position, resolvePath));
        }
        return page;
    }

    private Button toButton(JsonNode node, String buttonId, GridPosition position,
                            Function<String, Optional<String>> resolvePath) {
        String label = Optional.ofNullable(extractAttribute(node, "label")).orElse("");
        String vocalization = Optional.ofNullable(extractAttribute(node, "vocalization")).orElse("");
        JsonNode loadBoard = node.get("load_board");

        if (loadBoard != null && loadBoard.isObject()) {
            String target = extractAttribute(loadBoard, "id");
            if (target == null) {
                String path = extractAttribute(loadBoard, "path");
                target = path == null ? null : resolvePath.apply(path).orElse(null);
            }
            return new Button(buttonId, label, vocalization, ButtonType.NAVIGATE, position, target);
        }
        String marker = Optional.ofNullable(extractAttribute(node, ObfBoardWriter.TYPE_FIELD)).orElse("");
        ButtonType type;
        if (node.hasNonNull("action") || node.hasNonNull("actions")) {
            type = ButtonType.ACTION;
        } else if ("empty".equalsIgnoreCase(marker)) {
            type = ButtonType.EMPTY;
        } else if ("speak".equalsIgnoreCase(marker)) {
            type = ButtonType.SPEAK;
        } else if (label.isEmpty() && vocalization.isEmpty()) {
            type = ButtonType.EMPTY;
        } else {
            type = ButtonType.SPEAK;
        }
        return new Button(buttonId, label, vocalization, type, position, null);
    }

    private void warn(Tree tree, String warning) {
        log.warn(warning);
        tree.addWarning(warning);
    }

    // ==================== Saving ====================

    @Override
    public void exportTree(Tree tree, Path output) throws IOException {
        Optional<Path> source = sameFormatSource(output);
        if (isArchive(output)) {
            writeAtomically(output, target -> writeArchive(tree, source, target));
        } else {
            writeAtomically(output, target -> writeSingleBoard(tree, source, target));
        }
        log.info("Wrote {} boards to {}", isArchive(output) ? tree.size() : 1, output);
    }

    private void writeSingleBoard(Tree tree, Optional<Path> source, Path target) throws IOException {
        Page page = tree.getRootPage()
            .orElseThrow(() -> new IllegalArgumentException("Cannot write an empty tree as a single board"));
        if (tree.size() > 1) {
            log.warn("Only the root board '{}' is written to a single .obf; {} other pages are dropped",
                page.getId(), tree.size() - 1);
        }
        ObjectNode template = null;
        if (source.isPresent()) {
            JsonNode original = parseJson(Files.readAllBytes(source.get()), source.get().getFileName().toString());
            if (original.isObject() && page.getId().equals(extractAttribute(original, "id"))) {
                template = (ObjectNode) original;
            }
        }
        ObjectNode board = new ObfBoardWriter(objectMapper, config().obf()).toBoard(page, Map.of(), template);
        Files.write(target, objectMapper.writeValueAsBytes(board));
    }

    private void writeArchive(Tree tree, Optional<Path> source, Path target) throws IOException {
        ObfDefaults defaults = config().obf();
        ZipContainer archive = new ZipContainer();
        Map<String, ObjectNode> templates = new HashMap<>();
        JsonNode sourceManifest = null;

        if (source.isPresent()) {
            ZipContainer original = ZipContainer.read(source.get(), getDisplayName());
            ObzManifest manifest = readManifest(original, source.get());
            sourceManifest = manifest.document();
            Set<String> boardEntries = new HashSet<>(boardEntries(original, manifest));
            for (String entry : original.names()) {
                if (!boardEntries.contains(entry) && !entry.equals(defaults.manifestEntry())) {
                    archive.put(entry, original.get(entry).orElseThrow());
                }
            }
            readBoards(original, manifest).values().stream()
                .filter(JsonNode::isObject)
                .forEach(board -> templates.putIfAbsent(extractAttribute(board, "id"), (ObjectNode) board));
        }

        Map<String, String> boardPaths = assignBoardPaths(tree);
        ObfBoardWriter writer = new ObfBoardWriter(objectMapper, defaults);
        for (Page page : tree.getPages()) {
            ObjectNode board = writer.toBoard(page, boardPaths, templates.get(page.getId()));
            archive.put(boardPaths.get(page.getId()), objectMapper.writeValueAsBytes(board));
        }

        ObjectNode manifest = sourceManifest != null && sourceManifest.isObject()
            ? ((ObjectNode) sourceManifest).deepCopy()
            : objectMapper.createObjectNode();
        if (!manifest.hasNonNull("format")) {
            manifest.put("format", defaults.format());
        }
        tree.getRootPage().ifPresent(root -> manifest.put("root", boardPaths.get(root.getId())));
        ObjectNode paths = manifest.get("paths") instanceof ObjectNode existing ? existing : manifest.putObject("paths");
        ObjectNode boards = paths.putObject("boards");
        boardPaths.forEach(boards::put);
        if (!paths.has("images")) {
            paths.putObject("images");
        }
        if (!paths.has("sounds")) {
            paths.putObject("sounds");
        }
        archive.put(defaults.manifestEntry(), objectMapper.writeValueAsBytes(manifest));
        archive.write(target);
    }

    /**
     * Gives every board a unique archive path derived from its id.
     */
    private Map<String, String> assignBoardPaths(Tree tree) {
        Map<String, String> paths = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Page page : tree.getPages()) {
            String base = config().obf().boardsDirectory() + "/" + FileUtils.sanitizeFileName(page.getId(), "board");
            String path = base + BOARD_SUFFIX;
            int suffix = 2;
            while (!used.add(path.toLowerCase(Locale.ROOT))) {
                path = base + "_" + suffix++ + BOARD_SUFFIX;
            }
            paths.put(page.getId(), path);
        }
        return paths;
    }

    // ==================== Text Rewriting ====================

    @Override
    protected void rewriteTexts(Path file, Map<String, String> translations, Path target) throws IOException {
        BoardTextRewriter rewriter = new BoardTextRewriter(objectMapper);
        if (!isArchive(file)) {
            byte[] original = Files.readAllBytes(file);
            BoardTextRewriter.Result result = rewriteBoard(rewriter, original, file.getFileName().toString(),
                translations);
            Files.write(target, result.content());
            return;
        }

        ZipContainer archive = ZipContainer.read(file, getDisplayName());
        ObzManifest manifest = readManifest(archive, file);
        int replaced = 0;
        for (String path : boardEntries(archive, manifest)) {
            byte[] board = archive.get(path)
                .orElseThrow(() -> new SchemaException("Manifest references missing board " + path));
            BoardTextRewriter.Result result = rewriteBoard(rewriter, board, path, translations);
            if (result.changed()) {
                archive.put(path, result.content());
                replaced += result.replacements();
            }
        }
        log.debug("Replaced {} texts in {}", replaced, file);
        archive.write(target);
    }

    private BoardTextRewriter.Result rewriteBoard(BoardTextRewriter rewriter, byte[] board, String documentName,
                                                  Map<String, String> translations) {
        JsonNode root = parseJson(board, documentName);
        if (!root.isObject() || !root.path("buttons").isArray()) {
            throw new SchemaException(documentName + " is missing the 'buttons' array");
        }
        return rewriter.rewrite(board, documentName, text -> TextSubstitution.lookup(text, translations));
    }
}
