package com.aacprocessors.core.processor.impl.gridset;

import com.aacprocessors.core.config.ProcessorConfig.GridsetDefaults;
import com.aacprocessors.core.exception.SchemaException;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.GridPosition;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;
import com.aacprocessors.core.processor.base.AbstractDocumentArchiveProcessor;
import com.aacprocessors.core.processor.base.ZipContainer;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.CaptionAndImage;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Cell;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Command;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Content;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Definition;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.FileMap;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.FileMapEntry;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Grid;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Parameter;
import com.aacprocessors.core.processor.impl.gridset.GridDocuments.Settings;
import com.aacprocessors.core.translation.TextSubstitution;
import com.aacprocessors.core.util.FileUtils;
import com.fasterxml.jackson.databind.JsonNode;

import javax.xml.stream.events.StartElement;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Processor for Grid 3 gridsets ({@code .gridset}).
 *
 * <p>A gridset is a zip archive with one {@code Grids/<name>/grid.xml} document per page,
 * a {@code Settings0/settings.xml} naming the start grid and a {@code FileMap.xml}
 * index. Images, styles and every other entry are carried through unchanged.
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>Page id: the grid's {@code GridGuid}, falling back to its name</li>
 *   <li>Cell {@code X}/{@code Y}: column/row; button id {@code r<row>c<column>}</li>
 *   <li>{@code Jump.To} command: NAVIGATE to the grid named by its {@code grid} parameter</li>
 *   <li>{@code Action.InsertText}/{@code Action.Speak}: message from the {@code text} parameter</li>
 *   <li>Any other command: ACTION; no command: SPEAK if captioned, else EMPTY</li>
 *   <li>{@code ContentType} {@code Empty} without jump or action commands: EMPTY</li>
 *   <li>Word list items fill the free cells left after the placed cells</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class GridsetProcessor extends AbstractDocumentArchiveProcessor {

    private static final String PROCESSOR_ID = "gridset";
    private static final String GRID_DOCUMENT = "grid.xml";
    private static final Set<String> SPEECH_COMMANDS = Set.of("action.inserttext", "action.speak", "action.speaknow");
    private static final String EMPTY_CONTENT_TYPE = "Empty";

    @Override
    public String getId() {
        return PROCESSOR_ID;
    }

    @Override
    public String getDisplayName() {
        return "Grid 3 Gridset";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("gridset");
    }

    // ==================== Loading ====================

    @Override
    public Tree loadIntoTree(Path file) throws IOException {
        requireReadable(file);
        ZipContainer archive = ZipContainer.read(file, getDisplayName());
        GridsetDefaults defaults = config().gridset();

        List<ParsedGrid> grids = new ArrayList<>();
        for (String entry : archive.names(this::isGridDocument)) {
            JsonNode root = parseXml(archive.get(entry).orElseThrow(), entry);
            grids.add(parseGrid(entry, root));
        }
        if (grids.isEmpty()) {
            throw new SchemaException(describe(file) + " contains no " + defaults.gridsDirectory() + "/*/"
                + GRID_DOCUMENT + " documents");
        }

        Map<String, String> idsByName = indexGridNames(grids);
        Tree tree = new Tree();
        for (ParsedGrid grid : grids) {
            tree.addPage(buildPage(grid, idsByName, tree));
        }

        resolveStartGrid(archive, idsByName, tree);
        log.info("Loaded {} grids from {}", tree.size(), file);
        return tree;
    }

    private boolean isGridDocument(String entryName) {
        return gridDocumentPattern().matcher(entryName).matches();
    }

    private Pattern gridDocumentPattern() {
        return Pattern.compile("^" + Pattern.quote(config().gridset().gridsDirectory()) + "/([^/]+)/"
            + Pattern.quote(GRID_DOCUMENT) + "$", Pattern.CASE_INSENSITIVE);
    }

    private ParsedGrid parseGrid(String entryName, JsonNode root) {
        Matcher matcher = gridDocumentPattern().matcher(entryName);
        String folder = matcher.matches() ? matcher.group(1) : entryName;
        String name = Optional.ofNullable(extractAttribute(root, "Name")).filter(n -> !n.isBlank()).orElse(folder);
        String guid = extractAttribute(root, "GridGuid");
        String pageId = guid == null || guid.isBlank() ? name : guid;

        List<ParsedCell> cells = new ArrayList<>();
        for (JsonNode cell : normalizeToArray(root.path("Cells").path("Cell"))) {
            cells.add(parseCell(cell, entryName));
        }

        List<String> wordListItems = new ArrayList<>();
        for (JsonNode item : normalizeToArray(root.path("WordList").path("Items").path("WordListItem"))) {
            wordListItems.add(elementText(item.path("Text")));
        }

        return new ParsedGrid(entryName, folder, name, pageId,
            countDefinitions(root.path("RowDefinitions").path("RowDefinition")),
            countDefinitions(root.path("ColumnDefinitions").path("ColumnDefinition")),
            cells, wordListItems);
    }

    private int countDefinitions(JsonNode definitions) {
        if (definitions.isMissingNode() || definitions.isNull()) {
            return 0;
        }
        return definitions.isArray() ? definitions.size() : 1;
    }

    private ParsedCell parseCell(JsonNode cell, String entryName) {
        int column = intAttribute(cell, "X", entryName);
        int row = intAttribute(cell, "Y", entryName);
        JsonNode content = cell.path("Content");
        String caption = elementText(content.path("CaptionAndImage").path("Caption"));
        boolean markedEmpty = EMPTY_CONTENT_TYPE.equalsIgnoreCase(elementText(content.path("ContentType")).trim());

        List<ParsedCommand> commands = new ArrayList<>();
        for (JsonNode command : normalizeToArray(content.path("Commands").path("Command"))) {
            String commandId = Optional.ofNullable(extractAttribute(command, "ID")).orElse("");
            Map<String, String> parameters = new LinkedHashMap<>();
            for (JsonNode parameter : normalizeToArray(command.path("Parameter"))) {
                String key = extractAttribute(parameter, "Key");
                if (key != null) {
                    parameters.putIfAbsent(key, elementText(parameter));
                }
            }
            commands.add(new ParsedCommand(commandId, parameters));
        }
        return new ParsedCell(new GridPosition(row, column), caption, commands, markedEmpty);
    }

    private int intAttribute(JsonNode node, String name, String entryName) {
        String value = extractAttribute(node, name);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new SchemaException("Negative cell coordinate " + name + "=" + value + " in " + entryName);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new SchemaException("Invalid cell coordinate " + name + "=" + value + " in " + entryName, e);
        }
    }

    /**
     * Maps grid folder names, then display names, to page ids. Jump commands name grids
     * by folder.
     */
    private Map<String, String> indexGridNames(List<ParsedGrid> grids) {
        Map<String, String> idsByName = new HashMap<>();
        for (ParsedGrid grid : grids) {
            idsByName.putIfAbsent(grid.name(), grid.pageId());
        }
        for (ParsedGrid grid : grids) {
            idsByName.put(grid.folder(), grid.pageId());
        }
        return idsByName;
    }

    private Page buildPage(ParsedGrid grid, Map<String, String> idsByName, Tree tree) {
        Set<GridPosition> declared = new HashSet<>();
        int rows = Math.max(grid.rowCount(), 1);
        int columns = Math.max(grid.columnCount(), 1);
        for (ParsedCell cell : grid.cells()) {
            declared.add(cell.position());
            rows = Math.max(rows, cell.position().row() + 1);
            columns = Math.max(columns, cell.position().column() + 1);
        }
        int needed = grid.cells().size() + grid.wordListItems().size();
        if ((long) rows * columns < needed) {
            rows = (needed + columns - 1) / columns;
        }

        Page page = new Page(grid.pageId(), grid.name(), rows, columns);
        for (ParsedCell cell : grid.cells()) {
            GridPosition position = cell.position();
            if (page.isOccupied(position)) {
                position = freeCell(page, declared);
                warn(tree, "Cell at " + cell.position() + " in " + grid.entryName() + " collides with another cell; moved to "
                    + position);
            }
            page.addButton(toButton(cell, position, idsByName));
        }
        for (String text : grid.wordListItems()) {
            GridPosition position = freeCell(page, declared);
            page.addButton(Button.speak(buttonId(position), text, "", position));
        }
        return page;
    }

    private GridPosition freeCell(Page page, Set<GridPosition> declared) {
        return page.firstFreePosition(declared)
            .or(page::firstFreePosition)
            .orElseThrow(() -> new IllegalStateException("No free cell on page " + page.getId()));
    }

    private Button toButton(ParsedCell cell, GridPosition position, Map<String, String> idsByName) {
        String jumpCommand = config().gridset().jumpCommand();
        Optional<ParsedCommand> jump = cell.commands().stream()
            .filter(command -> command.id().equalsIgnoreCase(jumpCommand))
            .findFirst();
        Optional<ParsedCommand> speech = cell.commands().stream()
            .filter(command -> isSpeechCommand(command.id()))
            .findFirst();
        boolean otherCommands = cell.commands().stream()
            .anyMatch(command -> !command.id().equalsIgnoreCase(jumpCommand) && !isSpeechCommand(command.id()));
        String message = speech.map(command -> command.parameters().getOrDefault("text", "")).orElse("");

        ButtonType type;
        String target = null;
        if (jump.isPresent()) {
            type = ButtonType.NAVIGATE;
            String gridName = jump.get().parameters().getOrDefault("grid", "");
            target = idsByName.getOrDefault(gridName, gridName);
        } else if (otherCommands) {
            type = ButtonType.ACTION;
        } else if (cell.markedEmpty()) {
            type = ButtonType.EMPTY;
        } else if (speech.isPresent() || !cell.caption().isEmpty()) {
            type = ButtonType.SPEAK;
        } else {
            type = ButtonType.EMPTY;
        }
        return new Button(buttonId(position), cell.caption(), message, type, position, target);
    }

    private boolean isSpeechCommand(String commandId) {
        return SPEECH_COMMANDS.contains(commandId.toLowerCase(Locale.ROOT))
            || commandId.equalsIgnoreCase(config().gridset().speakCommand());
    }

    private void resolveStartGrid(ZipContainer archive, Map<String, String> idsByName, Tree tree) {
        String settingsEntry = config().gridset().settingsEntry();
        Optional<byte[]> settings = archive.get(settingsEntry);
        if (settings.isEmpty()) {
            return;
        }
        String startGrid = elementText(parseXml(settings.get(), settingsEntry).path("StartGrid")).trim();
        if (startGrid.isEmpty()) {
            return;
        }
        String rootId = idsByName.get(startGrid);
        if (rootId == null) {
            warn(tree, "Start grid '" + startGrid + "' does not exist; using the first grid as root");
            return;
        }
        tree.setRootId(rootId);
    }

    private static String buttonId(GridPosition position) {
        return "r" + position.row() + "c" + position.column();
    }

    private void warn(Tree tree, String warning) {
        log.warn(warning);
        tree.addWarning(warning);
    }

    // ==================== Saving ====================

    @Override
    public void exportTree(Tree tree, Path output) throws IOException {
        GridsetDefaults defaults = config().gridset();
        Optional<Path> source = sameFormatSource(output);

        writeAtomically(output, target -> {
            ZipContainer archive = new ZipContainer();
            if (source.isPresent()) {
                ZipContainer original = ZipContainer.read(source.get(), getDisplayName());
                for (String entry : original.names(name -> !isGridDocument(name))) {
                    archive.put(entry, original.get(entry).orElseThrow());
                }
            }

            Map<String, String> folders = assignFolders(tree);
            List<FileMapEntry> fileMapEntries = new ArrayList<>();
            for (Page page : tree.getPages()) {
                String entry = defaults.gridsDirectory() + "/" + folders.get(page.getId()) + "/" + GRID_DOCUMENT;
                archive.put(entry, xmlMapper.writeValueAsBytes(toGrid(page, folders)));
                fileMapEntries.add(new FileMapEntry(entry.replace('/', '\\')));
            }
            archive.put(defaults.fileMapEntry(), xmlMapper.writeValueAsBytes(new FileMap(fileMapEntries)));

            String startGrid = tree.getRootPage().map(page -> folders.get(page.getId())).orElse("");
            Optional<byte[]> settings = archive.get(defaults.settingsEntry());
            if (settings.isPresent()) {
                XmlTextRewriter.Result result = XmlTextRewriter.rewrite(settings.get(), defaults.settingsEntry(),
                    (path, text) -> isStartGrid(path) ? Optional.of(startGrid) : Optional.empty());
                if (result.changed()) {
                    archive.put(defaults.settingsEntry(), result.content());
                }
            } else {
                archive.put(defaults.settingsEntry(), xmlMapper.writeValueAsBytes(new Settings(startGrid)));
            }
            archive.write(target);
        });
        log.info("Wrote {} grids to {}", tree.size(), output);
    }

    private boolean isStartGrid(List<StartElement> path) {
        return "StartGrid".equals(path.get(path.size() - 1).getName().getLocalPart());
    }

    /**
     * Gives every page a unique archive folder derived from its name.
     */
    private Map<String, String> assignFolders(Tree tree) {
        Map<String, String> folders = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (Page page : tree.getPages()) {
            String base = FileUtils.sanitizeFileName(page.getName(), "Grid");
            String folder = base;
            if (!used.add(folder.toLowerCase(Locale.ROOT))) {
                folder = base + " (" + FileUtils.sanitizeFileName(page.getId(), "grid") + ")";
                int suffix = 2;
                while (!used.add(folder.toLowerCase(Locale.ROOT))) {
                    folder = base + " " + suffix++;
                }
            }
            folders.put(page.getId(), folder);
        }
        return folders;
    }

    private Grid toGrid(Page page, Map<String, String> folders) {
        GridsetDefaults defaults = config().gridset();
        List<Cell> cells = new ArrayList<>();
        for (Button button : page.getButtons()) {
            List<Command> commands = new ArrayList<>();
            String contentType = null;
            switch (button.getType()) {
                case NAVIGATE -> {
                    String target = button.getTargetPageId().map(id -> folders.getOrDefault(id, id)).orElse("");
                    commands.add(new Command(defaults.jumpCommand(), List.of(new Parameter("grid", target))));
                    if (!button.getMessage().isEmpty()) {
                        commands.add(speechCommand(button.getMessage()));
                    }
                }
                case SPEAK -> commands.add(speechCommand(button.getMessage()));
                case ACTION -> {
                    commands.add(new Command(defaults.actionCommand(), List.of()));
                    if (!button.getMessage().isEmpty()) {
                        commands.add(speechCommand(button.getMessage()));
                    }
                }
                case EMPTY -> {
                    // A caption or a speech command alone would read back as SPEAK
                    if (!button.getLabel().isEmpty() || !button.getMessage().isEmpty()) {
                        contentType = EMPTY_CONTENT_TYPE;
                    }
                    if (!button.getMessage().isEmpty()) {
                        commands.add(speechCommand(button.getMessage()));
                    }
                }
            }
            CaptionAndImage caption = button.getLabel().isEmpty() ? null : new CaptionAndImage(button.getLabel());
            cells.add(new Cell(button.getPosition().column(), button.getPosition().row(),
                new Content(contentType, commands, caption)));
        }
        return new Grid(
            page.getName(),
            page.getId(),
            Collections.nCopies(page.getColumns(), new Definition()),
            Collections.nCopies(page.getRows(), new Definition()),
            cells);
    }

    private Command speechCommand(String message) {
        return new Command(config().gridset().speakCommand(), List.of(new Parameter("text", message)));
    }

    // ==================== Text Rewriting ====================

    @Override
    protected void rewriteTexts(Path file, Map<String, String> translations, Path target) throws IOException {
        ZipContainer archive = ZipContainer.read(file, getDisplayName());
        List<String> gridEntries = archive.names(this::isGridDocument);
        if (gridEntries.isEmpty()) {
            throw new SchemaException(describe(file) + " contains no grid documents");
        }

        int replaced = 0;
        for (String entry : gridEntries) {
            XmlTextRewriter.Result result = XmlTextRewriter.rewrite(archive.get(entry).orElseThrow(), entry,
                Set.of("Caption"),
                (path, text) -> isTranslatable(path) ? TextSubstitution.lookup(text, translations) : Optional.empty());
            if (result.changed()) {
                archive.put(entry, result.content());
                replaced += result.replacements();
            }
        }
        log.debug("Replaced {} texts in {} grids", replaced, gridEntries.size());
        archive.write(target);
    }

    /**
     * Text nodes holding a caption, a word list item, or the {@code text} parameter of a command.
     */
    private boolean isTranslatable(List<StartElement> path) {
        if (XmlTextRewriter.hasAncestor(path, "Caption")) {
            return true;
        }
        for (int i = 1; i < path.size(); i++) {
            String name = path.get(i).getName().getLocalPart();
            String parent = path.get(i - 1).getName().getLocalPart();
            if ("Text".equals(name) && "WordListItem".equals(parent)) {
                return true;
            }
            if ("Parameter".equals(name) && "Command".equals(parent)
                && "text".equals(XmlTextRewriter.attribute(path.get(i), "Key"))) {
                return true;
            }
        }
        return false;
    }

    private record ParsedGrid(String entryName, String folder, String name, String pageId,
                              int rowCount, int columnCount,
                              List<ParsedCell> cells, List<String> wordListItems) {}

    private record ParsedCell(GridPosition position, String caption, List<ParsedCommand> commands,
                              boolean markedEmpty) {}

    private record ParsedCommand(String id, Map<String, String> parameters) {}
}
