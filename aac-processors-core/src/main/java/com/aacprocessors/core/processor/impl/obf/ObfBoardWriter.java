package com.aacprocessors.core.processor.impl.obf;

import com.aacprocessors.core.config.ProcessorConfig.ObfDefaults;
import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.ButtonType;
import com.aacprocessors.core.model.Page;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds Open Board documents from pages.
 *
 * <p>When the page was loaded from a board of the same id, that board serves as a
 * template: fields the tree does not model (images, colours, strings, extensions) are
 * kept, and only id, name, grid and the mapped button fields are rewritten.
 */
final class ObfBoardWriter {

    /**
     * Extension field naming the type of a SPEAK or EMPTY button that its texts would misclassify.
     */
    static final String TYPE_FIELD = "ext_aacprocessors_type";

    private final ObjectMapper objectMapper;
    private final ObfDefaults defaults;

    ObfBoardWriter(ObjectMapper objectMapper, ObfDefaults defaults) {
        this.objectMapper = objectMapper;
        this.defaults = defaults;
    }

    /**
     * Builds one board.
     *
     * @param page page to write
     * @param boardPaths archive path of every board written alongside (empty for a lone {@code .obf})
     * @param template board previously loaded for this page, or null
     * @return board document
     */
    ObjectNode toBoard(Page page, Map<String, String> boardPaths, ObjectNode template) {
        ObjectNode board = template == null ? objectMapper.createObjectNode() : template.deepCopy();
        if (!board.hasNonNull("format")) {
            board.put("format", defaults.format());
        }
        board.put("id", page.getId());
        if (!board.hasNonNull("locale")) {
            board.put("locale", defaults.locale());
        }
        board.put("name", page.getName());

        Map<String, ObjectNode> templateButtons = indexButtons(template);
        ArrayNode buttons = board.putArray("buttons");
        for (Button button : page.getButtons()) {
            buttons.add(toButton(button, boardPaths, templateButtons.get(button.getId())));
        }

        ObjectNode grid = board.putObject("grid");
        grid.put("rows", page.getRows());
        grid.put("columns", page.getColumns());
        ArrayNode order = grid.putArray("order");
        for (int row = 0; row < page.getRows(); row++) {
            ArrayNode cells = order.addArray();
            for (int column = 0; column < page.getColumns(); column++) {
                cells.addNull();
            }
        }
        for (Button button : page.getButtons()) {
            ((ArrayNode) order.get(button.getPosition().row()))
                .set(button.getPosition().column(), objectMapper.getNodeFactory().textNode(button.getId()));
        }

        if (!board.has("images")) {
            board.putArray("images");
        }
        if (!board.has("sounds")) {
            board.putArray("sounds");
        }
        return board;
    }

    private ObjectNode toButton(Button button, Map<String, String> boardPaths, ObjectNode template) {
        ObjectNode node = template == null ? objectMapper.createObjectNode() : template.deepCopy();
        node.put("id", button.getId());
        node.put("label", button.getLabel());
        if (button.getMessage().isEmpty()) {
            node.remove("vocalization");
        } else {
            node.put("vocalization", button.getMessage());
        }

        node.remove(TYPE_FIELD);
        switch (button.getType()) {
            case NAVIGATE -> {
                node.remove("action");
                node.remove("actions");
                ObjectNode loadBoard = node.putObject("load_board");
                button.getTargetPageId().ifPresent(target -> {
                    loadBoard.put("id", target);
                    if (boardPaths.containsKey(target)) {
                        loadBoard.put("path", boardPaths.get(target));
                    }
                });
            }
            case ACTION -> {
                node.remove("load_board");
                if (!node.has("action") && !node.has("actions")) {
                    node.put("action", defaults.action());
                }
            }
            case SPEAK, EMPTY -> {
                node.remove("load_board");
                node.remove("action");
                node.remove("actions");
                boolean hasText = !button.getLabel().isEmpty() || !button.getMessage().isEmpty();
                if (hasText != (button.getType() == ButtonType.SPEAK)) {
                    node.put(TYPE_FIELD, button.getType().name().toLowerCase(Locale.ROOT));
                }
            }
        }
        return node;
    }

    private Map<String, ObjectNode> indexButtons(ObjectNode template) {
        Map<String, ObjectNode> buttons = new HashMap<>();
        if (template == null) {
            return buttons;
        }
        for (JsonNode button : template.path("buttons")) {
            if (button.isObject() && button.hasNonNull("id")) {
                buttons.putIfAbsent(button.get("id").asText(), (ObjectNode) button);
            }
        }
        return buttons;
    }
}
