package com.aacprocessors.core.processor.impl.obf;

import com.aacprocessors.core.exception.SchemaException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of an {@code .obz} {@code manifest.json} needed to locate boards.
 *
 * @param root archive path of the root board (may be null)
 * @param boardPaths board id to archive path, in manifest order
 * @param document the full manifest, kept so unknown sections survive a rewrite
 */
record ObzManifest(String root, Map<String, String> boardPaths, JsonNode document) {

    ObzManifest {
        boardPaths = Collections.unmodifiableMap(new LinkedHashMap<>(boardPaths));
    }

    /**
     * Reads a parsed manifest.
     *
     * @throws SchemaException if the manifest is not a JSON object or its board paths are malformed
     */
    static ObzManifest from(JsonNode document, String entryName) {
        if (!document.isObject()) {
            throw new SchemaException(entryName + " must be a JSON object");
        }
        JsonNode boards = document.path("paths").path("boards");
        if (!boards.isMissingNode() && !boards.isObject()) {
            throw new SchemaException(entryName + " has a malformed 'paths.boards' section");
        }
        Map<String, String> paths = new LinkedHashMap<>();
        boards.fields().forEachRemaining(field -> {
            if (!field.getValue().isTextual()) {
                throw new SchemaException(entryName + " maps board '" + field.getKey() + "' to a non-text path");
            }
            paths.put(field.getKey(), field.getValue().asText());
        });
        JsonNode root = document.get("root");
        return new ObzManifest(root != null && root.isTextual() ? root.asText() : null, paths, document);
    }

    /**
     * Finds the board id stored at an archive path.
     */
    Optional<String> boardIdForPath(String path) {
        return boardPaths.entrySet().stream()
            .filter(entry -> entry.getValue().equals(path))
            .map(Map.Entry::getKey)
            .findFirst();
    }
}
