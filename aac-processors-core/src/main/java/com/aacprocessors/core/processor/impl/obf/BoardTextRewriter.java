package com.aacprocessors.core.processor.impl.obf;

import com.aacprocessors.core.exception.FormatException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Replaces button labels and vocalizations of a board in place.
 *
 * <p>The board is scanned with the streaming parser and only the string literals that
 * get a replacement are spliced; every other byte of the document is kept as read.
 */
final class BoardTextRewriter {

    private static final Set<String> TEXT_FIELDS = Set.of("label", "vocalization");

    /**
     * Outcome of a rewrite.
     *
     * @param content rewritten document
     * @param replacements number of strings replaced
     */
    record Result(byte[] content, int replacements) {
        boolean changed() {
            return replacements > 0;
        }
    }

    private final ObjectMapper objectMapper;

    BoardTextRewriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Rewrites one board document.
     *
     * @param board UTF-8 document bytes
     * @param documentName name used in error messages
     * @param rule replacement for a text, or empty to keep it
     * @return rewritten document and replacement count
     * @throws FormatException if the document is not well-formed JSON
     */
    Result rewrite(byte[] board, String documentName, Function<String, Optional<String>> rule) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(board.length + 64);
        int copied = 0;
        int replacements = 0;
        try (JsonParser parser = objectMapper.getFactory().createParser(board)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token != JsonToken.VALUE_STRING || !isButtonText(parser.getParsingContext())) {
                    continue;
                }
                Optional<String> replacement = rule.apply(parser.getText());
                if (replacement.isEmpty()) {
                    continue;
                }
                int start = (int) parser.currentTokenLocation().getByteOffset();
                int end = endOfString(board, start, documentName);
                out.write(board, copied, start - copied);
                out.writeBytes(objectMapper.writeValueAsBytes(replacement.get()));
                copied = end;
                replacements++;
            }
        } catch (IOException e) {
            throw new FormatException("Malformed JSON in " + documentName + ": " + e.getMessage(), e);
        }
        out.write(board, copied, board.length - copied);
        return new Result(out.toByteArray(), replacements);
    }

    /**
     * A string field {@code label} or {@code vocalization} of an element of the top-level {@code buttons} array.
     */
    private static boolean isButtonText(JsonStreamContext context) {
        if (!context.inObject() || !TEXT_FIELDS.contains(context.getCurrentName())) {
            return false;
        }
        JsonStreamContext buttons = context.getParent();
        if (buttons == null || !buttons.inArray()) {
            return false;
        }
        JsonStreamContext board = buttons.getParent();
        return board != null && board.inObject() && "buttons".equals(board.getCurrentName())
            && board.getParent() != null && board.getParent().inRoot();
    }

    /**
     * Returns the offset just past the closing quote of the string literal starting at {@code start}.
     */
    private static int endOfString(byte[] board, int start, String documentName) {
        if (start < 0 || start >= board.length || board[start] != '"') {
            throw new FormatException("Cannot locate string literal at offset " + start + " of " + documentName);
        }
        int i = start + 1;
        while (i < board.length) {
            if (board[i] == '\\') {
                i += 2;
            } else if (board[i] == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        throw new FormatException("Unterminated string at offset " + start + " of " + documentName);
    }
}
