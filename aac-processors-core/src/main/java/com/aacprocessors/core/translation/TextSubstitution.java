package com.aacprocessors.core.translation;

import com.aacprocessors.core.model.Button;
import com.aacprocessors.core.model.Page;
import com.aacprocessors.core.model.Tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exact-match text substitution over labels and messages.
 *
 * <p>A field is replaced only when its whole value equals a key of the translation map;
 * there is no substring, case-insensitive or fuzzy matching. Empty fields are never
 * matched. Each field is looked up once against the original value, so a map that swaps
 * two texts ({@code A -> B, B -> A}) swaps them rather than replacing twice.
 *
 * <p>Processors reuse {@link #lookup(String, Map)} when they rewrite vendor files in
 * place, so tree-level and file-level substitution agree on what matches.
 */
public final class TextSubstitution {

    private TextSubstitution() {
        // Utility class
    }

    /**
     * Collects every non-empty label and message in page then button order.
     *
     * @param tree tree to read
     * @return texts, label before message for each button, duplicates kept
     */
    public static List<String> collect(Tree tree) {
        List<String> texts = new ArrayList<>();
        for (Page page : tree.getPages()) {
            for (Button button : page.getButtons()) {
                if (!button.getLabel().isEmpty()) {
                    texts.add(button.getLabel());
                }
                if (!button.getMessage().isEmpty()) {
                    texts.add(button.getMessage());
                }
            }
        }
        return texts;
    }

    /**
     * Rewrites matching labels and messages in place.
     *
     * @param tree tree to mutate
     * @param translations exact original text to replacement text
     * @return number of fields rewritten
     */
    public static int apply(Tree tree, Map<String, String> translations) {
        if (translations == null || translations.isEmpty()) {
            return 0;
        }
        int replaced = 0;
        for (Page page : tree.getPages()) {
            for (Button button : page.getButtons()) {
                Optional<String> label = lookup(button.getLabel(), translations);
                Optional<String> message = lookup(button.getMessage(), translations);
                if (label.isPresent()) {
                    button.setLabel(label.get());
                    replaced++;
                }
                if (message.isPresent()) {
                    button.setMessage(message.get());
                    replaced++;
                }
            }
        }
        return replaced;
    }

    /**
     * Finds the replacement for one field value.
     *
     * @param value current field value
     * @param translations exact original text to replacement text
     * @return replacement, or empty if the value is empty, unmatched, or mapped to null
     */
    public static Optional<String> lookup(String value, Map<String, String> translations) {
        if (value == null || value.isEmpty() || translations == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(translations.get(value));
    }

    /**
     * Returns the replacement for a value, or the value itself when unmatched.
     */
    public static String translate(String value, Map<String, String> translations) {
        return lookup(value, translations).orElse(value);
    }
}
