package com.aacprocessors.core.model;

import com.aacprocessors.core.exception.DuplicateIdException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Vendor-neutral pageset: the pages of one board set and the page shown first.
 *
 * <p>Pages keep their insertion order, which is the order adapters write them back out
 * and the order used to break ties during navigation analysis.
 *
 * <p>A tree is built by a single load or by direct construction and is not thread-safe.
 * Load warnings (relocated buttons, ignored layout entries) are kept alongside the pages
 * so callers can report them; they never make a tree invalid.
 */
public final class Tree {

    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private String rootId;

    /**
     * Adds a page at the end of the page order.
     *
     * @param page page to add
     * @return this tree
     * @throws DuplicateIdException if a page with the same identifier exists
     */
    public Tree addPage(Page page) {
        Objects.requireNonNull(page, "page must not be null");
        if (pages.containsKey(page.getId())) {
            throw new DuplicateIdException("Duplicate page id '" + page.getId() + "'", page.getId());
        }
        pages.put(page.getId(), page);
        return this;
    }

    /**
     * Looks up a page by identifier.
     *
     * @param pageId page identifier
     * @return the page, or empty when absent
     */
    public Optional<Page> getPage(String pageId) {
        return pageId == null ? Optional.empty() : Optional.ofNullable(pages.get(pageId));
    }

    public boolean containsPage(String pageId) {
        return pageId != null && pages.containsKey(pageId);
    }

    /**
     * Returns the pages in insertion order.
     *
     * @return unmodifiable view of the pages
     */
    public Collection<Page> getPages() {
        return Collections.unmodifiableCollection(pages.values());
    }

    /**
     * Returns the page identifiers in insertion order.
     */
    public List<String> getPageIds() {
        return List.copyOf(pages.keySet());
    }

    public int size() {
        return pages.size();
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    public Optional<String> getRootId() {
        return Optional.ofNullable(rootId);
    }

    /**
     * Sets or clears the root page.
     *
     * @param rootId identifier of an existing page, or null to clear
     * @return this tree
     * @throws IllegalArgumentException if no page has that identifier
     */
    public Tree setRootId(String rootId) {
        if (rootId != null && !pages.containsKey(rootId)) {
            throw new IllegalArgumentException("Root page '" + rootId + "' is not part of the tree");
        }
        this.rootId = rootId;
        return this;
    }

    /**
     * Returns the root page, falling back to the first inserted page when no root is set.
     */
    public Optional<Page> getRootPage() {
        if (rootId != null) {
            return getPage(rootId);
        }
        return pages.values().stream().findFirst();
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "Tree[" + pages.size() + " pages, root=" + rootId + "]";
    }
}
