package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a selector key to the element registered last under it.
 *
 * <p>Keys are a tag name ({@code div}), an id ({@code #app}) or a class
 * ({@code .card}). A later registration replaces the earlier one, so two
 * elements sharing an id leave only the second in the index.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SelectorIndex {

    private final Map<String, Integer> entries = new LinkedHashMap<>();

    /**
     * Registers an element under a key, replacing any previous entry.
     *
     * @param key the selector key
     * @param nodeId the element node id
     */
    public void register(final String key, final int nodeId) {
        Preconditions.requireNonBlank(key, "Selector key is required");
        entries.put(key, nodeId);
    }

    /**
     * Resolves a key to the element registered last under it.
     *
     * @param key the selector key
     * @return the node id, or null if nothing is registered
     */
    public Integer resolve(final String key) {
        return entries.get(key);
    }

    /** Checks whether any element is registered under the key. */
    public boolean contains(final String key) {
        return entries.containsKey(key);
    }

    /** Returns the number of keys. */
    public int size() {
        return entries.size();
    }

    /** Returns a read-only view of all entries in registration order. */
    public Map<String, Integer> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
