package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw source text of each inline script, keyed by script node id.
 *
 * <p>Serves "inspect code" requests without rebuilding text from syntax
 * tree spans.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScriptContentStore {

    private final Map<Integer, String> contents = new LinkedHashMap<>();

    /**
     * Stores the text of a script.
     *
     * @param scriptId the script node id
     * @param text the raw script text
     */
    public void put(final int scriptId, final String text) {
        Preconditions.requireNonNull(text, "Script text is required");
        contents.put(scriptId, text);
    }

    /**
     * Returns the text of a script.
     *
     * @param scriptId the script node id
     * @return the text, or null when the script had none
     */
    public String get(final int scriptId) {
        return contents.get(scriptId);
    }

    /** Returns a read-only view keyed by script node id. */
    public Map<Integer, String> asMap() {
        return Collections.unmodifiableMap(contents);
    }
}
