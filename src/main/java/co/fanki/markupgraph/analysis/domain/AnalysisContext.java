package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * State of a single analysis run, passed explicitly to every component.
 *
 * <p>Holds the graph store, the selector index, the script content store
 * and the scripts and stylesheets discovered during the markup walk that
 * still have to be analyzed. A context is never shared between runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisContext {

    /**
     * An inline script waiting for the script analyzer.
     *
     * @param nodeId the script node id
     * @param text the script source
     */
    public record DiscoveredScript(int nodeId, String text) {}

    /**
     * A stylesheet waiting for the style resolver.
     *
     * @param nodeId the stylesheet node id
     * @param text the stylesheet source
     */
    public record DiscoveredStylesheet(int nodeId, String text) {}

    private final GraphStore graph;
    private final SelectorIndex selectorIndex;
    private final ScriptContentStore scriptContents;
    private final List<DiscoveredScript> scripts;
    private final List<DiscoveredStylesheet> stylesheets;

    /** Maps an external stylesheet href to the text the caller supplied. */
    private final Map<String, String> externalStylesheets;

    /**
     * Creates a fresh context.
     *
     * @param theExternalStylesheets stylesheet texts keyed by href, as
     *        supplied by the caller; never fetched by the analysis
     */
    public AnalysisContext(final Map<String, String> theExternalStylesheets) {
        Preconditions.requireNonNull(theExternalStylesheets,
                "External stylesheets map is required");
        this.graph = new GraphStore();
        this.selectorIndex = new SelectorIndex();
        this.scriptContents = new ScriptContentStore();
        this.scripts = new ArrayList<>();
        this.stylesheets = new ArrayList<>();
        this.externalStylesheets = Map.copyOf(theExternalStylesheets);
    }

    /** Creates a fresh context with no external stylesheets. */
    public AnalysisContext() {
        this(Map.of());
    }

    public GraphStore graph() {
        return graph;
    }

    public SelectorIndex selectorIndex() {
        return selectorIndex;
    }

    public ScriptContentStore scriptContents() {
        return scriptContents;
    }

    /**
     * Queues an inline script for analysis and records its text.
     *
     * @param nodeId the script node id
     * @param text the script source
     */
    public void discoverScript(final int nodeId, final String text) {
        scriptContents.put(nodeId, text);
        scripts.add(new DiscoveredScript(nodeId, text));
    }

    /**
     * Queues a stylesheet for selector resolution.
     *
     * @param nodeId the stylesheet node id
     * @param text the stylesheet source
     */
    public void discoverStylesheet(final int nodeId, final String text) {
        Preconditions.requireNonNull(text, "Stylesheet text is required");
        stylesheets.add(new DiscoveredStylesheet(nodeId, text));
    }

    /** Returns the queued scripts in discovery order. */
    public List<DiscoveredScript> discoveredScripts() {
        return Collections.unmodifiableList(scripts);
    }

    /** Returns the queued stylesheets in discovery order. */
    public List<DiscoveredStylesheet> discoveredStylesheets() {
        return Collections.unmodifiableList(stylesheets);
    }

    /**
     * Returns the caller-supplied text of an external stylesheet.
     *
     * @param href the href as written in the document
     * @return the stylesheet text, or null if the caller supplied none
     */
    public String externalStylesheet(final String href) {
        return externalStylesheets.get(href);
    }
}
