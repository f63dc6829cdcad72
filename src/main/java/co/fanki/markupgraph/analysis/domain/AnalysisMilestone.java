package co.fanki.markupgraph.analysis.domain;

/**
 * Fixed progress points of an analysis run, reported in declaration
 * order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AnalysisMilestone {

    /** The element tree and the selector index are complete. */
    STRUCTURE_TRAVERSED(25),

    /** Scripts are analyzed and stylesheets parsed. */
    EXTRACTION_COMPLETE(50),

    /** Stylesheet edges are in place. */
    STYLES_RESOLVED(75),

    /** The graph is final. */
    DONE(100);

    private final int percent;

    AnalysisMilestone(final int thePercent) {
        this.percent = thePercent;
    }

    /**
     * Returns the progress this milestone stands for.
     *
     * @return a percentage between 0 and 100
     */
    public int percent() {
        return percent;
    }

}
