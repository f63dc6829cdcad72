package co.fanki.markupgraph.analysis.domain;

/**
 * Observer of an analysis run.
 *
 * <p>Notifications carry no back-pressure or cancellation: the run does
 * not wait on, nor react to, the listener.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface AnalysisListener {

    /** A listener that ignores every notification. */
    AnalysisListener NONE = new AnalysisListener() {
    };

    /**
     * Called once per milestone, in milestone order.
     *
     * @param milestone the milestone reached
     */
    default void onProgress(final AnalysisMilestone milestone) {
    }

    /**
     * Called exactly once, after {@link AnalysisMilestone#DONE}, with the
     * finished graph. Not called when the run fails.
     *
     * @param graph the finished graph
     */
    default void onComplete(final MarkupGraph graph) {
    }
}
