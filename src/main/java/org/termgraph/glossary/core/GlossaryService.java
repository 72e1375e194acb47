package org.termgraph.glossary.core;

import org.termgraph.glossary.graph.GlossaryBatch;
import org.termgraph.glossary.stats.GraphStatistics;
import org.termgraph.glossary.store.ReloadResult;

/**
 * Public glossary query contract.
 *
 * <p>Implementations throw reason-coded {@link GlossaryException}s for malformed
 * requests; missing terms are reported through the response flags.</p>
 */
public interface GlossaryService {
    /**
     * Looks up one term by exact name.
     */
    TermResponse getTerm(TermRequest request);

    /**
     * Lists relations reachable over outgoing edges within the requested depth.
     */
    RelationsResponse listRelations(RelationsRequest request);

    /**
     * Finds a shortest path between two terms within the requested depth.
     */
    PathResponse findPath(PathRequest request);

    /**
     * Enumerates every term.
     */
    AllTermsResponse listAllTerms();

    /**
     * Replaces the whole graph atomically.
     */
    ReloadResult reload(GlossaryBatch batch);

    /**
     * Summarizes the current graph.
     *
     * @param topN number of most connected terms to report.
     */
    GraphStatistics statistics(int topN);
}
