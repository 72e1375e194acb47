package org.termgraph.glossary.stats;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Summary of one glossary snapshot.
 *
 * <p>Node-level figures (average degree, components) count dangling relation endpoints
 * as nodes; {@code mostConnected} only lists indexed terms.</p>
 */
@Value
@Builder
public class GraphStatistics {
    /** Snapshot version the figures were computed from. */
    long version;
    int termCount;
    /** Terms plus dangling relation endpoints. */
    int nodeCount;
    int danglingNameCount;
    int relationCount;
    int distinctRelationCount;
    /** Relation count per type, most frequent first; ties by type name. */
    @Singular
    Map<String, Integer> relationTypeCounts;
    /** {@code 2 * relationCount / nodeCount}, or 0 for an empty graph. */
    double averageDegree;
    /** Highest total-degree terms, descending; ties keep insertion order. */
    @Singular("mostConnectedTerm")
    List<TermDegree> mostConnected;
    /** Weakly connected components over all nodes. */
    int componentCount;
    int largestComponentSize;

    /**
     * Degree of one term.
     *
     * @param name term name.
     * @param degree incoming plus outgoing relations.
     */
    public record TermDegree(String name, int degree) {
    }

    public boolean isConnected() {
        return componentCount <= 1;
    }
}
