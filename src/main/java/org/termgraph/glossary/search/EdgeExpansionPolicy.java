package org.termgraph.glossary.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.termgraph.glossary.graph.RelationIndex;

/**
 * Neighbor expansion rule used by path search.
 *
 * <p>This is the only place that decides whether path search follows relations
 * directionally. Neighbors are emitted in a deterministic order so that ties between
 * equally short paths always resolve the same way.</p>
 */
public enum EdgeExpansionPolicy {
    /**
     * Follow relations from source to target only.
     */
    OUTGOING {
        @Override
        public int expand(RelationIndex index, int nodeId, IntArrayList neighbors) {
            return appendOutgoing(index, nodeId, neighbors);
        }
    },
    /**
     * Follow relations in both directions: outgoing targets first, then incoming sources,
     * each in insertion order.
     */
    UNDIRECTED {
        @Override
        public int expand(RelationIndex index, int nodeId, IntArrayList neighbors) {
            int scanned = appendOutgoing(index, nodeId, neighbors);
            int end = index.incomingEnd(nodeId);
            for (int i = index.incomingStart(nodeId); i < end; i++) {
                neighbors.add(index.edgeOrigin(index.incomingEdgeIdAt(i)));
                scanned++;
            }
            return scanned;
        }
    };

    /**
     * Appends neighbor node ids of {@code nodeId} to {@code neighbors}.
     *
     * @return number of relation edges scanned.
     */
    public abstract int expand(RelationIndex index, int nodeId, IntArrayList neighbors);

    private static int appendOutgoing(RelationIndex index, int nodeId, IntArrayList neighbors) {
        int start = index.outgoingStart(nodeId);
        int end = index.outgoingEnd(nodeId);
        for (int edgeId = start; edgeId < end; edgeId++) {
            neighbors.add(index.edgeTarget(edgeId));
        }
        return end - start;
    }
}
