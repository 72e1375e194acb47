package org.termgraph.glossary.search;

import java.util.BitSet;

/**
 * A compact set of dense ids (term nodes or relation triples) already seen by a traversal.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) access, about one bit per id.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. One instance belongs to one query.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected id range, usually the node or triple count.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(Math.max(0, initialCapacity));
    }

    /**
     * Marks an id as visited if it hasn't been visited already.
     *
     * @return {@code true} if the id was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int id) {
        if (visited.get(id)) {
            return false;
        }
        visited.set(id);
        return true;
    }
}
