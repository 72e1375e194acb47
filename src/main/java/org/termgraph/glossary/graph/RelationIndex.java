package org.termgraph.glossary.graph;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.termgraph.core.id.IDMapper;
import org.termgraph.glossary.model.Relation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable adjacency structure over typed relations.
 * <p>
 * Layout:
 * </p>
 * <ul>
 * <li>Forward CSR: {@code firstOutgoing[node]} is the first edge slot of a node's
 *     outgoing relations. Edge ids are CSR slots.</li>
 * <li>Reverse CSR: {@code firstIncoming[node]} indexes {@code incomingEdgeIds}, which
 *     holds forward edge ids of a node's incoming relations.</li>
 * <li>Per edge: origin node, target node, relation triple and a dense triple id shared by
 *     identical {@code (source, target, type)} triples.</li>
 * </ul>
 * <p>
 * Both adjacency directions keep batch insertion order per node, which is the
 * deterministic tie-break order for every traversal.
 * </p>
 */
public final class RelationIndex {
    private final IDMapper nodeIds;

    private final int[] firstOutgoing;
    private final int[] edgeOrigin;
    private final int[] edgeTarget;
    private final int[] edgeTripleId;
    private final Relation[] edgeRelation;

    private final int[] firstIncoming;
    private final int[] incomingEdgeIds;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int relationCount;
    @Getter
    @Accessors(fluent = true)
    private final int distinctTripleCount;

    private RelationIndex(
            IDMapper nodeIds,
            int[] firstOutgoing,
            int[] edgeOrigin,
            int[] edgeTarget,
            int[] edgeTripleId,
            Relation[] edgeRelation,
            int[] firstIncoming,
            int[] incomingEdgeIds,
            int distinctTripleCount
    ) {
        this.nodeIds = nodeIds;
        this.firstOutgoing = firstOutgoing;
        this.edgeOrigin = edgeOrigin;
        this.edgeTarget = edgeTarget;
        this.edgeTripleId = edgeTripleId;
        this.edgeRelation = edgeRelation;
        this.firstIncoming = firstIncoming;
        this.incomingEdgeIds = incomingEdgeIds;
        this.nodeCount = nodeIds.size();
        this.relationCount = edgeRelation.length;
        this.distinctTripleCount = distinctTripleCount;
    }

    /**
     * Builds forward and reverse adjacency for one relation batch.
     *
     * @param nodeIds mapper covering every relation endpoint.
     * @param relations relations in insertion order.
     * @throws IllegalArgumentException when an endpoint is not mapped.
     */
    static RelationIndex build(IDMapper nodeIds, List<Relation> relations) {
        Objects.requireNonNull(nodeIds, "nodeIds");
        Objects.requireNonNull(relations, "relations");
        int nodeCount = nodeIds.size();
        int relationCount = relations.size();

        int[] inputOrigin = new int[relationCount];
        int[] inputTarget = new int[relationCount];
        int[] outgoingDegree = new int[nodeCount];
        int[] incomingDegree = new int[nodeCount];
        for (int i = 0; i < relationCount; i++) {
            Relation relation = relations.get(i);
            inputOrigin[i] = requireNode(nodeIds, relation.sourceTerm(), i);
            inputTarget[i] = requireNode(nodeIds, relation.targetTerm(), i);
            outgoingDegree[inputOrigin[i]]++;
            incomingDegree[inputTarget[i]]++;
        }

        int[] firstOutgoing = prefixOffsets(outgoingDegree, relationCount);
        int[] firstIncoming = prefixOffsets(incomingDegree, relationCount);
        int[] outgoingCursor = Arrays.copyOf(firstOutgoing, firstOutgoing.length);
        int[] incomingCursor = Arrays.copyOf(firstIncoming, firstIncoming.length);

        int[] edgeOrigin = new int[relationCount];
        int[] edgeTarget = new int[relationCount];
        int[] edgeTripleId = new int[relationCount];
        Relation[] edgeRelation = new Relation[relationCount];
        int[] incomingEdgeIds = new int[relationCount];

        Object2IntOpenHashMap<Relation> tripleIds = new Object2IntOpenHashMap<>(relationCount);
        tripleIds.defaultReturnValue(-1);

        // Stable fill: input order is preserved inside every node's range.
        for (int i = 0; i < relationCount; i++) {
            Relation relation = relations.get(i);
            int edgeId = outgoingCursor[inputOrigin[i]]++;
            edgeOrigin[edgeId] = inputOrigin[i];
            edgeTarget[edgeId] = inputTarget[i];
            edgeRelation[edgeId] = relation;

            int tripleId = tripleIds.getInt(relation);
            if (tripleId == -1) {
                tripleId = tripleIds.size();
                tripleIds.put(relation, tripleId);
            }
            edgeTripleId[edgeId] = tripleId;

            incomingEdgeIds[incomingCursor[inputTarget[i]]++] = edgeId;
        }

        return new RelationIndex(
                nodeIds,
                firstOutgoing,
                edgeOrigin,
                edgeTarget,
                edgeTripleId,
                edgeRelation,
                firstIncoming,
                incomingEdgeIds,
                tripleIds.size()
        );
    }

    // ========================================================================
    // NAME-LEVEL ACCESSORS
    // ========================================================================

    /**
     * Direct outgoing relations of a name in insertion order.
     *
     * @return relations, empty when the name is unknown or has no outgoing relations.
     */
    public List<Relation> relationsFrom(String name) {
        int nodeId = nodeIds.indexOf(name);
        if (nodeId == IDMapper.ABSENT) {
            return List.of();
        }
        int start = firstOutgoing[nodeId];
        int end = firstOutgoing[nodeId + 1];
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(edgeRelation, start, end)));
    }

    /**
     * Direct incoming relations of a name in insertion order.
     *
     * @return relations, empty when the name is unknown or has no incoming relations.
     */
    public List<Relation> relationsTo(String name) {
        int nodeId = nodeIds.indexOf(name);
        if (nodeId == IDMapper.ABSENT) {
            return List.of();
        }
        int start = firstIncoming[nodeId];
        int end = firstIncoming[nodeId + 1];
        List<Relation> incoming = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            incoming.add(edgeRelation[incomingEdgeIds[i]]);
        }
        return Collections.unmodifiableList(incoming);
    }

    public IDMapper nodeIds() {
        return nodeIds;
    }

    // ========================================================================
    // CORE ACCESSORS (O(1))
    // ========================================================================

    /**
     * Returns start slot (inclusive) of a node's outgoing edges.
     */
    public int outgoingStart(int nodeId) {
        validateNode(nodeId);
        return firstOutgoing[nodeId];
    }

    /**
     * Returns end slot (exclusive) of a node's outgoing edges.
     */
    public int outgoingEnd(int nodeId) {
        validateNode(nodeId);
        return firstOutgoing[nodeId + 1];
    }

    /**
     * Returns start position (inclusive) in the incoming-edge array for one node.
     */
    public int incomingStart(int nodeId) {
        validateNode(nodeId);
        return firstIncoming[nodeId];
    }

    /**
     * Returns end position (exclusive) in the incoming-edge array for one node.
     */
    public int incomingEnd(int nodeId) {
        validateNode(nodeId);
        return firstIncoming[nodeId + 1];
    }

    /**
     * Returns the forward edge id stored at one reverse-array position.
     */
    public int incomingEdgeIdAt(int reverseIndexPosition) {
        return incomingEdgeIds[reverseIndexPosition];
    }

    public int edgeOrigin(int edgeId) {
        validateEdge(edgeId);
        return edgeOrigin[edgeId];
    }

    public int edgeTarget(int edgeId) {
        validateEdge(edgeId);
        return edgeTarget[edgeId];
    }

    public int edgeTripleId(int edgeId) {
        validateEdge(edgeId);
        return edgeTripleId[edgeId];
    }

    public Relation relationAt(int edgeId) {
        validateEdge(edgeId);
        return edgeRelation[edgeId];
    }

    public int outDegree(int nodeId) {
        return outgoingEnd(nodeId) - outgoingStart(nodeId);
    }

    public int inDegree(int nodeId) {
        return incomingEnd(nodeId) - incomingStart(nodeId);
    }

    @Override
    public String toString() {
        return String.format("RelationIndex[nodes=%d, relations=%d, distinctTriples=%d]",
                nodeCount, relationCount, distinctTripleCount);
    }

    private static int requireNode(IDMapper nodeIds, String name, int position) {
        int nodeId = nodeIds.indexOf(name);
        if (nodeId == IDMapper.ABSENT) {
            throw new IllegalArgumentException(
                    "relation[" + position + "] endpoint not mapped to a node: " + name);
        }
        return nodeId;
    }

    private static int[] prefixOffsets(int[] degree, int total) {
        int[] offsets = new int[degree.length + 1];
        int cursor = 0;
        for (int nodeId = 0; nodeId < degree.length; nodeId++) {
            offsets[nodeId] = cursor;
            cursor += degree[nodeId];
        }
        offsets[degree.length] = total;
        return offsets;
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }

    private void validateEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= relationCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + relationCount + ")");
        }
    }
}
