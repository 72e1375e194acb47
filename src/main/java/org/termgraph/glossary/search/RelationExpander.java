package org.termgraph.glossary.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.termgraph.core.id.IDMapper;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.graph.RelationIndex;
import org.termgraph.glossary.model.Relation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded breadth-first neighborhood expansion over outgoing relations.
 *
 * <p>Semantics:</p>
 * <ul>
 * <li>Level {@code L} reports the outgoing relations of every node first reached at
 *     distance {@code L - 1}, so no reported relation ends more than {@code depth} hops away.</li>
 * <li>Each distinct {@code (source, target, type)} triple is reported once.</li>
 * <li>A node is expanded at most once; edges into already-visited nodes are still reported.</li>
 * <li>Order: level, then source discovery order, then source adjacency order.</li>
 * </ul>
 */
@Slf4j
public final class RelationExpander {
    private final TraversalBudget budget;

    public RelationExpander(TraversalBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Expands the relation neighborhood of one term.
     *
     * @param graph snapshot to read.
     * @param termName start term.
     * @param depth hop bound, {@code >= 1}.
     * @return listing, empty when the start term is not indexed.
     * @throws TraversalBudget.BudgetExceededException when the budget is exhausted.
     */
    public RelationListing expand(GlossaryGraph graph, String termName, int depth) {
        Objects.requireNonNull(graph, "graph");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1, got " + depth);
        }
        int startNode = graph.termIndex().termId(termName);
        if (startNode == IDMapper.ABSENT) {
            return RelationListing.empty(depth);
        }

        RelationIndex index = graph.relationIndex();
        VisitedSet discovered = new VisitedSet(index.nodeCount());
        VisitedSet reportedTriples = new VisitedSet(index.distinctTripleCount());
        List<Relation> relations = new ArrayList<>();

        IntArrayList frontier = new IntArrayList();
        frontier.add(startNode);
        discovered.markVisited(startNode);
        int discoveredCount = 1;
        int expandedTerms = 0;
        int scannedRelations = 0;

        for (int level = 1; level <= depth && !frontier.isEmpty(); level++) {
            IntArrayList next = new IntArrayList();
            for (int i = 0; i < frontier.size(); i++) {
                int nodeId = frontier.getInt(i);
                expandedTerms++;
                int end = index.outgoingEnd(nodeId);
                for (int edgeId = index.outgoingStart(nodeId); edgeId < end; edgeId++) {
                    budget.checkScannedRelations(++scannedRelations);
                    if (reportedTriples.markVisited(index.edgeTripleId(edgeId))) {
                        relations.add(index.relationAt(edgeId));
                    }
                    int target = index.edgeTarget(edgeId);
                    if (level < depth && discovered.markVisited(target)) {
                        budget.checkVisitedTerms(++discoveredCount);
                        next.add(target);
                    }
                }
            }
            frontier = next;
        }

        log.debug("Expanded '{}' to depth {}: {} relation(s), {} term(s) expanded, {} edge(s) scanned",
                termName, depth, relations.size(), expandedTerms, scannedRelations);
        return new RelationListing(relations, depth, expandedTerms, scannedRelations);
    }
}
