package org.termgraph.glossary.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.termgraph.core.id.IDMapper;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.graph.RelationIndex;
import org.termgraph.glossary.graph.TermIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Hop-count shortest path search between two terms.
 *
 * <p>Layered breadth-first search from the source. Neighbors come from the configured
 * {@link EdgeExpansionPolicy}; a node's parent is fixed the first time it is discovered,
 * so the returned path is the first shortest path under adjacency insertion order and
 * repeated calls return the same path. Intermediate hops may pass through names that
 * are relation endpoints only.</p>
 */
@Slf4j
public final class PathFinder {
    private static final int NO_PARENT = -1;

    @Getter
    @Accessors(fluent = true)
    private final EdgeExpansionPolicy expansionPolicy;
    private final TraversalBudget budget;

    public PathFinder(EdgeExpansionPolicy expansionPolicy, TraversalBudget budget) {
        this.expansionPolicy = Objects.requireNonNull(expansionPolicy, "expansionPolicy");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Finds a shortest path of at most {@code maxDepth} hops.
     *
     * @param graph snapshot to read.
     * @param source start term.
     * @param target goal term.
     * @param maxDepth hop bound, {@code >= 1}.
     * @return path result; never null.
     * @throws TraversalBudget.BudgetExceededException when the budget is exhausted.
     */
    public PathResult find(GlossaryGraph graph, String source, String target, int maxDepth) {
        Objects.requireNonNull(graph, "graph");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        TermIndex terms = graph.termIndex();
        int sourceNode = terms.termId(source);
        int targetNode = terms.termId(target);
        if (sourceNode == IDMapper.ABSENT || targetNode == IDMapper.ABSENT) {
            List<String> missing = new ArrayList<>(2);
            if (sourceNode == IDMapper.ABSENT) {
                missing.add(source);
            }
            if (targetNode == IDMapper.ABSENT && !Objects.equals(source, target)) {
                missing.add(target);
            }
            return PathResult.missingTerms(missing);
        }
        if (sourceNode == targetNode) {
            return PathResult.trivial(source);
        }

        RelationIndex index = graph.relationIndex();
        int[] parent = new int[index.nodeCount()];
        VisitedSet visited = new VisitedSet(index.nodeCount());
        visited.markVisited(sourceNode);
        parent[sourceNode] = NO_PARENT;
        int visitedCount = 1;
        int scannedRelations = 0;

        IntArrayList frontier = new IntArrayList();
        frontier.add(sourceNode);
        IntArrayList neighbors = new IntArrayList();

        for (int level = 1; level <= maxDepth && !frontier.isEmpty(); level++) {
            IntArrayList next = new IntArrayList();
            for (int i = 0; i < frontier.size(); i++) {
                int nodeId = frontier.getInt(i);
                neighbors.clear();
                scannedRelations += expansionPolicy.expand(index, nodeId, neighbors);
                budget.checkScannedRelations(scannedRelations);
                for (int j = 0; j < neighbors.size(); j++) {
                    int neighbor = neighbors.getInt(j);
                    if (!visited.markVisited(neighbor)) {
                        continue;
                    }
                    parent[neighbor] = nodeId;
                    visitedCount++;
                    if (neighbor == targetNode) {
                        List<String> path = reconstruct(index, parent, targetNode);
                        log.debug("Path '{}' -> '{}' found at depth {} after visiting {} node(s)",
                                source, target, level, visitedCount);
                        return PathResult.found(path, visitedCount);
                    }
                    budget.checkVisitedTerms(visitedCount);
                    next.add(neighbor);
                }
            }
            frontier = next;
        }

        log.debug("No path '{}' -> '{}' within {} hop(s); visited {} node(s), scanned {} edge(s)",
                source, target, maxDepth, visitedCount, scannedRelations);
        return PathResult.notFound(maxDepth, visitedCount);
    }

    private static List<String> reconstruct(RelationIndex index, int[] parent, int targetNode) {
        List<String> path = new ArrayList<>();
        for (int node = targetNode; node != NO_PARENT; node = parent[node]) {
            path.add(index.nodeIds().toExternal(node));
        }
        Collections.reverse(path);
        return path;
    }
}
