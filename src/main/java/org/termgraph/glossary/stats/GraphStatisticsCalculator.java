package org.termgraph.glossary.stats;

import lombok.experimental.UtilityClass;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.graph.RelationIndex;
import org.termgraph.glossary.graph.TermIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link GraphStatistics} for a snapshot in {@code O(nodes + relations)}.
 */
@UtilityClass
public class GraphStatisticsCalculator {

    public GraphStatistics compute(GlossaryGraph graph, int topN) {
        Objects.requireNonNull(graph, "graph");
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0");
        }
        TermIndex terms = graph.termIndex();
        RelationIndex relations = graph.relationIndex();
        int nodeCount = relations.nodeCount();

        Map<String, Integer> typeCounts = new HashMap<>();
        int[] componentParent = new int[nodeCount];
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            componentParent[nodeId] = nodeId;
        }
        for (int edgeId = 0; edgeId < relations.relationCount(); edgeId++) {
            typeCounts.merge(relations.relationAt(edgeId).relationType(), 1, Integer::sum);
            union(componentParent, relations.edgeOrigin(edgeId), relations.edgeTarget(edgeId));
        }

        int[] componentSize = new int[nodeCount];
        int componentCount = 0;
        int largestComponent = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            int root = find(componentParent, nodeId);
            if (componentSize[root]++ == 0) {
                componentCount++;
            }
            largestComponent = Math.max(largestComponent, componentSize[root]);
        }

        List<GraphStatistics.TermDegree> degrees = new ArrayList<>(terms.size());
        for (int nodeId = 0; nodeId < terms.size(); nodeId++) {
            degrees.add(new GraphStatistics.TermDegree(
                    terms.termAt(nodeId).name(),
                    relations.outDegree(nodeId) + relations.inDegree(nodeId)));
        }
        // List.sort is stable, so equal degrees keep insertion order
        degrees.sort(Comparator.comparingInt(GraphStatistics.TermDegree::degree).reversed());

        return GraphStatistics.builder()
                .version(graph.version())
                .termCount(terms.size())
                .nodeCount(nodeCount)
                .danglingNameCount(nodeCount - terms.size())
                .relationCount(relations.relationCount())
                .distinctRelationCount(relations.distinctTripleCount())
                .relationTypeCounts(sortByCount(typeCounts))
                .averageDegree(nodeCount == 0 ? 0.0d : 2.0d * relations.relationCount() / nodeCount)
                .mostConnected(degrees.subList(0, Math.min(topN, degrees.size())))
                .componentCount(componentCount)
                .largestComponentSize(largestComponent)
                .build();
    }

    private Map<String, Integer> sortByCount(Map<String, Integer> counts) {
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private int find(int[] parent, int nodeId) {
        int root = nodeId;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[nodeId] != root) {
            int next = parent[nodeId];
            parent[nodeId] = root;
            nodeId = next;
        }
        return root;
    }

    private void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }
}
