package org.termgraph.glossary.search;

import org.termgraph.glossary.model.Relation;

import java.util.List;

/**
 * Result of one bounded relation expansion.
 *
 * @param relations distinct relation triples in breadth-first order.
 * @param depth effective depth that was expanded.
 * @param expandedTerms number of nodes whose outgoing relations were scanned.
 * @param scannedRelations number of relation edges scanned.
 */
public record RelationListing(
        List<Relation> relations,
        int depth,
        int expandedTerms,
        int scannedRelations
) {
    public RelationListing {
        relations = List.copyOf(relations);
    }

    public static RelationListing empty(int depth) {
        return new RelationListing(List.of(), depth, 0, 0);
    }

    public int totalCount() {
        return relations.size();
    }
}
