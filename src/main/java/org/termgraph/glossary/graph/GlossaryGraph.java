package org.termgraph.glossary.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.termgraph.core.id.IDMapper;
import org.termgraph.glossary.model.Relation;
import org.termgraph.glossary.model.Term;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the glossary graph: one {@link TermIndex} plus one
 * {@link RelationIndex} sharing a node id space.
 *
 * <p>Snapshots are fully built before they are published, and never change afterwards,
 * so any number of readers may query one concurrently.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GlossaryGraph {
    /** Monotonic snapshot version assigned by the owning store. */
    private final long version;
    private final TermIndex termIndex;
    private final RelationIndex relationIndex;

    private GlossaryGraph(long version, TermIndex termIndex, RelationIndex relationIndex) {
        this.version = version;
        this.termIndex = termIndex;
        this.relationIndex = relationIndex;
    }

    /**
     * Builds a snapshot from a load batch.
     *
     * <p>Node ids are assigned to term names first (insertion order, first occurrence wins
     * the position, last occurrence wins the definition), then to dangling relation
     * endpoints in the order they are first seen.</p>
     *
     * @param batch terms and relations to index.
     * @param version snapshot version.
     * @return the new snapshot.
     * @throws IllegalArgumentException when the batch is malformed.
     */
    public static GlossaryGraph build(GlossaryBatch batch, long version) {
        if (batch == null) {
            throw new IllegalArgumentException("batch must be provided");
        }
        List<Term> terms = batch.getTerms();
        List<Relation> relations = batch.getRelations();
        if (terms == null || relations == null) {
            throw new IllegalArgumentException("batch terms and relations must be non-null");
        }

        Map<String, Term> termsByName = new LinkedHashMap<>();
        for (int i = 0; i < terms.size(); i++) {
            Term term = terms.get(i);
            if (term == null) {
                throw new IllegalArgumentException("term[" + i + "] must be non-null");
            }
            requireName(term.name(), "term[" + i + "].name");
            termsByName.put(term.name(), term);
        }

        Set<String> nodeNames = new LinkedHashSet<>(termsByName.keySet());
        for (int i = 0; i < relations.size(); i++) {
            Relation relation = relations.get(i);
            if (relation == null) {
                throw new IllegalArgumentException("relation[" + i + "] must be non-null");
            }
            requireName(relation.sourceTerm(), "relation[" + i + "].sourceTerm");
            requireName(relation.targetTerm(), "relation[" + i + "].targetTerm");
            nodeNames.add(relation.sourceTerm());
            nodeNames.add(relation.targetTerm());
        }

        IDMapper nodeIds = IDMapper.createImmutable(new ArrayList<>(nodeNames));
        TermIndex termIndex = new TermIndex(nodeIds, termsByName.values().toArray(new Term[0]));
        RelationIndex relationIndex = RelationIndex.build(nodeIds, relations);
        return new GlossaryGraph(version, termIndex, relationIndex);
    }

    /**
     * Returns an empty snapshot.
     */
    public static GlossaryGraph empty(long version) {
        return build(GlossaryBatch.empty(), version);
    }

    public int termCount() {
        return termIndex.size();
    }

    public int relationCount() {
        return relationIndex.relationCount();
    }

    @Override
    public String toString() {
        return String.format("GlossaryGraph[version=%d, terms=%d, nodes=%d, relations=%d]",
                version, termCount(), relationIndex.nodeCount(), relationCount());
    }

    private static void requireName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(field + " must be non-blank");
        }
    }
}
