package org.termgraph.glossary.graph;

import org.termgraph.core.id.IDMapper;
import org.termgraph.glossary.model.Term;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable name-to-definition index; the single source of truth for term existence.
 *
 * <p>The index shares its {@link IDMapper} with the {@link RelationIndex} of the same
 * snapshot. Terms occupy node ids {@code [0, size)} in insertion order; names that only
 * appear as relation endpoints (dangling references) are mapped after them and are not
 * terms.</p>
 */
public final class TermIndex {
    private final IDMapper nodeIds;
    private final Term[] terms;
    private final List<Term> ordered;

    TermIndex(IDMapper nodeIds, Term[] terms) {
        this.nodeIds = Objects.requireNonNull(nodeIds, "nodeIds");
        this.terms = Objects.requireNonNull(terms, "terms");
        if (terms.length > nodeIds.size()) {
            throw new IllegalArgumentException(
                    "term count " + terms.length + " exceeds mapped node count " + nodeIds.size());
        }
        this.ordered = List.copyOf(Arrays.asList(terms));
    }

    /**
     * Exact, case-sensitive lookup.
     *
     * @param name term name, may be null.
     * @return the term, or empty when no term has this name.
     */
    public Optional<Term> get(String name) {
        int nodeId = termId(name);
        return nodeId == IDMapper.ABSENT ? Optional.empty() : Optional.of(terms[nodeId]);
    }

    /**
     * Returns every indexed term in insertion order.
     */
    public List<Term> listAll() {
        return ordered;
    }

    public boolean contains(String name) {
        return termId(name) != IDMapper.ABSENT;
    }

    /**
     * Resolves the node id of a term.
     *
     * @return node id, or {@link IDMapper#ABSENT} for unknown or dangling names.
     */
    public int termId(String name) {
        int nodeId = nodeIds.indexOf(name);
        return isTermNode(nodeId) ? nodeId : IDMapper.ABSENT;
    }

    /**
     * Returns whether a node id belongs to an indexed term.
     */
    public boolean isTermNode(int nodeId) {
        return nodeId >= 0 && nodeId < terms.length;
    }

    public Term termAt(int nodeId) {
        if (!isTermNode(nodeId)) {
            throw new IndexOutOfBoundsException("term id out of bounds: " + nodeId);
        }
        return terms[nodeId];
    }

    public int size() {
        return terms.length;
    }
}
