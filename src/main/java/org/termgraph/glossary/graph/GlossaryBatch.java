package org.termgraph.glossary.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.termgraph.glossary.model.Relation;
import org.termgraph.glossary.model.Term;

import java.util.List;

/**
 * In-memory load batch handed over by the data-loading collaborator.
 *
 * <p>The batch is only a carrier; structural validation happens when a
 * {@link GlossaryGraph} snapshot is built from it.</p>
 */
@Value
@Builder
public class GlossaryBatch {
    /** Terms in insertion order. Later duplicates overwrite earlier definitions. */
    @Singular
    List<Term> terms;
    /** Relation triples in insertion order. */
    @Singular
    List<Relation> relations;

    /**
     * Creates a batch from pre-built lists.
     */
    public static GlossaryBatch of(List<Term> terms, List<Relation> relations) {
        if (terms == null || relations == null) {
            throw new IllegalArgumentException("terms and relations must be non-null");
        }
        return GlossaryBatch.builder().terms(terms).relations(relations).build();
    }

    /**
     * Returns an empty batch.
     */
    public static GlossaryBatch empty() {
        return GlossaryBatch.builder().build();
    }
}
