package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.termgraph.glossary.model.Relation;

import java.util.List;

/**
 * Relation listing response in breadth-first order.
 */
@Value
@Builder
public class RelationsResponse {
    @Singular
    List<Relation> relations;
    /** Always equal to {@code relations.size()}. */
    int totalCount;
}
