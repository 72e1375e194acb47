package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Value;

/**
 * Relation listing request.
 */
@Value
@Builder
public class RelationsRequest {
    /** Start term. */
    String termName;
    /** Hop bound; {@code <= 0} selects the configured default. */
    int maxDepth;

    public static RelationsRequest of(String termName, int maxDepth) {
        return RelationsRequest.builder().termName(termName).maxDepth(maxDepth).build();
    }
}
