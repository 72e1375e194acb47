package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Value;

/**
 * Path search request.
 */
@Value
@Builder
public class PathRequest {
    String sourceTerm;
    String targetTerm;
    /** Hop bound; {@code <= 0} selects the configured default. */
    int maxDepth;

    public static PathRequest of(String sourceTerm, String targetTerm, int maxDepth) {
        return PathRequest.builder()
                .sourceTerm(sourceTerm)
                .targetTerm(targetTerm)
                .maxDepth(maxDepth)
                .build();
    }
}
