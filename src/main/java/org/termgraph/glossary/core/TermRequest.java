package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Value;

/**
 * Term lookup request.
 */
@Value
@Builder
public class TermRequest {
    /** Exact, case-sensitive term name. */
    String termName;

    public static TermRequest of(String termName) {
        return TermRequest.builder().termName(termName).build();
    }
}
