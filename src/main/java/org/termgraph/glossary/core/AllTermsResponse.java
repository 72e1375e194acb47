package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.termgraph.glossary.model.Term;

import java.util.List;

/**
 * Full term enumeration in insertion order.
 */
@Value
@Builder
public class AllTermsResponse {
    @Singular
    List<Term> terms;
    int totalCount;
}
