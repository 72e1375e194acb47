package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Value;
import org.termgraph.glossary.model.Term;

/**
 * Term lookup response. {@code term} is {@code null} when {@code found=false}.
 */
@Value
@Builder
public class TermResponse {
    Term term;
    boolean found;
}
