package org.termgraph.glossary.model;

import java.util.Objects;

/**
 * A directed, typed relation between two terms.
 *
 * <p>{@code relationType} is an open label such as {@code is-a} or {@code part-of};
 * any value is carried verbatim. Record equality is triple identity.</p>
 */
public record Relation(
        String sourceTerm,
        String targetTerm,
        String relationType
) {
    public Relation {
        Objects.requireNonNull(sourceTerm, "sourceTerm");
        Objects.requireNonNull(targetTerm, "targetTerm");
        Objects.requireNonNull(relationType, "relationType");
    }
}
