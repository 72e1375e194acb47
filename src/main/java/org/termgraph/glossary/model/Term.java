package org.termgraph.glossary.model;

import java.util.Objects;

/**
 * A named glossary concept and its definition.
 *
 * @param name unique, case-sensitive term name.
 * @param definition definition text, possibly empty.
 */
public record Term(String name, String definition) {
    public Term {
        Objects.requireNonNull(name, "name");
        definition = definition == null ? "" : definition;
    }
}
