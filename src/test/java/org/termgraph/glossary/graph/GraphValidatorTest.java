package org.termgraph.glossary.graph;

import org.termgraph.glossary.testutil.GlossaryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.termgraph.glossary.testutil.GlossaryFixtures.relation;
import static org.termgraph.glossary.testutil.GlossaryFixtures.term;

@DisplayName("Graph Validator Tests")
class GraphValidatorTest {

    @Test
    @DisplayName("Clean graph has no errors and no warnings")
    void testCleanGraph() {
        GraphValidator.ValidationResult result =
                GraphValidator.validate(GlossaryFixtures.graph(GlossaryFixtures.petBatch()));

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
    }

    @Test
    @DisplayName("Dangling references, duplicates and isolated terms are warnings")
    void testTaxonomyWarnings() {
        GraphValidator.ValidationResult result =
                GraphValidator.validate(GlossaryFixtures.graph(GlossaryFixtures.taxonomyBatch()));

        assertTrue(result.isValid());
        assertEquals(5, result.warnings().size(), result.warnings().toString());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("target references unknown term 'appendage'")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("source references unknown term 'appendage'")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("target references unknown term 'limb'")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("1 duplicate relation triple")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("1 isolated term")));
    }

    @Test
    @DisplayName("Dangling warnings are capped with a summary line")
    void testDanglingWarningCap() {
        GlossaryBatch.GlossaryBatchBuilder builder = GlossaryBatch.builder().term(term("hub"));
        for (int i = 0; i < GraphValidator.MAX_REPORTED_DANGLING + 5; i++) {
            builder.relation(relation("hub", "ghost" + i, "mentions"));
        }

        GraphValidator.ValidationResult result = GraphValidator.validate(GlossaryFixtures.graph(builder.build()));

        assertEquals(GraphValidator.MAX_REPORTED_DANGLING + 1, result.warnings().size());
        assertTrue(result.warnings().get(result.warnings().size() - 1).startsWith("5 more relation(s)"));
    }
}
