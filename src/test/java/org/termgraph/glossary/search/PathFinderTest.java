package org.termgraph.glossary.search;

import org.termgraph.glossary.graph.GlossaryBatch;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.testutil.GlossaryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.termgraph.glossary.testutil.GlossaryFixtures.relation;
import static org.termgraph.glossary.testutil.GlossaryFixtures.term;

@DisplayName("Path Finder Tests")
class PathFinderTest {

    private GlossaryGraph taxonomy;
    private PathFinder undirected;
    private PathFinder directed;

    @BeforeEach
    void setUp() {
        taxonomy = GlossaryFixtures.graph(GlossaryFixtures.taxonomyBatch());
        undirected = new PathFinder(EdgeExpansionPolicy.UNDIRECTED, TraversalBudget.unlimited());
        directed = new PathFinder(EdgeExpansionPolicy.OUTGOING, TraversalBudget.unlimited());
    }

    @Test
    @DisplayName("Two-hop path through a shared neighbor")
    void testPetExample() {
        PathResult result = undirected.find(GlossaryFixtures.graph(GlossaryFixtures.petBatch()), "animal", "pet", 3);

        assertTrue(result.exists());
        assertEquals(List.of("animal", "cat", "pet"), result.path());
        assertEquals(2, result.hops());
        assertEquals("path found (2 hop(s))", result.message());
    }

    @Test
    @DisplayName("Undirected search follows relations backwards and resolves ties by insertion order")
    void testUndirectedTieBreak() {
        // tail-cat-mammal-dog and tail-cat-pet-dog are both 3 hops; mammal is reached first
        PathResult result = undirected.find(taxonomy, "tail", "dog", 10);

        assertEquals(List.of("tail", "cat", "mammal", "dog"), result.path());
        assertEquals(result.path(), undirected.find(taxonomy, "tail", "dog", 10).path());
    }

    @Test
    @DisplayName("Bound smaller than the distance yields no path")
    void testBoundTooSmall() {
        PathResult result = undirected.find(taxonomy, "tail", "dog", 2);

        assertFalse(result.exists());
        assertTrue(result.path().isEmpty());
        assertEquals(-1, result.hops());
        assertEquals("no path found within 2 hop(s)", result.message());
    }

    @Test
    @DisplayName("Directed search only follows source-to-target")
    void testDirected() {
        assertEquals(List.of("cat", "mammal", "animal"), directed.find(taxonomy, "cat", "animal", 10).path());
        assertEquals(List.of("animal", "cat", "pet"), directed.find(taxonomy, "animal", "pet", 10).path());
        assertFalse(directed.find(taxonomy, "pet", "cat", 10).exists());
        assertEquals(List.of("pet", "cat"), undirected.find(taxonomy, "pet", "cat", 10).path());
        assertEquals(EdgeExpansionPolicy.OUTGOING, directed.expansionPolicy());
    }

    @Test
    @DisplayName("Undirected path search is symmetric in length")
    void testSymmetricLength() {
        String[] names = {"animal", "mammal", "cat", "dog", "pet", "tail", "whisker"};
        for (String a : names) {
            for (String b : names) {
                PathResult forward = undirected.find(taxonomy, a, b, 10);
                PathResult backward = undirected.find(taxonomy, b, a, 10);
                assertEquals(forward.hops(), backward.hops(), a + " <-> " + b);
            }
        }
    }

    @Test
    @DisplayName("Isolated term has no path")
    void testIsolated() {
        PathResult result = undirected.find(taxonomy, "lonely", "cat", 10);

        assertFalse(result.exists());
        assertEquals("no path found within 10 hop(s)", result.message());
    }

    @Test
    @DisplayName("Missing endpoints are reported by name")
    void testMissingTerms() {
        assertEquals("term not found: 'ghost'", undirected.find(taxonomy, "cat", "ghost", 5).message());
        assertEquals("term not found: 'ghost'", undirected.find(taxonomy, "ghost", "cat", 5).message());
        assertEquals("terms not found: 'ghost', 'spirit'",
                undirected.find(taxonomy, "ghost", "spirit", 5).message());
        assertEquals("term not found: 'ghost'", undirected.find(taxonomy, "ghost", "ghost", 5).message());
        assertEquals("term not found: 'limb'", undirected.find(taxonomy, "cat", "limb", 5).message());
    }

    @Test
    @DisplayName("Same source and target is a zero-hop path")
    void testTrivialPath() {
        PathResult result = undirected.find(taxonomy, "lonely", "lonely", 1);

        assertTrue(result.exists());
        assertEquals(List.of("lonely"), result.path());
        assertEquals(0, result.hops());
    }

    @Test
    @DisplayName("Paths may pass through names that are relation endpoints only")
    void testDanglingIntermediate() {
        GlossaryGraph graph = GlossaryFixtures.graph(GlossaryBatch.builder()
                .term(term("a"))
                .term(term("b"))
                .relation(relation("a", "x", "mentions"))
                .relation(relation("x", "b", "mentions"))
                .build());

        assertEquals(List.of("a", "x", "b"), directed.find(graph, "a", "b", 2).path());
    }

    @Test
    @DisplayName("Long chain: path length equals distance; bound is honored")
    void testChain() {
        GlossaryGraph chain = GlossaryFixtures.graph(GlossaryFixtures.chainBatch("n", 12));

        assertEquals(11, undirected.find(chain, "n0", "n11", 11).hops());
        assertFalse(undirected.find(chain, "n0", "n11", 10).exists());
        assertEquals(11, undirected.find(chain, "n11", "n0", 64).hops());
    }

    @Test
    @DisplayName("Non-positive bound is rejected")
    void testNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> undirected.find(taxonomy, "cat", "dog", 0));
    }

    @Test
    @DisplayName("Visited-term budget fails fast")
    void testVisitedBudget() {
        PathFinder bounded = new PathFinder(EdgeExpansionPolicy.UNDIRECTED, TraversalBudget.of(3, 0));

        TraversalBudget.BudgetExceededException ex = assertThrows(TraversalBudget.BudgetExceededException.class,
                () -> bounded.find(taxonomy, "tail", "dog", 10));
        assertEquals(TraversalBudget.REASON_VISITED_TERMS_EXCEEDED, ex.reasonCode());
    }
}
