package org.termgraph.glossary.store;

import org.termgraph.glossary.graph.GlossaryBatch;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.graph.GraphValidator;
import org.termgraph.glossary.model.Term;
import org.termgraph.glossary.testutil.GlossaryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.termgraph.glossary.testutil.GlossaryFixtures.relation;
import static org.termgraph.glossary.testutil.GlossaryFixtures.term;

@DisplayName("Glossary Store Tests")
class GlossaryStoreTest {

    @Test
    @DisplayName("Initial load publishes version 1")
    void testInitialLoad() {
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch());

        assertEquals(1L, store.snapshot().version());
        assertEquals(3, store.snapshot().termCount());
        assertEquals(2, store.snapshot().relationCount());
    }

    @Test
    @DisplayName("Initial load rejects malformed batches")
    void testInitialLoadRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GlossaryStore(null));
        assertThrows(IllegalArgumentException.class, () -> new GlossaryStore(
                GlossaryBatch.builder().term(new Term(" ", "blank")).build()));
    }

    @Test
    @DisplayName("Reload replaces all data and bumps the version")
    void testReloadReplaces() {
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch());
        GlossaryGraph before = store.snapshot();

        ReloadResult result = store.reload(GlossaryFixtures.taxonomyBatch());

        assertTrue(result.isSuccess());
        assertNull(result.getReasonCode());
        assertEquals(2L, result.getVersion());
        assertEquals(8, result.getTermCount());
        assertEquals(12, result.getRelationCount());
        assertEquals("reloaded 8 term(s) and 12 relation(s)", result.getMessage());
        assertEquals(5, result.getWarnings().size());

        GlossaryGraph after = store.snapshot();
        assertNotSame(before, after);
        assertTrue(after.termIndex().contains("dog"));
        // earlier snapshot stays intact for readers that still hold it
        assertFalse(before.termIndex().contains("dog"));
        assertEquals(2, before.relationCount());
    }

    @Test
    @DisplayName("Reload with an empty batch empties the glossary")
    void testReloadEmpty() {
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch());

        ReloadResult result = store.reload(GlossaryBatch.empty());

        assertTrue(result.isSuccess());
        assertEquals(0, store.snapshot().termCount());
        assertTrue(store.snapshot().termIndex().listAll().isEmpty());
    }

    @Test
    @DisplayName("Rejected reload keeps the published snapshot")
    void testRejectedReloadKeepsData() {
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch());
        GlossaryGraph before = store.snapshot();

        ReloadResult nullBatch = store.reload(null);
        ReloadResult nullRelation = store.reload(GlossaryBatch.of(
                List.of(term("x")), Arrays.asList(relation("x", "x", "self"), null)));

        for (ReloadResult result : List.of(nullBatch, nullRelation)) {
            assertFalse(result.isSuccess());
            assertEquals(GlossaryStore.REASON_INVALID_BATCH, result.getReasonCode());
            assertEquals(1L, result.getVersion());
            assertEquals(3, result.getTermCount());
            assertTrue(result.getWarnings().isEmpty());
        }
        assertSame(before, store.snapshot());
    }

    @Test
    @DisplayName("Reload whose built index fails validation is rejected as corrupt")
    void testCorruptIndexRejected() {
        AtomicBoolean corrupt = new AtomicBoolean(false);
        Function<GlossaryGraph, GraphValidator.ValidationResult> validator = graph -> corrupt.get()
                ? new GraphValidator.ValidationResult(List.of("Edge 0 endpoints do not match"), List.of())
                : GraphValidator.validate(graph);
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch(), GlossaryGraph::build, validator);
        GlossaryGraph before = store.snapshot();

        corrupt.set(true);
        ReloadResult result = store.reload(GlossaryFixtures.taxonomyBatch());

        assertFalse(result.isSuccess());
        assertEquals(GlossaryStore.REASON_CORRUPT_INDEX, result.getReasonCode());
        assertEquals("Edge 0 endpoints do not match", result.getMessage());
        assertEquals(1L, result.getVersion());
        assertSame(before, store.snapshot());
    }

    @Test
    @DisplayName("Unexpected build failure during reload keeps the published snapshot")
    void testUnexpectedBuildFailure() {
        AtomicBoolean failing = new AtomicBoolean(false);
        BiFunction<GlossaryBatch, Long, GlossaryGraph> factory = (batch, version) -> {
            if (failing.get()) {
                throw new IllegalStateException("index arena exhausted");
            }
            return GlossaryGraph.build(batch, version);
        };
        GlossaryStore store = new GlossaryStore(GlossaryFixtures.petBatch(), factory, GraphValidator::validate);

        failing.set(true);
        ReloadResult result = store.reload(GlossaryFixtures.taxonomyBatch());

        assertFalse(result.isSuccess());
        assertEquals(GlossaryStore.REASON_RELOAD_FAILED, result.getReasonCode());
        assertEquals("index arena exhausted", result.getMessage());
        assertEquals(3, result.getTermCount());
        assertTrue(store.snapshot().termIndex().contains("cat"));

        failing.set(false);
        assertEquals(2L, store.reload(GlossaryFixtures.taxonomyBatch()).getVersion());
    }

    @Test
    @DisplayName("Initial load with an inconsistent index is rejected")
    void testInitialCorruptIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GlossaryStore(
                GlossaryFixtures.petBatch(),
                GlossaryGraph::build,
                graph -> new GraphValidator.ValidationResult(List.of("broken"), List.of())));
    }

    @Test
    @DisplayName("Versions increase only on successful reloads")
    void testVersionSequence() {
        GlossaryStore store = new GlossaryStore(GlossaryBatch.empty());

        assertEquals(2L, store.reload(GlossaryFixtures.petBatch()).getVersion());
        assertEquals(2L, store.reload(null).getVersion());
        assertEquals(3L, store.reload(GlossaryFixtures.petBatch()).getVersion());
        assertEquals(3L, store.snapshot().version());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency: readers never observe a mix of two snapshots")
    void testReadersDuringReloads() throws InterruptedException {
        GlossaryBatch small = GlossaryFixtures.chainBatch("a", 50);
        GlossaryBatch large = GlossaryFixtures.chainBatch("b", 200);
        GlossaryStore store = new GlossaryStore(small);

        int readers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger inconsistencies = new AtomicInteger();

        for (int r = 0; r < readers; r++) {
            executor.execute(() -> {
                awaitQuietly(start);
                while (running.get()) {
                    GlossaryGraph graph = store.snapshot();
                    List<Term> terms = graph.termIndex().listAll();
                    String prefix = terms.get(0).name().substring(0, 1);
                    boolean consistent = terms.size() == graph.termCount()
                            && graph.relationCount() == terms.size() - 1
                            && terms.stream().allMatch(t -> t.name().startsWith(prefix))
                            && graph.relationIndex().relationsFrom(prefix + "0").size() == 1;
                    if (!consistent) {
                        inconsistencies.incrementAndGet();
                    }
                }
            });
        }
        executor.execute(() -> {
            awaitQuietly(start);
            for (int i = 0; i < 200; i++) {
                store.reload(i % 2 == 0 ? large : small);
            }
            running.set(false);
        });

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(25, TimeUnit.SECONDS));
        assertEquals(0, inconsistencies.get());
        assertEquals(201L, store.snapshot().version());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency: parallel reloads are serialized with unique versions")
    void testParallelReloadsSerialized() throws InterruptedException {
        GlossaryStore store = new GlossaryStore(GlossaryBatch.empty());
        int writers = 4;
        int reloadsPerWriter = 25;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        boolean[] seen = new boolean[writers * reloadsPerWriter + 2];
        AtomicInteger duplicates = new AtomicInteger();

        for (int w = 0; w < writers; w++) {
            executor.execute(() -> {
                awaitQuietly(start);
                for (int i = 0; i < reloadsPerWriter; i++) {
                    int version = (int) store.reload(GlossaryFixtures.petBatch()).getVersion();
                    synchronized (seen) {
                        if (seen[version]) {
                            duplicates.incrementAndGet();
                        }
                        seen[version] = true;
                    }
                }
            });
        }

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(25, TimeUnit.SECONDS));
        assertEquals(0, duplicates.get());
        assertEquals(1L + writers * reloadsPerWriter, store.snapshot().version());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
