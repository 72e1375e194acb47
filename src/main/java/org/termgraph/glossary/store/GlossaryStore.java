package org.termgraph.glossary.store;

import lombok.extern.slf4j.Slf4j;
import org.termgraph.glossary.graph.GlossaryBatch;
import org.termgraph.glossary.graph.GlossaryGraph;
import org.termgraph.glossary.graph.GraphValidator;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Process-wide holder of the current {@link GlossaryGraph} snapshot.
 * <ul>
 * <li>Readers call {@link #snapshot()} once per query and work on that immutable snapshot;
 *     the read path is a single volatile load and never blocks.</li>
 * <li>{@link #reload(GlossaryBatch)} is the only mutator. Writers are serialized, build the
 *     complete new snapshot off to the side and publish it with one atomic swap.</li>
 * <li>A reload that fails to build or validate leaves the previous snapshot published.</li>
 * </ul>
 */
@Slf4j
public final class GlossaryStore {
    public static final String REASON_INVALID_BATCH = "TG_RELOAD_INVALID_BATCH";
    public static final String REASON_CORRUPT_INDEX = "TG_RELOAD_CORRUPT_INDEX";
    public static final String REASON_RELOAD_FAILED = "TG_RELOAD_FAILED";

    private final BiFunction<GlossaryBatch, Long, GlossaryGraph> snapshotFactory;
    private final Function<GlossaryGraph, GraphValidator.ValidationResult> validator;
    private final AtomicReference<GlossaryGraph> current;
    private final ReentrantLock writeLock;

    /**
     * Builds and publishes the initial snapshot (version 1).
     *
     * @param initialBatch terms and relations supplied by the loading collaborator.
     * @throws IllegalArgumentException when the batch is malformed or the built index is inconsistent.
     */
    public GlossaryStore(GlossaryBatch initialBatch) {
        this(initialBatch, GlossaryGraph::build, GraphValidator::validate);
    }

    /**
     * Creates a store with explicit snapshot construction and validation steps.
     */
    GlossaryStore(
            GlossaryBatch initialBatch,
            BiFunction<GlossaryBatch, Long, GlossaryGraph> snapshotFactory,
            Function<GlossaryGraph, GraphValidator.ValidationResult> validator
    ) {
        this.snapshotFactory = Objects.requireNonNull(snapshotFactory, "snapshotFactory");
        this.validator = Objects.requireNonNull(validator, "validator");
        GlossaryGraph initial = snapshotFactory.apply(initialBatch, 1L);
        GraphValidator.ValidationResult validation = validator.apply(initial);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("initial glossary index is inconsistent: " + validation.errors());
        }
        logWarnings(initial, validation);
        this.current = new AtomicReference<>(initial);
        this.writeLock = new ReentrantLock();
        log.info("Loaded glossary snapshot v{}: {} term(s), {} relation(s)",
                initial.version(), initial.termCount(), initial.relationCount());
    }

    /**
     * Returns the currently published snapshot.
     */
    public GlossaryGraph snapshot() {
        return current.get();
    }

    /**
     * Replaces all terms and relations atomically.
     *
     * @param batch complete replacement data.
     * @return applied or rejected outcome; never throws for malformed batches.
     */
    public ReloadResult reload(GlossaryBatch batch) {
        writeLock.lock();
        try {
            GlossaryGraph previous = current.get();
            long nextVersion = previous.version() + 1;

            GlossaryGraph next;
            try {
                next = snapshotFactory.apply(batch, nextVersion);
            } catch (IllegalArgumentException ex) {
                log.warn("Rejected glossary reload, keeping v{}: {}", previous.version(), ex.getMessage());
                return rejected(previous, REASON_INVALID_BATCH, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Glossary reload failed, keeping v{}", previous.version(), ex);
                return rejected(previous, REASON_RELOAD_FAILED, String.valueOf(ex.getMessage()));
            }

            GraphValidator.ValidationResult validation = validator.apply(next);
            if (!validation.isValid()) {
                log.warn("Rejected glossary reload, keeping v{}: {} index error(s)",
                        previous.version(), validation.errors().size());
                return rejected(previous, REASON_CORRUPT_INDEX, String.join("; ", validation.errors()));
            }
            logWarnings(next, validation);

            current.set(next);
            log.info("Reloaded glossary snapshot v{} -> v{}: {} term(s), {} relation(s)",
                    previous.version(), next.version(), next.termCount(), next.relationCount());
            return ReloadResult.builder()
                    .success(true)
                    .message("reloaded " + next.termCount() + " term(s) and " + next.relationCount() + " relation(s)")
                    .version(next.version())
                    .termCount(next.termCount())
                    .relationCount(next.relationCount())
                    .warnings(validation.warnings())
                    .build();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "GlossaryStore[" + Objects.toString(current.get()) + "]";
    }

    private static ReloadResult rejected(GlossaryGraph kept, String reasonCode, String message) {
        return ReloadResult.builder()
                .success(false)
                .reasonCode(reasonCode)
                .message(message)
                .version(kept.version())
                .termCount(kept.termCount())
                .relationCount(kept.relationCount())
                .build();
    }

    private static void logWarnings(GlossaryGraph graph, GraphValidator.ValidationResult validation) {
        if (validation.hasWarnings()) {
            log.warn("Glossary snapshot v{} has {} validation warning(s)", graph.version(), validation.warnings().size());
            validation.warnings().forEach(w -> log.debug("  v{}: {}", graph.version(), w));
        }
    }
}
