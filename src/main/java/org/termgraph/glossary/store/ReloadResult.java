package org.termgraph.glossary.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one {@link GlossaryStore#reload} call.
 *
 * <p>On failure {@code version}, {@code termCount} and {@code relationCount} describe the
 * snapshot that stayed published.</p>
 */
@Value
@Builder
public class ReloadResult {
    /** Whether the new snapshot was published. */
    boolean success;
    /** Deterministic reason code for failures, {@code null} on success. */
    String reasonCode;
    /** Human-readable outcome. */
    String message;
    /** Version of the snapshot published after this call. */
    long version;
    /** Term count of the published snapshot. */
    int termCount;
    /** Relation count of the published snapshot. */
    int relationCount;
    /** Validation warnings for the new snapshot (success only). */
    @Singular
    List<String> warnings;
}
