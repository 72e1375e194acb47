package org.termgraph.glossary.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Raised by {@link GlossaryService} when a query cannot be answered.
 *
 * <p>Two situations qualify: the request itself is malformed (missing request, blank term
 * name, negative {@code topN}), or a traversal ran out of its {@code TraversalBudget}.
 * A term that does not exist or a pair with no connecting path is an ordinary answer
 * ({@code found=false}, {@code pathExists=false}) and never surfaces here.</p>
 *
 * <p>{@link #getReasonCode()} returns one of the {@code GlossaryCore.REASON_*} constants;
 * the message repeats it as a {@code [TG_...]} prefix so log lines stay greppable.</p>
 */
@Getter
public final class GlossaryException extends RuntimeException {
    private final String reasonCode;

    public GlossaryException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * @param reasonCode non-blank {@code TG_*} code identifying the failed check.
     * @param message what was wrong with the query.
     * @param cause traversal failure being wrapped, or {@code null}.
     */
    public GlossaryException(String reasonCode, String message, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("glossary reason code must be non-blank");
        }
        return reasonCode;
    }
}
