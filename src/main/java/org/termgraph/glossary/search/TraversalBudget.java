package org.termgraph.glossary.search;

/**
 * Per-query deterministic bounds for traversal work.
 *
 * <p>Both traversals terminate on their own (visited sets plus a depth bound); the budget
 * caps worst-case latency on dense graphs queried with large depths.</p>
 */
public final class TraversalBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_VISITED_TERMS_EXCEEDED = "TG_BUDGET_VISITED_TERMS_EXCEEDED";
    public static final String REASON_SCANNED_RELATIONS_EXCEEDED = "TG_BUDGET_SCANNED_RELATIONS_EXCEEDED";

    static final String PROP_MAX_VISITED_TERMS = "termgraph.search.maxVisitedTerms";
    static final String PROP_MAX_SCANNED_RELATIONS = "termgraph.search.maxScannedRelations";

    private static final TraversalBudget UNLIMITED = new TraversalBudget(UNBOUNDED, UNBOUNDED);

    private final int maxVisitedTerms;
    private final int maxScannedRelations;

    private TraversalBudget(int maxVisitedTerms, int maxScannedRelations) {
        this.maxVisitedTerms = normalizeBound(maxVisitedTerms);
        this.maxScannedRelations = normalizeBound(maxScannedRelations);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static TraversalBudget of(int maxVisitedTerms, int maxScannedRelations) {
        return new TraversalBudget(maxVisitedTerms, maxScannedRelations);
    }

    /**
     * Loads budget values from system properties.
     */
    public static TraversalBudget defaults() {
        return TraversalBudget.of(
                readBound(PROP_MAX_VISITED_TERMS),
                readBound(PROP_MAX_SCANNED_RELATIONS)
        );
    }

    public static TraversalBudget unlimited() {
        return UNLIMITED;
    }

    /**
     * Validates the number of terms discovered so far.
     */
    public void checkVisitedTerms(int visitedTerms) {
        if (visitedTerms > maxVisitedTerms) {
            throw new BudgetExceededException(
                    REASON_VISITED_TERMS_EXCEEDED,
                    "visited-term budget exceeded: " + visitedTerms + " > " + maxVisitedTerms
            );
        }
    }

    /**
     * Validates the number of relation edges scanned so far.
     */
    public void checkScannedRelations(int scannedRelations) {
        if (scannedRelations > maxScannedRelations) {
            throw new BudgetExceededException(
                    REASON_SCANNED_RELATIONS_EXCEEDED,
                    "scanned-relation budget exceeded: " + scannedRelations + " > " + maxScannedRelations
            );
        }
    }

    public int maxVisitedTerms() {
        return maxVisitedTerms;
    }

    public int maxScannedRelations() {
        return maxScannedRelations;
    }

    @Override
    public String toString() {
        return "TraversalBudget[maxVisitedTerms=" + maxVisitedTerms
                + ", maxScannedRelations=" + maxScannedRelations + "]";
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
