package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.termgraph.glossary.graph.GlossaryBatch;
import org.termgraph.glossary.model.Term;
import org.termgraph.glossary.search.PathFinder;
import org.termgraph.glossary.search.PathResult;
import org.termgraph.glossary.search.RelationExpander;
import org.termgraph.glossary.search.RelationListing;
import org.termgraph.glossary.search.TraversalBudget;
import org.termgraph.glossary.stats.GraphStatistics;
import org.termgraph.glossary.stats.GraphStatisticsCalculator;
import org.termgraph.glossary.store.GlossaryStore;
import org.termgraph.glossary.store.ReloadResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main glossary query entry point.
 *
 * <p>Execution flow for every query:</p>
 * <ul>
 * <li>Validate the request shape and term names.</li>
 * <li>Resolve the effective depth: {@code <= 0} selects the configured default, any positive
 *     depth is used as given. Work on large depths is bounded by the traversal budget.</li>
 * <li>Read the published snapshot exactly once and run the traversal against it.</li>
 * <li>Wrap traversal budget failures into {@link GlossaryException} with stable reason codes.</li>
 * </ul>
 */
@Slf4j
public final class GlossaryCore implements GlossaryService {
    public static final String REASON_TERM_REQUEST_REQUIRED = "TG_TERM_REQUEST_REQUIRED";
    public static final String REASON_RELATIONS_REQUEST_REQUIRED = "TG_RELATIONS_REQUEST_REQUIRED";
    public static final String REASON_PATH_REQUEST_REQUIRED = "TG_PATH_REQUEST_REQUIRED";
    public static final String REASON_TERM_NAME_REQUIRED = "TG_TERM_NAME_REQUIRED";
    public static final String REASON_SOURCE_TERM_REQUIRED = "TG_SOURCE_TERM_REQUIRED";
    public static final String REASON_TARGET_TERM_REQUIRED = "TG_TARGET_TERM_REQUIRED";
    public static final String REASON_TOP_N_INVALID = "TG_TOP_N_INVALID";
    public static final String REASON_TRAVERSAL_BUDGET_EXCEEDED = "TG_TRAVERSAL_BUDGET_EXCEEDED";

    private final GlossaryStore store;
    private final GlossaryRuntimeConfig config;
    private final RelationExpander relationExpander;
    private final PathFinder pathFinder;

    /**
     * Creates the query facade.
     *
     * @param store snapshot holder.
     * @param config runtime configuration; {@code null} selects {@link GlossaryRuntimeConfig#defaults()}.
     */
    @Builder
    public GlossaryCore(GlossaryStore store, GlossaryRuntimeConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = config == null ? GlossaryRuntimeConfig.defaults() : config;
        validateConfig(this.config);
        this.relationExpander = new RelationExpander(this.config.getTraversalBudget());
        this.pathFinder = new PathFinder(this.config.getExpansionPolicy(), this.config.getTraversalBudget());
    }

    /**
     * Looks up one term.
     *
     * @throws GlossaryException when the request or name is missing.
     */
    @Override
    public TermResponse getTerm(TermRequest request) {
        if (request == null) {
            throw new GlossaryException(REASON_TERM_REQUEST_REQUIRED, "term request must be provided");
        }
        String name = requireName(request.getTermName(), REASON_TERM_NAME_REQUIRED, "termName");
        Optional<Term> term = store.snapshot().termIndex().get(name);
        return TermResponse.builder()
                .term(term.orElse(null))
                .found(term.isPresent())
                .build();
    }

    /**
     * Lists relations reachable from one term.
     *
     * @throws GlossaryException when the request is malformed or the traversal budget is exhausted.
     */
    @Override
    public RelationsResponse listRelations(RelationsRequest request) {
        if (request == null) {
            throw new GlossaryException(REASON_RELATIONS_REQUEST_REQUIRED, "relations request must be provided");
        }
        String name = requireName(request.getTermName(), REASON_TERM_NAME_REQUIRED, "termName");
        int depth = effectiveDepth(request.getMaxDepth(), config.getDefaultRelationDepth());

        RelationListing listing;
        try {
            listing = relationExpander.expand(store.snapshot(), name, depth);
        } catch (TraversalBudget.BudgetExceededException ex) {
            throw budgetExceeded(ex, "relations of '" + name + "'");
        }
        return RelationsResponse.builder()
                .relations(listing.relations())
                .totalCount(listing.totalCount())
                .build();
    }

    /**
     * Finds a shortest path between two terms.
     *
     * @throws GlossaryException when the request is malformed or the traversal budget is exhausted.
     */
    @Override
    public PathResponse findPath(PathRequest request) {
        if (request == null) {
            throw new GlossaryException(REASON_PATH_REQUEST_REQUIRED, "path request must be provided");
        }
        String source = requireName(request.getSourceTerm(), REASON_SOURCE_TERM_REQUIRED, "sourceTerm");
        String target = requireName(request.getTargetTerm(), REASON_TARGET_TERM_REQUIRED, "targetTerm");
        int depth = effectiveDepth(request.getMaxDepth(), config.getDefaultPathDepth());

        PathResult result;
        try {
            result = pathFinder.find(store.snapshot(), source, target, depth);
        } catch (TraversalBudget.BudgetExceededException ex) {
            throw budgetExceeded(ex, "path '" + source + "' -> '" + target + "'");
        }
        return PathResponse.builder()
                .path(result.path())
                .pathExists(result.exists())
                .message(result.message())
                .build();
    }

    @Override
    public AllTermsResponse listAllTerms() {
        List<Term> terms = store.snapshot().termIndex().listAll();
        return AllTermsResponse.builder()
                .terms(terms)
                .totalCount(terms.size())
                .build();
    }

    @Override
    public ReloadResult reload(GlossaryBatch batch) {
        return store.reload(batch);
    }

    /**
     * @throws GlossaryException when {@code topN} is negative.
     */
    @Override
    public GraphStatistics statistics(int topN) {
        if (topN < 0) {
            throw new GlossaryException(REASON_TOP_N_INVALID, "topN must be >= 0, got " + topN);
        }
        return GraphStatisticsCalculator.compute(store.snapshot(), topN);
    }

    /**
     * Applies the depth policy: non-positive selects the default.
     */
    static int effectiveDepth(int requestedDepth, int defaultDepth) {
        return requestedDepth <= 0 ? defaultDepth : requestedDepth;
    }

    private GlossaryException budgetExceeded(TraversalBudget.BudgetExceededException ex, String query) {
        log.warn("Traversal budget exhausted for {}: {}", query, ex.getMessage());
        return new GlossaryException(
                REASON_TRAVERSAL_BUDGET_EXCEEDED,
                ex.reasonCode() + ": " + ex.getMessage(),
                ex
        );
    }

    private static String requireName(String name, String reasonCode, String field) {
        if (name == null || name.isBlank()) {
            throw new GlossaryException(reasonCode, field + " must be non-blank");
        }
        return name;
    }

    private static void validateConfig(GlossaryRuntimeConfig config) {
        if (config.getDefaultRelationDepth() < 1) {
            throw new IllegalArgumentException("defaultRelationDepth must be >= 1");
        }
        if (config.getDefaultPathDepth() < 1) {
            throw new IllegalArgumentException("defaultPathDepth must be >= 1");
        }
        Objects.requireNonNull(config.getExpansionPolicy(), "expansionPolicy");
        Objects.requireNonNull(config.getTraversalBudget(), "traversalBudget");
    }
}
