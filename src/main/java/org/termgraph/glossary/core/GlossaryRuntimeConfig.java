package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Value;
import org.termgraph.glossary.search.EdgeExpansionPolicy;
import org.termgraph.glossary.search.TraversalBudget;

/**
 * Runtime configuration bound once when the {@link GlossaryCore} is created.
 */
@Value
@Builder
public class GlossaryRuntimeConfig {
    public static final int DEFAULT_RELATION_DEPTH = 1;
    public static final int DEFAULT_PATH_DEPTH = 10;

    /**
     * Depth used by relation listing when the request depth is {@code <= 0}.
     */
    @Builder.Default
    int defaultRelationDepth = DEFAULT_RELATION_DEPTH;

    /**
     * Hop bound used by path search when the request depth is {@code <= 0}.
     */
    @Builder.Default
    int defaultPathDepth = DEFAULT_PATH_DEPTH;

    /**
     * Neighbor rule for path search.
     */
    @Builder.Default
    EdgeExpansionPolicy expansionPolicy = EdgeExpansionPolicy.UNDIRECTED;

    /**
     * Per-query work bounds.
     */
    @Builder.Default
    TraversalBudget traversalBudget = TraversalBudget.unlimited();

    /**
     * Returns the default configuration with the traversal budget read from system properties.
     */
    public static GlossaryRuntimeConfig defaults() {
        return GlossaryRuntimeConfig.builder()
                .traversalBudget(TraversalBudget.defaults())
                .build();
    }

    /**
     * Returns the default configuration with directed-only path search.
     */
    public static GlossaryRuntimeConfig directed() {
        return GlossaryRuntimeConfig.builder()
                .expansionPolicy(EdgeExpansionPolicy.OUTGOING)
                .traversalBudget(TraversalBudget.defaults())
                .build();
    }
}
