package org.termgraph.glossary.search;

import java.util.List;

/**
 * Outcome of one path search.
 *
 * <p>When {@code exists=false}, {@code path} is empty and {@code message} says whether a
 * term was missing or the bound was too small.</p>
 *
 * @param path term names from source to target inclusive.
 * @param exists whether a path was found within the bound.
 * @param message human-readable outcome.
 * @param visitedTerms number of nodes discovered by the search.
 */
public record PathResult(
        List<String> path,
        boolean exists,
        String message,
        int visitedTerms
) {
    public PathResult {
        path = List.copyOf(path);
    }

    /**
     * Number of relation hops in the path, or {@code -1} when no path exists.
     */
    public int hops() {
        return exists ? path.size() - 1 : -1;
    }

    static PathResult missingTerms(List<String> missing) {
        String message = missing.size() == 1
                ? "term not found: '" + missing.get(0) + "'"
                : "terms not found: '" + String.join("', '", missing) + "'";
        return new PathResult(List.of(), false, message, 0);
    }

    static PathResult trivial(String term) {
        return new PathResult(List.of(term), true, "source and target are the same term", 1);
    }

    static PathResult notFound(int maxDepth, int visitedTerms) {
        return new PathResult(List.of(), false,
                "no path found within " + maxDepth + " hop(s)", visitedTerms);
    }

    static PathResult found(List<String> path, int visitedTerms) {
        return new PathResult(path, true, "path found (" + (path.size() - 1) + " hop(s))", visitedTerms);
    }
}
