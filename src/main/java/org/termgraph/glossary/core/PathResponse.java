package org.termgraph.glossary.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Path search response.
 *
 * <p>When {@code pathExists=false}, {@code path} is empty.</p>
 */
@Value
@Builder
public class PathResponse {
    /** Term names from source to target inclusive. */
    @Singular("pathTerm")
    List<String> path;
    boolean pathExists;
    String message;
}
