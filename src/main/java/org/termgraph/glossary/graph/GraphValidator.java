package org.termgraph.glossary.graph;

import lombok.experimental.UtilityClass;
import org.termgraph.glossary.model.Relation;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistency report for a built {@link GlossaryGraph}.
 *
 * <p>Errors describe index corruption (an edge whose stored triple does not resolve to
 * its recorded endpoints). Warnings cover data the engine
 * tolerates, such as dangling references or isolated terms.</p>
 */
@UtilityClass
public class GraphValidator {

    static final int MAX_REPORTED_DANGLING = 10;

    /**
     * Immutable result of validating a snapshot.
     *
     * @param errors   structural violations.
     * @param warnings tolerated but suspicious conditions.
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public ValidationResult validate(GlossaryGraph graph) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        TermIndex terms = graph.termIndex();
        RelationIndex relations = graph.relationIndex();

        // 1. Edge endpoints agree with the id space
        for (int edgeId = 0; edgeId < relations.relationCount(); edgeId++) {
            Relation relation = relations.relationAt(edgeId);
            if (relations.nodeIds().indexOf(relation.sourceTerm()) != relations.edgeOrigin(edgeId)
                    || relations.nodeIds().indexOf(relation.targetTerm()) != relations.edgeTarget(edgeId)) {
                errors.add("Edge " + edgeId + " endpoints do not match relation " + relation);
                if (errors.size() > 10) { errors.add("..."); break; }
            }
        }

        // 2. Dangling references
        int dangling = 0;
        for (int edgeId = 0; edgeId < relations.relationCount(); edgeId++) {
            Relation relation = relations.relationAt(edgeId);
            boolean sourceMissing = !terms.contains(relation.sourceTerm());
            boolean targetMissing = !terms.contains(relation.targetTerm());
            if (!sourceMissing && !targetMissing) {
                continue;
            }
            dangling++;
            if (dangling <= MAX_REPORTED_DANGLING) {
                String p = "relation '" + relation.sourceTerm() + "' -[" + relation.relationType()
                        + "]-> '" + relation.targetTerm() + "'";
                if (sourceMissing) {
                    warnings.add(p + ": source references unknown term '" + relation.sourceTerm() + "'");
                }
                if (targetMissing) {
                    warnings.add(p + ": target references unknown term '" + relation.targetTerm() + "'");
                }
            }
        }
        if (dangling > MAX_REPORTED_DANGLING) {
            warnings.add((dangling - MAX_REPORTED_DANGLING) + " more relation(s) with dangling references");
        }

        // 3. Duplicate triples
        int duplicates = relations.relationCount() - relations.distinctTripleCount();
        if (duplicates > 0) {
            warnings.add("Graph contains " + duplicates + " duplicate relation triple(s)");
        }

        // 4. Isolated terms
        int isolated = 0;
        for (int nodeId = 0; nodeId < terms.size(); nodeId++) {
            if (relations.outDegree(nodeId) == 0 && relations.inDegree(nodeId) == 0) {
                isolated++;
            }
        }
        if (isolated > 0) {
            warnings.add("Graph contains " + isolated + " isolated term(s) (no relations)");
        }

        return new ValidationResult(errors, warnings);
    }
}
