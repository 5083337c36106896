package ai.sensor.report;

import java.util.List;
import java.util.Objects;

import ai.sensor.model.EvidenceRef;

/**
 * A testable statement about the diff; never an exploit chain.
 */
public record VulnHypothesis(
        String statement,
        String testApproach,
        List<EvidenceRef> evidenceRefs
) {
    public VulnHypothesis {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(testApproach, "testApproach");
        evidenceRefs = List.copyOf(evidenceRefs);
        if (evidenceRefs.isEmpty()) {
            throw new IllegalArgumentException("hypothesis cites no evidence: " + statement);
        }
    }
}
