package ai.sensor.model;

import java.util.List;
import java.util.Objects;

/**
 * One scored explanation. A reason without evidence cannot be constructed.
 */
public record Reason(
        String ruleId,
        String text,
        double scoreContribution,
        List<EvidenceRef> evidenceRefs
) {
    public Reason {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(evidenceRefs, "evidenceRefs");
        evidenceRefs = List.copyOf(evidenceRefs);
        if (evidenceRefs.isEmpty()) {
            throw new IllegalArgumentException("reason '" + ruleId + "' cites no evidence");
        }
    }
}
