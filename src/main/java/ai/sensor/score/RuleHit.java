package ai.sensor.score;

import java.util.List;

import ai.sensor.model.EvidenceRef;

/**
 * One match of a rule's pattern: the values its reason template is filled with and the
 * evidence that triggered it.
 */
public record RuleHit(List<Object> args, List<EvidenceRef> evidenceRefs) {

    public RuleHit {
        args = List.copyOf(args);
        evidenceRefs = List.copyOf(evidenceRefs);
    }
}
