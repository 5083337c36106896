package ai.sensor.score;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import ai.sensor.model.EvidenceBundle;

/**
 * One scoring rule as data: an id, a reason template filled from each hit, the default weight
 * and the pattern that finds hits in a bundle.
 */
public record ScoringRule(
        String id,
        String reasonTemplate,  // String.format template over RuleHit.args
        double defaultWeight,
        EvidencePattern pattern
) {
    public ScoringRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(reasonTemplate, "reasonTemplate");
        Objects.requireNonNull(pattern, "pattern");
    }

    @FunctionalInterface
    public interface EvidencePattern {

        /**
         * @return hits in evidence order; empty when the pattern does not occur
         */
        List<RuleHit> find(EvidenceBundle bundle);
    }

    public List<RuleHit> find(EvidenceBundle bundle) {
        return pattern.find(bundle);
    }

    public String reasonText(RuleHit hit) {
        return String.format(Locale.ROOT, reasonTemplate, hit.args().toArray());
    }
}
