package ai.sensor.score;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.bundle.EvidenceIndex;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.Reason;
import ai.sensor.model.ScoreResult;

/**
 * Scores one bundle with a fixed rule list. Pure: no I/O, no lookups outside the bundle.
 * A bundle that matches no rule scores 0 with no reasons.
 */
public final class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final List<ScoringRule> rules;
    private final ScoringProfile profile;

    public ScoringEngine() {
        this(ScoringRules.v1(), ScoringProfile.defaults());
    }

    public ScoringEngine(ScoringProfile profile) {
        this(ScoringRules.v1(), profile);
    }

    public ScoringEngine(List<ScoringRule> rules, ScoringProfile profile) {
        this.rules = List.copyOf(rules);
        this.profile = Objects.requireNonNull(profile, "profile");
        profile.requireCovers(this.rules);
    }

    /**
     * @throws ai.sensor.bundle.EvidenceIntegrityException if a reason cites evidence the bundle lacks
     */
    public ScoreResult score(EvidenceBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        final EvidenceIndex index = EvidenceIndex.of(bundle);

        final List<Reason> reasons = new ArrayList<>();
        for (ScoringRule rule : rules) {
            final double weight = profile.weightOf(rule.id());
            for (RuleHit hit : rule.find(bundle)) {
                final Reason reason = new Reason(rule.id(), rule.reasonText(hit), weight, hit.evidenceRefs());
                index.requireAll(reason.evidenceRefs(), "reason '" + rule.id() + "'");
                reasons.add(reason);
            }
        }

        final ScoreResult result = ScoreResult.of(bundle.diffId(), profile.version(), reasons);
        log.info("Scored {}: {} reason(s), total {}", bundle.diffId(), reasons.size(), result.totalScore());
        return result;
    }
}
