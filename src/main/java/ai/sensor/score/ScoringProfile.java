package ai.sensor.score;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weight per rule id under one rules version.
 */
public record ScoringProfile(String version, Map<String, Double> weights) {

    public ScoringProfile {
        Objects.requireNonNull(version, "version");
        weights = Map.copyOf(weights);
    }

    public static ScoringProfile defaults() {
        final Map<String, Double> w = new LinkedHashMap<>();
        for (ScoringRule r : ScoringRules.v1()) {
            w.put(r.id(), r.defaultWeight());
        }
        return new ScoringProfile(ScoringRules.VERSION, w);
    }

    public double weightOf(String ruleId) {
        final Double w = weights.get(ruleId);
        if (w == null) {
            throw new IllegalArgumentException("no weight for rule '" + ruleId + "' in profile " + version);
        }
        return w;
    }

    /**
     * Fails unless every rule has a weight and every weight names a rule.
     */
    public void requireCovers(List<ScoringRule> rules) {
        for (ScoringRule r : rules) {
            weightOf(r.id());
        }
        for (String id : weights.keySet()) {
            if (rules.stream().noneMatch(r -> r.id().equals(id))) {
                throw new IllegalArgumentException("weight for unknown rule '" + id + "' in profile " + version);
            }
        }
    }
}
