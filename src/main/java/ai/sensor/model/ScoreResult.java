package ai.sensor.model;

import java.util.List;
import java.util.Objects;

/**
 * Scoring output for one bundle under one rule version. totalScore is the plain sum of
 * contributions in reason order.
 */
public record ScoreResult(
        String diffId,
        String rulesVersion,
        double totalScore,
        List<Reason> reasons
) {
    public ScoreResult {
        Objects.requireNonNull(diffId, "diffId");
        Objects.requireNonNull(rulesVersion, "rulesVersion");
        reasons = List.copyOf(reasons);
        final double sum = sum(reasons);
        if (Double.compare(totalScore, sum) != 0) {
            throw new IllegalArgumentException("totalScore " + totalScore + " is not the sum of its reasons " + sum);
        }
    }

    public static ScoreResult of(String diffId, String rulesVersion, List<Reason> reasons) {
        return new ScoreResult(diffId, rulesVersion, sum(reasons), reasons);
    }

    private static double sum(List<Reason> reasons) {
        double total = 0.0;
        for (Reason r : reasons) {
            total += r.scoreContribution();
        }
        return total;
    }
}
