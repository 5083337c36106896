package ai.sensor.report;

import java.util.List;
import java.util.Objects;

import ai.sensor.model.EvidenceRef;

/**
 * Explanation of a score built only from its reasons. citations lists every ref those
 * reasons cite, first occurrence first.
 */
public record TriageReport(
        String diffId,
        String summary,
        String scoreExplanation,
        List<EvidenceRef> citations
) {
    public TriageReport {
        Objects.requireNonNull(diffId, "diffId");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(scoreExplanation, "scoreExplanation");
        citations = List.copyOf(citations);
    }
}
