package ai.sensor.report;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import ai.sensor.model.EvidenceRef;
import ai.sensor.model.Reason;
import ai.sensor.model.ScoreResult;

public final class TriageReportGenerator {

    public TriageReport generate(ScoreResult score) {
        Objects.requireNonNull(score, "score");
        final Set<EvidenceRef> citations = new LinkedHashSet<>();
        final List<String> parts = new ArrayList<>();
        for (int i = 0; i < score.reasons().size(); i++) {
            final Reason r = score.reasons().get(i);
            citations.addAll(r.evidenceRefs());
            parts.add(String.format(Locale.ROOT, "[%d] %s (+%.2f; evidence: %s)", i + 1, r.text(),
                    r.scoreContribution(),
                    r.evidenceRefs().stream().map(EvidenceRef::stableId).collect(Collectors.joining(", "))));
        }
        final String summary = String.format(Locale.ROOT, "Score %.2f from %d reason(s) under %s.",
                score.totalScore(), score.reasons().size(), score.rulesVersion());
        return new TriageReport(score.diffId(), summary, String.join(" ", parts), new ArrayList<>(citations));
    }
}
