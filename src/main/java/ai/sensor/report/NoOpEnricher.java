package ai.sensor.report;

import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ScoreResult;

public final class NoOpEnricher implements Enricher {

    @Override
    public TriageReport enrich(TriageReport report, EvidenceBundle bundle, ScoreResult score) {
        return report;
    }
}
