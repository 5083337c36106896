package ai.sensor.pipeline;

import java.util.List;

import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ScoreResult;
import ai.sensor.report.TriageReport;
import ai.sensor.report.VulnHypothesis;

public record DiffRun(
        EvidenceBundle bundle,
        ScoreResult score,
        TriageReport triageReport,
        List<VulnHypothesis> hypotheses
) {
    public DiffRun {
        hypotheses = List.copyOf(hypotheses);
    }
}
