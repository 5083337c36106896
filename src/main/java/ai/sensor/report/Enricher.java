package ai.sensor.report;

import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ScoreResult;

/**
 * Optional decoration of a rules-only report (for example by a language model). An enricher
 * may rephrase and reorder, but may only cite evidence the bundle already contains; wrap it
 * with {@link CitationPolicy#guard(Enricher)} to have that checked.
 */
public interface Enricher {

    TriageReport enrich(TriageReport report, EvidenceBundle bundle, ScoreResult score);
}
