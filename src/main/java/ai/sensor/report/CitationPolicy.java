package ai.sensor.report;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.bundle.EvidenceIndex;
import ai.sensor.bundle.EvidenceIntegrityException;
import ai.sensor.model.EvidenceBundle;

/**
 * Rejects reports and hypotheses citing evidence absent from their bundle.
 */
public final class CitationPolicy {

    private static final Logger log = LoggerFactory.getLogger(CitationPolicy.class);

    private CitationPolicy() {
    }

    /**
     * @throws EvidenceIntegrityException on the first unresolvable citation
     */
    public static TriageReport enforce(EvidenceBundle bundle, TriageReport report) {
        Objects.requireNonNull(report, "report");
        if (!bundle.diffId().equals(report.diffId())) {
            throw new EvidenceIntegrityException("report for " + report.diffId()
                    + " checked against bundle " + bundle.diffId());
        }
        EvidenceIndex.of(bundle).requireAll(report.citations(), "triage report");
        return report;
    }

    public static List<VulnHypothesis> enforce(EvidenceBundle bundle, List<VulnHypothesis> hypotheses) {
        final EvidenceIndex index = EvidenceIndex.of(bundle);
        for (VulnHypothesis h : hypotheses) {
            index.requireAll(h.evidenceRefs(), "hypothesis");
        }
        return hypotheses;
    }

    public static Enricher guard(Enricher delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return (report, bundle, score) -> {
            final TriageReport enriched = delegate.enrich(report, bundle, score);
            log.debug("Checking citations of {} output for {}", delegate.getClass().getSimpleName(), bundle.diffId());
            return enforce(bundle, enriched);
        };
    }
}
