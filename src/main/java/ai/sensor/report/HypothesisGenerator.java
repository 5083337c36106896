package ai.sensor.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.EvidenceRef;
import ai.sensor.model.SourceFeature;

/**
 * Rules-only hypotheses: one per source feature, citing the feature and its hunks.
 */
public final class HypothesisGenerator {

    public List<VulnHypothesis> generate(EvidenceBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        final List<VulnHypothesis> out = new ArrayList<>();
        for (SourceFeature f : bundle.sourceFeatures()) {
            final List<EvidenceRef> refs = new ArrayList<>();
            refs.add(EvidenceRef.feature(f.featureId()));
            f.hunkIds().forEach(h -> refs.add(EvidenceRef.hunk(h)));

            final String where = " (" + f.filePath() + ":" + f.line() + ")";
            out.add(switch (f.kind()) {
                case ALLOCATION_SIZING -> new VulnHypothesis(
                        "Allocation size derived from a product may overflow" + where + ".",
                        "Trace the size operands back to input; fuzz with very large and zero counts.", refs);
                case BOUNDS_CHECK_ADDED -> new VulnHypothesis(
                        "A bounds check was added, so the previous build may read or write out of bounds" + where + ".",
                        "Run the old build with boundary values the new check rejects.", refs);
                case BOUNDS_CHECK_REMOVED -> new VulnHypothesis(
                        "A bounds check was removed; the guarded copy or allocation may now overrun" + where + ".",
                        "Fuzz the new build with values the removed check used to reject.", refs);
                case PARSING_LOGIC -> new VulnHypothesis(
                        "Parsing of external input changed; malformed input may reach new code paths" + where + ".",
                        "Structure-aware fuzzing seeded with captured valid messages.", refs);
                case PRIVILEGE_CHECK -> new VulnHypothesis(
                        "A privilege gate changed; check for bypass or time-of-check/time-of-use gaps" + where + ".",
                        "Exercise the path with reduced privileges and racing callers.", refs);
            });
        }
        return out;
    }
}
