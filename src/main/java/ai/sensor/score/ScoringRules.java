package ai.sensor.score;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.ChangeSide;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.EvidenceRef;
import ai.sensor.model.ExtractionStatus;
import ai.sensor.model.Ids;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.SourceFeature;
import ai.sensor.model.SourceFeatureKind;

/**
 * The versioned rule set. Declaration order is reason order.
 */
public final class ScoringRules {

    public static final String VERSION = "rules/v1";

    public static final String UNGUARDED_ALLOCATION_SIZING = "unguarded-allocation-sizing";
    public static final String ALLOCATION_GUARD_ADDED = "allocation-guard-added";
    public static final String BOUNDS_CHECK_REMOVED = "bounds-check-removed";
    public static final String PARSING_LOGIC_CHANGED = "parsing-logic-changed";
    public static final String PRIVILEGE_CHECK_CHANGED = "privilege-check-changed";
    public static final String LOG_CORRELATED_CHANGED_CODE = "log-correlated-changed-code";
    public static final String NEW_LOG_TEMPLATE = "new-log-template";
    public static final String BINARY_STRINGS_ADDED = "binary-strings-added";
    public static final String UNMATCHED_BINARY_SYMBOL = "unmatched-binary-symbol";

    // aggregated reasons cite at most this many strings
    static final int MAX_CITED_STRINGS = 20;

    // shorter symbol names match too much prose to count as "named" by a log string
    static final int MIN_SYMBOL_NAME = 4;

    private static final List<ScoringRule> V1 = List.of(
            new ScoringRule(UNGUARDED_ALLOCATION_SIZING,
                    "Allocation sizing at %s:%d with no bounds check added in the same hunk (%s)",
                    3.0, ScoringRules::unguardedAllocationSizing),
            new ScoringRule(ALLOCATION_GUARD_ADDED,
                    "Bounds check added at %s:%d that %s",
                    1.5, ScoringRules::allocationGuardAdded),
            new ScoringRule(BOUNDS_CHECK_REMOVED,
                    "Bounds check removed at %s:%d that %s",
                    2.5, b -> featureHits(b, SourceFeatureKind.BOUNDS_CHECK_REMOVED)),
            new ScoringRule(PARSING_LOGIC_CHANGED,
                    "Parsing logic %s at %s:%d: %s",
                    2.0, b -> sidedFeatureHits(b, SourceFeatureKind.PARSING_LOGIC)),
            new ScoringRule(PRIVILEGE_CHECK_CHANGED,
                    "Privilege check %s at %s:%d: %s",
                    2.5, b -> sidedFeatureHits(b, SourceFeatureKind.PRIVILEGE_CHECK)),
            new ScoringRule(LOG_CORRELATED_CHANGED_CODE,
                    "Log template \"%s\" matches binary string \"%s\" tied to %s",
                    1.2, ScoringRules::logCorrelatedChangedCode),
            new ScoringRule(NEW_LOG_TEMPLATE,
                    "New log template in %s:%s: \"%s\"",
                    0.8, ScoringRules::newLogTemplate),
            new ScoringRule(BINARY_STRINGS_ADDED,
                    "%d string(s) in the new binary are absent from the old one, first: \"%s\"",
                    0.5, ScoringRules::binaryStringsAdded),
            new ScoringRule(UNMATCHED_BINARY_SYMBOL,
                    "Symbol %s is only present in the %s binary",
                    0.5, ScoringRules::unmatchedBinarySymbol)
    );

    private ScoringRules() {
    }

    public static List<ScoringRule> v1() {
        return V1;
    }

    static List<RuleHit> unguardedAllocationSizing(EvidenceBundle b) {
        final List<SourceFeature> guards = features(b, SourceFeatureKind.BOUNDS_CHECK_ADDED);
        final List<RuleHit> hits = new ArrayList<>();
        for (SourceFeature f : features(b, SourceFeatureKind.ALLOCATION_SIZING)) {
            if (guards.stream().noneMatch(g -> sharesHunk(f, g))) {
                hits.add(new RuleHit(List.of(f.filePath(), f.line(), f.guarded()
                        ? "an existing check precedes it"
                        : "no preceding bounds or overflow check"), featureRefs(f)));
            }
        }
        return hits;
    }

    static List<RuleHit> allocationGuardAdded(EvidenceBundle b) {
        final List<SourceFeature> sizing = features(b, SourceFeatureKind.ALLOCATION_SIZING);
        final List<RuleHit> hits = new ArrayList<>();
        for (SourceFeature g : features(b, SourceFeatureKind.BOUNDS_CHECK_ADDED)) {
            final Set<EvidenceRef> refs = new LinkedHashSet<>(featureRefs(g));
            for (SourceFeature f : sizing) {
                if (sharesHunk(f, g)) {
                    refs.addAll(featureRefs(f));
                }
            }
            hits.add(new RuleHit(List.of(g.filePath(), g.line(), g.detail()), new ArrayList<>(refs)));
        }
        return hits;
    }

    static List<RuleHit> featureHits(EvidenceBundle b, SourceFeatureKind kind) {
        final List<RuleHit> hits = new ArrayList<>();
        for (SourceFeature f : features(b, kind)) {
            hits.add(new RuleHit(List.of(f.filePath(), f.line(), f.detail()), featureRefs(f)));
        }
        return hits;
    }

    static List<RuleHit> sidedFeatureHits(EvidenceBundle b, SourceFeatureKind kind) {
        final List<RuleHit> hits = new ArrayList<>();
        for (SourceFeature f : features(b, kind)) {
            final String verb = f.side() == ChangeSide.ADDED ? "added" : "removed";
            hits.add(new RuleHit(List.of(verb, f.filePath(), f.line(), f.snippet()), featureRefs(f)));
        }
        return hits;
    }

    static List<RuleHit> logCorrelatedChangedCode(EvidenceBundle b) {
        final String toArtifact = b.binaryFeaturesTo().artifactId();
        final List<BinaryDiffPair> unmatched = b.binaryDiffPairs().stream()
                .filter(p -> !p.matched())
                .collect(Collectors.toList());
        final List<RuleHit> hits = new ArrayList<>();
        for (LogToBinaryMatch m : b.logToBinaryMatches()) {
            final List<DiffHunk> hunks = new ArrayList<>();
            for (DiffHunk h : b.diffHunks()) {
                if (h.lines().stream().anyMatch(l -> l.substring(1).contains(m.fragment()))) {
                    hunks.add(h);
                }
            }
            final List<BinaryDiffPair> named = new ArrayList<>();
            for (BinaryDiffPair p : unmatched) {
                final String name = bareSymbolName(p.displayName());
                if (name.length() >= MIN_SYMBOL_NAME && m.matchedString().contains(name)) {
                    named.add(p);
                }
            }
            if (hunks.isEmpty() && named.isEmpty()) {
                continue;
            }

            final List<EvidenceRef> refs = new ArrayList<>();
            refs.add(EvidenceRef.match(m.matchId()));
            refs.add(EvidenceRef.template(m.templateId()));
            refs.add(EvidenceRef.string(toArtifact, m.stringId()));
            hunks.forEach(h -> refs.add(EvidenceRef.hunk(h.hunkId())));
            named.forEach(p -> refs.add(EvidenceRef.pair(p.pairId())));

            final String tiedTo = !hunks.isEmpty()
                    ? "changed lines in " + hunks.stream().map(DiffHunk::filePath).distinct()
                            .collect(Collectors.joining(", "))
                    : "unmatched symbol " + named.stream().map(BinaryDiffPair::displayName)
                            .collect(Collectors.joining(", "));
            hits.add(new RuleHit(List.of(formatOf(b, m.templateId()), m.matchedString(), tiedTo), refs));
        }
        return hits;
    }

    static List<RuleHit> newLogTemplate(EvidenceBundle b) {
        if (b.baselineLogTemplates().isEmpty()) {
            return List.of();
        }
        final Set<String> baseline = new HashSet<>();
        b.baselineLogTemplates().forEach(t -> baseline.add(t.templateId()));
        final List<RuleHit> hits = new ArrayList<>();
        for (LogTemplate t : b.logTemplates()) {
            if (!baseline.contains(t.templateId())) {
                hits.add(new RuleHit(List.of(t.subsystem(), t.category(), t.formatString()),
                        List.of(EvidenceRef.template(t.templateId()))));
            }
        }
        return hits;
    }

    static List<RuleHit> binaryStringsAdded(EvidenceBundle b) {
        if (!b.hasSourceChanges() || !bothComplete(b)) {
            return List.of();
        }
        final Set<String> before = new HashSet<>(b.binaryFeaturesFrom().strings());
        final List<String> added = b.binaryFeaturesTo().strings().stream()
                .filter(s -> !before.contains(s))
                .collect(Collectors.toList());
        if (added.isEmpty()) {
            return List.of();
        }
        final String art = b.binaryFeaturesTo().artifactId();
        final List<EvidenceRef> refs = added.stream()
                .limit(MAX_CITED_STRINGS)
                .map(s -> EvidenceRef.string(art, Ids.stringId(s)))
                .collect(Collectors.toList());
        return List.of(new RuleHit(List.of(added.size(), abbreviate(added.get(0))), refs));
    }

    static List<RuleHit> unmatchedBinarySymbol(EvidenceBundle b) {
        if (!b.hasSourceChanges() || !bothComplete(b)) {
            return List.of();
        }
        final List<RuleHit> hits = new ArrayList<>();
        for (BinaryDiffPair p : b.binaryDiffPairs()) {
            if (p.matched()) {
                continue;
            }
            final boolean onlyOld = p.fromSymbolId() != null;
            final EvidenceRef symbol = onlyOld
                    ? EvidenceRef.symbol(b.binaryFeaturesFrom().artifactId(), p.fromSymbolId())
                    : EvidenceRef.symbol(b.binaryFeaturesTo().artifactId(), p.toSymbolId());
            hits.add(new RuleHit(List.of(p.displayName(), onlyOld ? "old" : "new"),
                    List.of(EvidenceRef.pair(p.pairId()), symbol)));
        }
        return hits;
    }

    private static List<SourceFeature> features(EvidenceBundle b, SourceFeatureKind kind) {
        return b.sourceFeatures().stream().filter(f -> f.kind() == kind).collect(Collectors.toList());
    }

    private static boolean sharesHunk(SourceFeature a, SourceFeature b) {
        return a.hunkIds().stream().anyMatch(b.hunkIds()::contains);
    }

    private static List<EvidenceRef> featureRefs(SourceFeature f) {
        final List<EvidenceRef> refs = new ArrayList<>();
        refs.add(EvidenceRef.feature(f.featureId()));
        f.hunkIds().forEach(h -> refs.add(EvidenceRef.hunk(h)));
        return refs;
    }

    private static boolean bothComplete(EvidenceBundle b) {
        return b.binaryFeaturesFrom().status() == ExtractionStatus.COMPLETE
                && b.binaryFeaturesTo().status() == ExtractionStatus.COMPLETE;
    }

    private static String formatOf(EvidenceBundle b, String templateId) {
        return b.logTemplates().stream()
                .filter(t -> t.templateId().equals(templateId))
                .map(LogTemplate::formatString)
                .findFirst()
                .orElse(templateId);
    }

    private static String bareSymbolName(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '_') {
            i++;
        }
        return name.substring(i);
    }

    private static String abbreviate(String s) {
        return s.length() > 80 ? s.substring(0, 80) + "..." : s;
    }
}
