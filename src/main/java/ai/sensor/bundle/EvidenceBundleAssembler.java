package ai.sensor.bundle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.Ids;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.Notice;
import ai.sensor.model.SourceFeature;

/**
 * Merges extractor outputs into one {@link EvidenceBundle}. Validates structure only:
 * every id unique within its kind and every cross-reference resolvable. A violation throws
 * {@link EvidenceIntegrityException}; nothing is dropped silently.
 */
public final class EvidenceBundleAssembler {

    private static final Logger log = LoggerFactory.getLogger(EvidenceBundleAssembler.class);

    public EvidenceBundle assemble(BundleDraft draft) {
        Objects.requireNonNull(draft, "draft");
        final String diffId = Ids.diffId(draft.buildFrom(), draft.buildTo(), draft.component());
        final BinaryFeatureSet from = draft.binaryFrom();
        final BinaryFeatureSet to = draft.binaryTo();

        checkKey(from, draft.buildFrom(), draft.component(), "from");
        checkKey(to, draft.buildTo(), draft.component(), "to");

        final List<DiffHunk> hunks = new ArrayList<>(draft.sourceDiff().hunks());
        hunks.sort(Comparator.comparing(DiffHunk::filePath)
                .thenComparingInt(DiffHunk::oldStart)
                .thenComparingInt(DiffHunk::newStart)
                .thenComparing(DiffHunk::hunkId));
        final Map<String, Integer> hunkPosition = new HashMap<>();
        for (int i = 0; i < hunks.size(); i++) {
            if (hunkPosition.put(hunks.get(i).hunkId(), i) != null) {
                throw duplicate("hunk", hunks.get(i).hunkId());
            }
        }

        final List<SourceFeature> features = new ArrayList<>(draft.sourceDiff().features());
        for (SourceFeature f : features) {
            for (String h : f.hunkIds()) {
                if (!hunkPosition.containsKey(h)) {
                    throw new EvidenceIntegrityException("feature " + f.featureId() + " cites unknown hunk " + h);
                }
            }
        }
        requireUnique(features, SourceFeature::featureId, "feature");
        features.sort(Comparator.<SourceFeature>comparingInt(f -> hunkPosition.get(f.primaryHunkId()))
                .thenComparing(SourceFeature::kind)
                .thenComparing(f -> f.side().ordinal(), Comparator.reverseOrder())
                .thenComparing(SourceFeature::featureId));

        requireUnique(from.symbols(), BinarySymbol::symbolId, "symbol in " + from.artifactId());
        requireUnique(to.symbols(), BinarySymbol::symbolId, "symbol in " + to.artifactId());
        requireUnique(from.strings(), Ids::stringId, "string in " + from.artifactId());
        requireUnique(to.strings(), Ids::stringId, "string in " + to.artifactId());

        final Set<String> fromSymbols = ids(from.symbols(), BinarySymbol::symbolId);
        final Set<String> toSymbols = ids(to.symbols(), BinarySymbol::symbolId);
        requireUnique(draft.pairs(), BinaryDiffPair::pairId, "binary diff pair");
        for (BinaryDiffPair p : draft.pairs()) {
            if (p.fromSymbolId() != null && !fromSymbols.contains(p.fromSymbolId())) {
                throw new EvidenceIntegrityException("pair " + p.pairId() + " cites symbol " + p.fromSymbolId()
                        + " absent from " + from.artifactId());
            }
            if (p.toSymbolId() != null && !toSymbols.contains(p.toSymbolId())) {
                throw new EvidenceIntegrityException("pair " + p.pairId() + " cites symbol " + p.toSymbolId()
                        + " absent from " + to.artifactId());
            }
        }

        requireUnique(draft.templates(), LogTemplate::templateId, "log template");
        requireUnique(draft.baselineTemplates(), LogTemplate::templateId, "baseline log template");
        final Set<String> templateIds = ids(draft.templates(), LogTemplate::templateId);
        final Set<String> toStrings = ids(to.strings(), Ids::stringId);
        requireUnique(draft.matches(), LogToBinaryMatch::matchId, "log/binary match");
        for (LogToBinaryMatch m : draft.matches()) {
            if (!templateIds.contains(m.templateId())) {
                throw new EvidenceIntegrityException("match " + m.matchId() + " cites unknown template "
                        + m.templateId());
            }
            if (!toStrings.contains(m.stringId()) || !m.stringId().equals(Ids.stringId(m.matchedString()))) {
                throw new EvidenceIntegrityException("match " + m.matchId() + " cites string " + m.stringId()
                        + " absent from " + to.artifactId());
            }
        }

        final List<Notice> notices = new ArrayList<>(draft.sourceDiff().notices());
        for (String n : from.notices()) {
            notices.add(new Notice(from.artifactId(), n));
        }
        for (String n : to.notices()) {
            notices.add(new Notice(to.artifactId(), n));
        }
        notices.addAll(draft.notices());

        final EvidenceBundle bundle = new EvidenceBundle(
                diffId,
                draft.buildFrom(),
                draft.buildTo(),
                draft.component(),
                hunks,
                features,
                from,
                to,
                draft.pairs(),
                draft.templates(),
                draft.baselineTemplates(),
                draft.matches(),
                notices);
        log.info("Assembled {}: {} hunk(s), {} feature(s), {} pair(s), {} template(s), {} match(es), {} notice(s)",
                diffId, hunks.size(), features.size(), bundle.binaryDiffPairs().size(),
                bundle.logTemplates().size(), bundle.logToBinaryMatches().size(), notices.size());
        return bundle;
    }

    private static void checkKey(BinaryFeatureSet set, String buildId, String component, String side) {
        if (!set.buildId().equals(buildId) || !set.component().equals(component)) {
            throw new EvidenceIntegrityException(side + " binary features belong to " + set.buildId() + "/"
                    + set.component() + ", expected " + buildId + "/" + component);
        }
    }

    private static <T> void requireUnique(List<T> items, Function<T, String> id, String kind) {
        final Set<String> seen = new HashSet<>();
        for (T item : items) {
            final String key = id.apply(item);
            if (!seen.add(key)) {
                throw duplicate(kind, key);
            }
        }
    }

    private static <T> Set<String> ids(List<T> items, Function<T, String> id) {
        final Set<String> out = new HashSet<>();
        for (T item : items) {
            out.add(id.apply(item));
        }
        return out;
    }

    private static EvidenceIntegrityException duplicate(String kind, String id) {
        return new EvidenceIntegrityException("duplicate " + kind + " id: " + id);
    }
}
