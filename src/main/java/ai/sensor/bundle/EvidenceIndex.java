package ai.sensor.bundle;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.EvidenceRef;
import ai.sensor.model.Ids;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.RefType;
import ai.sensor.model.SourceFeature;

/**
 * Lookup of every stable id a bundle owns, scoped by evidence kind and, for binary evidence,
 * by artifact.
 */
public final class EvidenceIndex {

    private final Map<RefType, Set<String>> diffLevel = new EnumMap<>(RefType.class);
    // refType -> artifactId -> ids
    private final Map<RefType, Map<String, Set<String>>> perArtifact = new EnumMap<>(RefType.class);

    private EvidenceIndex() {
    }

    public static EvidenceIndex of(EvidenceBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        final EvidenceIndex idx = new EvidenceIndex();
        for (DiffHunk h : bundle.diffHunks()) {
            idx.add(RefType.DIFF_HUNK, h.hunkId());
        }
        for (SourceFeature f : bundle.sourceFeatures()) {
            idx.add(RefType.SOURCE_FEATURE, f.featureId());
        }
        for (BinaryDiffPair p : bundle.binaryDiffPairs()) {
            idx.add(RefType.BINARY_DIFF_PAIR, p.pairId());
        }
        for (LogTemplate t : bundle.logTemplates()) {
            idx.add(RefType.LOG_TEMPLATE, t.templateId());
        }
        for (LogTemplate t : bundle.baselineLogTemplates()) {
            idx.add(RefType.LOG_TEMPLATE, t.templateId());
        }
        for (LogToBinaryMatch m : bundle.logToBinaryMatches()) {
            idx.add(RefType.LOG_BINARY_MATCH, m.matchId());
        }
        idx.addBinary(bundle.binaryFeaturesFrom());
        idx.addBinary(bundle.binaryFeaturesTo());
        return idx;
    }

    /**
     * A binary ref without an artifact id resolves against either image.
     */
    public boolean resolves(EvidenceRef ref) {
        Objects.requireNonNull(ref, "ref");
        final Map<String, Set<String>> byArtifact = perArtifact.get(ref.refType());
        if (byArtifact != null) {
            if (ref.artifactId() == null) {
                return byArtifact.values().stream().anyMatch(ids -> ids.contains(ref.stableId()));
            }
            return byArtifact.getOrDefault(ref.artifactId(), Set.of()).contains(ref.stableId());
        }
        return diffLevel.getOrDefault(ref.refType(), Set.of()).contains(ref.stableId());
    }

    public void require(EvidenceRef ref, String citedBy) {
        if (!resolves(ref)) {
            throw new EvidenceIntegrityException(citedBy + " cites " + ref.refType().label() + " '"
                    + ref.stableId() + "'" + (ref.artifactId() != null ? " in " + ref.artifactId() : "")
                    + " which the bundle does not contain");
        }
    }

    public void requireAll(List<EvidenceRef> refs, String citedBy) {
        for (EvidenceRef ref : refs) {
            require(ref, citedBy);
        }
    }

    private void add(RefType type, String id) {
        diffLevel.computeIfAbsent(type, k -> new HashSet<>()).add(id);
    }

    private void addBinary(BinaryFeatureSet set) {
        final String art = set.artifactId();
        for (BinarySymbol s : set.symbols()) {
            addArtifact(RefType.SYMBOL, art, s.symbolId());
        }
        for (String s : set.strings()) {
            addArtifact(RefType.STRING, art, Ids.stringId(s));
        }
        for (String i : set.imports()) {
            addArtifact(RefType.IMPORT, art, Ids.importId(i));
        }
    }

    private void addArtifact(RefType type, String artifactId, String id) {
        perArtifact.computeIfAbsent(type, k -> new HashMap<>())
                .computeIfAbsent(artifactId, k -> new HashSet<>())
                .add(id);
    }
}
