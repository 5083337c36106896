package ai.sensor.model;

import java.util.List;
import java.util.Objects;

/**
 * All evidence for one (buildFrom, buildTo, component) diff. Built once by the assembler and
 * never changed afterwards; a re-run produces a new bundle.
 * <p>
 * logTemplates come from the to build's stream and are the ones correlated with the to image;
 * baselineLogTemplates come from the from build and only serve as a comparison set.
 */
public record EvidenceBundle(
        String diffId,
        String buildFrom,
        String buildTo,
        String component,
        List<DiffHunk> diffHunks,
        List<SourceFeature> sourceFeatures,
        BinaryFeatureSet binaryFeaturesFrom,
        BinaryFeatureSet binaryFeaturesTo,
        List<BinaryDiffPair> binaryDiffPairs,
        List<LogTemplate> logTemplates,
        List<LogTemplate> baselineLogTemplates,
        List<LogToBinaryMatch> logToBinaryMatches,
        List<Notice> notices
) {
    public EvidenceBundle {
        Objects.requireNonNull(diffId, "diffId");
        Objects.requireNonNull(buildFrom, "buildFrom");
        Objects.requireNonNull(buildTo, "buildTo");
        Objects.requireNonNull(component, "component");
        diffHunks = List.copyOf(diffHunks);
        sourceFeatures = List.copyOf(sourceFeatures);
        Objects.requireNonNull(binaryFeaturesFrom, "binaryFeaturesFrom");
        Objects.requireNonNull(binaryFeaturesTo, "binaryFeaturesTo");
        binaryDiffPairs = List.copyOf(binaryDiffPairs);
        logTemplates = List.copyOf(logTemplates);
        baselineLogTemplates = List.copyOf(baselineLogTemplates);
        logToBinaryMatches = List.copyOf(logToBinaryMatches);
        notices = List.copyOf(notices);
    }

    public boolean hasSourceChanges() {
        return !diffHunks.isEmpty();
    }
}
