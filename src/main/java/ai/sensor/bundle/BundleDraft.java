package ai.sensor.bundle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.Notice;
import ai.sensor.model.SourceDiff;

/**
 * Mutable collection point for one diff run's extractor outputs, handed to
 * {@link EvidenceBundleAssembler#assemble(BundleDraft)}.
 */
public final class BundleDraft {

    private final String buildFrom;
    private final String buildTo;
    private final String component;

    private SourceDiff sourceDiff = SourceDiff.EMPTY;
    private BinaryFeatureSet binaryFrom;
    private BinaryFeatureSet binaryTo;
    private List<BinaryDiffPair> pairs = List.of();
    private List<LogTemplate> templates = List.of();
    private List<LogTemplate> baselineTemplates = List.of();
    private List<LogToBinaryMatch> matches = List.of();
    private final List<Notice> notices = new ArrayList<>();

    public BundleDraft(String buildFrom, String buildTo, String component) {
        this.buildFrom = Objects.requireNonNull(buildFrom, "buildFrom");
        this.buildTo = Objects.requireNonNull(buildTo, "buildTo");
        this.component = Objects.requireNonNull(component, "component");
    }

    public BundleDraft sourceDiff(SourceDiff diff) {
        this.sourceDiff = Objects.requireNonNull(diff, "diff");
        return this;
    }

    public BundleDraft binaries(BinaryFeatureSet from, BinaryFeatureSet to) {
        this.binaryFrom = Objects.requireNonNull(from, "from");
        this.binaryTo = Objects.requireNonNull(to, "to");
        return this;
    }

    public BundleDraft binaryDiffPairs(List<BinaryDiffPair> pairs) {
        this.pairs = List.copyOf(pairs);
        return this;
    }

    /**
     * @param templates         to-build templates, correlated with the to image
     * @param baselineTemplates from-build templates
     */
    public BundleDraft logTemplates(List<LogTemplate> templates, List<LogTemplate> baselineTemplates) {
        this.templates = List.copyOf(templates);
        this.baselineTemplates = List.copyOf(baselineTemplates);
        return this;
    }

    public BundleDraft logToBinaryMatches(List<LogToBinaryMatch> matches) {
        this.matches = List.copyOf(matches);
        return this;
    }

    public BundleDraft notice(Notice notice) {
        notices.add(Objects.requireNonNull(notice, "notice"));
        return this;
    }

    String buildFrom() {
        return buildFrom;
    }

    String buildTo() {
        return buildTo;
    }

    String component() {
        return component;
    }

    SourceDiff sourceDiff() {
        return sourceDiff;
    }

    BinaryFeatureSet binaryFrom() {
        return binaryFrom != null ? binaryFrom : BinaryFeatureSet.absent(buildFrom, component);
    }

    BinaryFeatureSet binaryTo() {
        return binaryTo != null ? binaryTo : BinaryFeatureSet.absent(buildTo, component);
    }

    List<BinaryDiffPair> pairs() {
        return pairs;
    }

    List<LogTemplate> templates() {
        return templates;
    }

    List<LogTemplate> baselineTemplates() {
        return baselineTemplates;
    }

    List<LogToBinaryMatch> matches() {
        return matches;
    }

    List<Notice> notices() {
        return notices;
    }
}
