package ai.sensor.model;

import java.util.List;

/**
 * Output of the source diff: ordered hunks, their features, and skip notices.
 */
public record SourceDiff(
        List<DiffHunk> hunks,
        List<SourceFeature> features,
        List<Notice> notices
) {
    public static final SourceDiff EMPTY = new SourceDiff(List.of(), List.of(), List.of());

    public SourceDiff {
        hunks = List.copyOf(hunks);
        features = List.copyOf(features);
        notices = List.copyOf(notices);
    }
}
