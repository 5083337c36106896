package ai.sensor.model;

import java.util.List;
import java.util.Objects;

/**
 * Security-relevant observation derived from one or more hunks of the same diff.
 */
public record SourceFeature(
        String featureId,
        SourceFeatureKind kind,
        ChangeSide side,
        List<String> hunkIds,  // first entry is the hunk the pattern was found in
        String filePath,
        int line,              // 1-based, in the file of the feature's side
        String snippet,
        String detail,
        boolean guarded        // allocation sizing only: an existing check already precedes the site
) {
    public SourceFeature {
        Objects.requireNonNull(featureId, "featureId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
        hunkIds = List.copyOf(hunkIds);
        if (hunkIds.isEmpty()) {
            throw new IllegalArgumentException("feature " + featureId + " cites no hunk");
        }
        Objects.requireNonNull(filePath, "filePath");
        snippet = snippet == null ? "" : snippet;
        detail = detail == null ? "" : detail;
    }

    public String primaryHunkId() {
        return hunkIds.get(0);
    }
}
