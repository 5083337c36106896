package ai.sensor.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The only way a reason, report or enrichment may point at evidence.
 * artifactId scopes binary evidence to the from/to image; it is null for diff-level evidence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceRef(
        RefType refType,
        String artifactId,
        String stableId
) {
    public EvidenceRef {
        Objects.requireNonNull(refType, "refType");
        Objects.requireNonNull(stableId, "stableId");
    }

    public static EvidenceRef hunk(String hunkId) {
        return new EvidenceRef(RefType.DIFF_HUNK, null, hunkId);
    }

    public static EvidenceRef feature(String featureId) {
        return new EvidenceRef(RefType.SOURCE_FEATURE, null, featureId);
    }

    public static EvidenceRef symbol(String artifactId, String symbolId) {
        return new EvidenceRef(RefType.SYMBOL, artifactId, symbolId);
    }

    public static EvidenceRef string(String artifactId, String stringId) {
        return new EvidenceRef(RefType.STRING, artifactId, stringId);
    }

    public static EvidenceRef pair(String pairId) {
        return new EvidenceRef(RefType.BINARY_DIFF_PAIR, null, pairId);
    }

    public static EvidenceRef template(String templateId) {
        return new EvidenceRef(RefType.LOG_TEMPLATE, null, templateId);
    }

    public static EvidenceRef match(String matchId) {
        return new EvidenceRef(RefType.LOG_BINARY_MATCH, null, matchId);
    }
}
