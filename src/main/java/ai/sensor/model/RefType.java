package ai.sensor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of evidence an {@link EvidenceRef} points at. Resolution is always scoped by kind.
 */
public enum RefType {
    DIFF_HUNK("diff_hunk"),
    SOURCE_FEATURE("source_feature"),
    SYMBOL("symbol"),
    STRING("string"),
    IMPORT("import"),
    BINARY_DIFF_PAIR("binary_diff_pair"),
    LOG_TEMPLATE("log_template"),
    LOG_BINARY_MATCH("log_binary_match");

    private final String label;

    RefType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
