package ai.sensor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceFeatureKind {
    ALLOCATION_SIZING("allocation-sizing"),
    BOUNDS_CHECK_ADDED("bounds-check-added"),
    BOUNDS_CHECK_REMOVED("bounds-check-removed"),
    PARSING_LOGIC("parsing-logic"),
    PRIVILEGE_CHECK("privilege-check");

    private final String label;

    SourceFeatureKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
