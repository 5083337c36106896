package ai.sensor.model;

/**
 * Outcome of reading one binary artifact.
 * <p>
 * Every status other than COMPLETE comes with empty feature lists and at least one notice.
 * UNSUPPORTED is kept apart from MALFORMED so callers can skip rather than alarm.
 */
public enum ExtractionStatus {
    COMPLETE,
    TRUNCATED,
    MALFORMED,
    UNREADABLE,
    UNSUPPORTED,
    ABSENT;

    public boolean degraded() {
        return this != COMPLETE;
    }
}
