package ai.sensor.model;

/**
 * How a {@link BinaryDiffPair} was formed. NONE records a symbol left unmatched.
 */
public enum MatchBasis {
    NAME,
    ADDRESS,
    NONE
}
