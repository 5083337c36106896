package ai.sensor.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Symbol pairing between the from and to images. Exactly one side is null when basis is NONE.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BinaryDiffPair(
        String pairId,
        String fromSymbolId,
        String fromName,
        String toSymbolId,
        String toName,
        MatchBasis basis
) {
    public BinaryDiffPair {
        Objects.requireNonNull(pairId, "pairId");
        Objects.requireNonNull(basis, "basis");
        if (fromSymbolId == null && toSymbolId == null) {
            throw new IllegalArgumentException("pair " + pairId + " has neither side");
        }
        if (basis != MatchBasis.NONE && (fromSymbolId == null || toSymbolId == null)) {
            throw new IllegalArgumentException("matched pair " + pairId + " is missing a side");
        }
    }

    public boolean matched() {
        return basis != MatchBasis.NONE;
    }

    /**
     * Name of whichever side is present, preferring the to side.
     */
    public String displayName() {
        return toName != null ? toName : fromName;
    }
}
