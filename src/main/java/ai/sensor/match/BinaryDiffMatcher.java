package ai.sensor.match;

import java.util.List;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;

/**
 * Pairs the symbols of two builds' images. Implementations must be deterministic and must
 * account for every symbol of both sides exactly once, matched or not.
 */
public interface BinaryDiffMatcher {

    /**
     * Registry key, also recorded in logs.
     */
    String name();

    List<BinaryDiffPair> match(BinaryFeatureSet from, BinaryFeatureSet to);
}
