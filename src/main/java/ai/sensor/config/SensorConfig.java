package ai.sensor.config;

import java.util.Map;

import ai.sensor.score.ScoringProfile;

/**
 * Tunables of the pipeline, bound from {@code sensor-defaults.json} plus an optional overlay.
 */
public record SensorConfig(
        Binary binary,
        Logs logs,
        Source source,
        Pipeline pipeline,
        Scoring scoring
) {
    public record Binary(int minStringLength) {
    }

    public record Logs(int minFragmentLength) {
    }

    public record Source(int lookaheadLines) {
    }

    public record Pipeline(
            int parallelism,  // worker threads for per-build extraction
            String matcher    // BinaryDiffMatchers key
    ) {
    }

    public record Scoring(String version, Map<String, Double> weights) {
    }

    public ScoringProfile scoringProfile() {
        return new ScoringProfile(scoring.version(), scoring.weights());
    }
}
