package ai.sensor.pipeline;

import java.nio.file.Path;
import java.util.Objects;

import ai.sensor.model.Ids;

/**
 * Resolved artifacts of one build of a component. Any path may be null when that artifact
 * was not supplied; the pipeline never goes looking for it.
 */
public record ArtifactSet(
        String buildId,
        String component,
        Path sourceDir,
        Path binaryPath,
        Path logPath
) {
    public ArtifactSet {
        Objects.requireNonNull(buildId, "buildId");
        Objects.requireNonNull(component, "component");
    }

    public String logArtifactId() {
        return Ids.artifactId(buildId, component, "logs");
    }
}
