package ai.sensor.model;

import java.util.List;
import java.util.Objects;

/**
 * Features read from one binary artifact, keyed by (buildId, component).
 * A degraded status always comes with empty lists and a notice saying why.
 */
public record BinaryFeatureSet(
        String buildId,
        String component,
        String artifactId,
        BinaryFormat format,
        ExtractionStatus status,
        List<String> notices,
        List<String> strings,
        List<String> imports,
        List<BinarySymbol> symbols,
        ObjcMetadataStub objcMetadataStub
) {
    public BinaryFeatureSet {
        Objects.requireNonNull(buildId, "buildId");
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(status, "status");
        notices = List.copyOf(notices);
        strings = List.copyOf(strings);
        imports = List.copyOf(imports);
        symbols = List.copyOf(symbols);
        objcMetadataStub = objcMetadataStub == null ? ObjcMetadataStub.EMPTY : objcMetadataStub;
    }

    public static BinaryFeatureSet degraded(String buildId, String component, BinaryFormat format,
                                            ExtractionStatus status, String notice) {
        if (!status.degraded()) {
            throw new IllegalArgumentException("not a degraded status: " + status);
        }
        return new BinaryFeatureSet(buildId, component, artifactId(buildId, component), format, status,
                List.of(notice), List.of(), List.of(), List.of(), ObjcMetadataStub.EMPTY);
    }

    public static BinaryFeatureSet absent(String buildId, String component) {
        return degraded(buildId, component, BinaryFormat.UNKNOWN, ExtractionStatus.ABSENT,
                "no binary artifact supplied");
    }

    public static String artifactId(String buildId, String component) {
        return Ids.artifactId(buildId, component, "binary");
    }
}
