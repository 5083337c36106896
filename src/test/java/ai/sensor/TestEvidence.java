package ai.sensor;

import java.util.ArrayList;
import java.util.List;

import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinaryFormat;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.ChangeSide;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.ExtractionStatus;
import ai.sensor.model.Ids;
import ai.sensor.model.ObjcMetadataStub;
import ai.sensor.model.SourceFeature;
import ai.sensor.model.SourceFeatureKind;

/**
 * Hand-built evidence units for tests that do not need real trees or images.
 */
public final class TestEvidence {

    public static final String COMPONENT = "parserd";

    private TestEvidence() {
    }

    public static BinaryFeatureSet binary(String buildId, List<String> strings, String... symbolNames) {
        final List<BinarySymbol> symbols = new ArrayList<>();
        for (int i = 0; i < symbolNames.length; i++) {
            int occurrence = 1;
            for (int j = 0; j < i; j++) {
                if (symbolNames[j].equals(symbolNames[i])) {
                    occurrence++;
                }
            }
            symbols.add(new BinarySymbol(Ids.symbolId(symbolNames[i], occurrence), symbolNames[i],
                    0x1000L + 16L * i, true));
        }
        return new BinaryFeatureSet(buildId, COMPONENT, BinaryFeatureSet.artifactId(buildId, COMPONENT),
                BinaryFormat.MACH_O, ExtractionStatus.COMPLETE, List.of(), strings, List.of(), symbols,
                ObjcMetadataStub.EMPTY);
    }

    public static DiffHunk hunk(String path, int oldStart, int newStart, List<String> removed, List<String> added) {
        final List<String> lines = new ArrayList<>();
        removed.forEach(l -> lines.add("-" + l));
        added.forEach(l -> lines.add("+" + l));
        final String id = Ids.hunkId(path, oldStart, removed.size(), newStart, added.size(), lines);
        return new DiffHunk(id, path, oldStart, removed.size(), newStart, added.size(), lines);
    }

    public static SourceFeature feature(SourceFeatureKind kind, ChangeSide side, DiffHunk hunk, String detail) {
        final int line = side == ChangeSide.ADDED ? hunk.newStart() : hunk.oldStart();
        return new SourceFeature(Ids.featureId(kind, side, hunk.hunkId()), kind, side, List.of(hunk.hunkId()),
                hunk.filePath(), line, "", detail, false);
    }
}
