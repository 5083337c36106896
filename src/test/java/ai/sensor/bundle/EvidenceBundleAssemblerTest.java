package ai.sensor.bundle;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.ChangeSide;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ExtractionStatus;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.MatchBasis;
import ai.sensor.model.Notice;
import ai.sensor.model.SourceDiff;
import ai.sensor.model.SourceFeature;
import ai.sensor.model.SourceFeatureKind;

import static ai.sensor.TestEvidence.COMPONENT;
import static ai.sensor.TestEvidence.binary;
import static ai.sensor.TestEvidence.feature;
import static ai.sensor.TestEvidence.hunk;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvidenceBundleAssemblerTest {

    private final EvidenceBundleAssembler assembler = new EvidenceBundleAssembler();

    @Test
    void shouldOrderHunksAndFeaturesByPosition() {
        final DiffHunk late = hunk("src/parser.c", 40, 41, List.of(), List.of("if (n > max)"));
        final DiffHunk early = hunk("src/parser.c", 10, 10, List.of("x = n * 4;"), List.of());
        final DiffHunk other = hunk("lib/io.c", 3, 3, List.of("a"), List.of("b"));
        final SourceFeature onLate = feature(SourceFeatureKind.BOUNDS_CHECK_ADDED, ChangeSide.ADDED, late, "");
        final SourceFeature addedOnEarly = feature(SourceFeatureKind.PARSING_LOGIC, ChangeSide.ADDED, early, "");
        final SourceFeature removedOnEarly = feature(SourceFeatureKind.PARSING_LOGIC, ChangeSide.REMOVED, early, "");
        final SourceFeature sizingOnEarly = feature(SourceFeatureKind.ALLOCATION_SIZING, ChangeSide.REMOVED, early, "");

        final EvidenceBundle bundle = assembler.assemble(new BundleDraft("b1", "b2", COMPONENT)
                .sourceDiff(new SourceDiff(List.of(late, early, other),
                        List.of(onLate, addedOnEarly, removedOnEarly, sizingOnEarly), List.of())));

        assertEquals("diff:parserd@b1..b2", bundle.diffId());
        assertEquals(List.of(other, early, late), bundle.diffHunks());
        assertEquals(List.of(sizingOnEarly, removedOnEarly, addedOnEarly, onLate), bundle.sourceFeatures());
    }

    @Test
    void shouldDefaultMissingBinariesToAbsentAndCollectNotices() {
        final EvidenceBundle bundle = assembler.assemble(new BundleDraft("b1", "b2", COMPONENT)
                .sourceDiff(new SourceDiff(List.of(), List.of(), List.of(new Notice("blob.c", "skipped: binary"))))
                .notice(new Notice("art:b2/parserd/logs", "unreadable: denied")));

        assertEquals(ExtractionStatus.ABSENT, bundle.binaryFeaturesFrom().status());
        assertEquals(ExtractionStatus.ABSENT, bundle.binaryFeaturesTo().status());
        assertEquals(List.of("blob.c", "art:b1/parserd/binary", "art:b2/parserd/binary", "art:b2/parserd/logs"),
                bundle.notices().stream().map(Notice::subject).toList());
    }

    @Test
    void shouldRejectDuplicateHunkIds() {
        final DiffHunk h = hunk("a.c", 1, 1, List.of("x"), List.of("y"));

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT).sourceDiff(new SourceDiff(List.of(h, h), List.of(), List.of()))));
    }

    @Test
    void shouldRejectFeatureCitingUnknownHunk() {
        final DiffHunk kept = hunk("a.c", 1, 1, List.of("x"), List.of("y"));
        final DiffHunk dropped = hunk("a.c", 9, 9, List.of("p"), List.of("q"));
        final SourceFeature dangling = feature(SourceFeatureKind.PARSING_LOGIC, ChangeSide.ADDED, dropped, "");

        final EvidenceIntegrityException ex = assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT)
                        .sourceDiff(new SourceDiff(List.of(kept), List.of(dangling), List.of()))));
        assertTrue(ex.getMessage().contains(dropped.hunkId()));
    }

    @Test
    void shouldRejectPairCitingAbsentSymbol() {
        final BinaryFeatureSet from = binary("b1", List.of(), "_main");
        final BinaryFeatureSet to = binary("b2", List.of(), "_main");
        final BinaryDiffPair bogus = new BinaryDiffPair("pair:_gone->-#1", "sym:_gone", "_gone", null, null,
                MatchBasis.NONE);

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT).binaries(from, to).binaryDiffPairs(List.of(bogus))));
    }

    @Test
    void shouldRejectBinaryFromAnotherBuild() {
        final BinaryFeatureSet stray = binary("b9", List.of());

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT).binaries(stray, binary("b2", List.of()))));
    }

    @Test
    void shouldRejectMatchAgainstStringMissingFromToImage() {
        final LogTemplate t = LogTemplate.of("default", "default", "opened table <str>", "opened table \"x\"");
        final BinaryFeatureSet to = binary("b2", List.of("unrelated string"));
        final LogToBinaryMatch m = LogToBinaryMatch.of(t.templateId(), "opened table", "opened table %s");

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT)
                        .binaries(binary("b1", List.of()), to)
                        .logTemplates(List.of(t), List.of())
                        .logToBinaryMatches(List.of(m))));
    }

    @Test
    void shouldRejectMatchCitingUnknownTemplate() {
        final LogTemplate t = LogTemplate.of("default", "default", "opened table <str>", "");
        final BinaryFeatureSet to = binary("b2", List.of("opened table %s"));
        final LogToBinaryMatch m = LogToBinaryMatch.of(t.templateId(), "opened table", "opened table %s");

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT)
                        .binaries(binary("b1", List.of()), to)
                        .logToBinaryMatches(List.of(m))));
    }

    @Test
    void shouldRejectDuplicateTemplates() {
        final LogTemplate t = LogTemplate.of("default", "default", "ready", "ready");

        assertThrows(EvidenceIntegrityException.class, () -> assembler.assemble(
                new BundleDraft("b1", "b2", COMPONENT).logTemplates(List.of(t, t), List.of())));
    }
}
