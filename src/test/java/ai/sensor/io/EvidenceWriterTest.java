package ai.sensor.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.sensor.bundle.BundleDraft;
import ai.sensor.bundle.EvidenceBundleAssembler;
import ai.sensor.model.ChangeSide;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ScoreResult;
import ai.sensor.model.SourceDiff;
import ai.sensor.model.SourceFeatureKind;
import ai.sensor.report.HypothesisGenerator;
import ai.sensor.report.TriageReport;
import ai.sensor.report.TriageReportGenerator;
import ai.sensor.report.VulnHypothesis;
import ai.sensor.score.ScoringEngine;

import static ai.sensor.TestEvidence.COMPONENT;
import static ai.sensor.TestEvidence.binary;
import static ai.sensor.TestEvidence.feature;
import static ai.sensor.TestEvidence.hunk;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvidenceWriterTest {

    @TempDir
    Path tmp;

    @Test
    void shouldWriteAllOutputsWithIndex() throws IOException {
        final Path out = tmp.resolve("run");

        write(out);

        for (String f : List.of(EvidenceWriter.BUNDLE_FILE, EvidenceWriter.SCORE_FILE, EvidenceWriter.TRIAGE_FILE,
                EvidenceWriter.HYPOTHESES_FILE, EvidenceWriter.INDEX_FILE)) {
            assertTrue(Files.isRegularFile(out.resolve(f)), f);
        }
        final JsonNode index = new ObjectMapper().readTree(out.resolve(EvidenceWriter.INDEX_FILE).toFile());
        assertEquals(EvidenceWriter.SCHEMA_VERSION, index.get("schema").asText());
        assertEquals("diff:parserd@b1..b2", index.get("diffId").asText());
        assertEquals(1, index.get("summary").get("hunks").asInt());
        assertEquals(1.5, index.get("summary").get("totalScore").asDouble());

        final JsonNode bundle = new ObjectMapper().readTree(out.resolve(EvidenceWriter.BUNDLE_FILE).toFile());
        assertEquals("bounds-check-added", bundle.get("sourceFeatures").get(0).get("kind").asText());
        assertEquals("COMPLETE", bundle.get("binaryFeaturesTo").get("status").asText());
    }

    @Test
    void shouldWriteIdenticalBytesOnRerun() throws IOException {
        final Path first = tmp.resolve("first");
        final Path second = tmp.resolve("second");

        write(first);
        write(second);

        for (String f : List.of(EvidenceWriter.BUNDLE_FILE, EvidenceWriter.SCORE_FILE, EvidenceWriter.TRIAGE_FILE,
                EvidenceWriter.HYPOTHESES_FILE, EvidenceWriter.INDEX_FILE)) {
            assertArrayEquals(Files.readAllBytes(first.resolve(f)), Files.readAllBytes(second.resolve(f)), f);
        }
    }

    private static void write(Path out) throws IOException {
        final DiffHunk h = hunk("src/parser.c", 14, 15, List.of(),
                List.of("    if (count > SIZE_MAX / sizeof(struct entry))", "        return NULL;"));
        final EvidenceBundle bundle = new EvidenceBundleAssembler().assemble(new BundleDraft("b1", "b2", COMPONENT)
                .sourceDiff(new SourceDiff(List.of(h),
                        List.of(feature(SourceFeatureKind.BOUNDS_CHECK_ADDED, ChangeSide.ADDED, h, "guards malloc")),
                        List.of()))
                .binaries(binary("b1", List.of("usage: parserd"), "_main"),
                        binary("b2", List.of("usage: parserd"), "_main")));
        final ScoreResult score = new ScoringEngine().score(bundle);
        final TriageReport report = new TriageReportGenerator().generate(score);
        final List<VulnHypothesis> hypotheses = new HypothesisGenerator().generate(bundle);

        new EvidenceWriter(out).writeAll(bundle, score, report, hypotheses);
    }
}
