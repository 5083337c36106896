package ai.sensor.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.ScoreResult;
import ai.sensor.report.TriageReport;
import ai.sensor.report.VulnHypothesis;

/**
 * Writes a diff run's outputs as deterministic JSON: same input objects, same bytes.
 * Storing the files afterwards is the caller's business.
 */
public final class EvidenceWriter {

    public static final String SCHEMA_VERSION = "oss-sensor/v1";

    public static final String BUNDLE_FILE = "evidence-bundle.json";
    public static final String SCORE_FILE = "score.json";
    public static final String TRIAGE_FILE = "triage-report.json";
    public static final String HYPOTHESES_FILE = "hypotheses.json";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public EvidenceWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public void writeAll(EvidenceBundle bundle,
                         ScoreResult score,
                         TriageReport report,
                         List<VulnHypothesis> hypotheses) throws IOException {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(score, "score");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(hypotheses, "hypotheses");

        Files.createDirectories(outDir);

        writeJson(outDir.resolve(BUNDLE_FILE), bundle);
        writeJson(outDir.resolve(SCORE_FILE), score);
        writeJson(outDir.resolve(TRIAGE_FILE), report);
        writeJson(outDir.resolve(HYPOTHESES_FILE), new Hypotheses(bundle.diffId(), hypotheses));

        final RunIndex idx = new RunIndex(
                SCHEMA_VERSION,
                bundle.diffId(),
                score.rulesVersion(),
                BUNDLE_FILE,
                SCORE_FILE,
                TRIAGE_FILE,
                HYPOTHESES_FILE,
                new Summary(
                        bundle.diffHunks().size(),
                        bundle.sourceFeatures().size(),
                        bundle.binaryDiffPairs().size(),
                        bundle.logTemplates().size(),
                        bundle.logToBinaryMatches().size(),
                        bundle.notices().size(),
                        score.reasons().size(),
                        score.totalScore()));
        writeJson(outDir.resolve(INDEX_FILE), idx);
    }

    public String toJson(Object value) throws JsonProcessingException {
        return jsonMapper.writeValueAsString(value);
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    // --- envelope records ---

    public record Hypotheses(
            String diffId,
            List<VulnHypothesis> hypotheses
    ) {
    }

    public record RunIndex(
            String schema,
            String diffId,
            String rulesVersion,
            String bundle,
            String score,
            String triageReport,
            String hypotheses,
            Summary summary
    ) {
    }

    public record Summary(
            int hunks,
            int features,
            int binaryDiffPairs,
            int logTemplates,
            int logToBinaryMatches,
            int notices,
            int reasons,
            double totalScore
    ) {
    }
}
