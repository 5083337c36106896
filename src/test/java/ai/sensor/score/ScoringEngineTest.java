package ai.sensor.score;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.sensor.bundle.BundleDraft;
import ai.sensor.bundle.EvidenceBundleAssembler;
import ai.sensor.bundle.EvidenceIndex;
import ai.sensor.bundle.EvidenceIntegrityException;
import ai.sensor.io.EvidenceWriter;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.EvidenceRef;
import ai.sensor.model.Reason;
import ai.sensor.model.ScoreResult;
import ai.sensor.scan.Fixtures;
import ai.sensor.scan.SourceDiffAnalyzer;
import ai.sensor.scan.SourceFeatureDetector;
import ai.sensor.scan.SourceTreeWalker;

import static ai.sensor.TestEvidence.COMPONENT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringEngineTest {

    @TempDir
    Path empty;

    private final SourceDiffAnalyzer analyzer =
            new SourceDiffAnalyzer(new SourceTreeWalker(), new SourceFeatureDetector(3));
    private final EvidenceBundleAssembler assembler = new EvidenceBundleAssembler();
    private final ScoringEngine engine = new ScoringEngine();

    @Test
    void shouldScoreUnguardedAllocationAboveAddedGuard() throws IOException {
        final ScoreResult unguarded = engine.score(bundle("b0", empty, "b1", Fixtures.parserBefore()));
        final ScoreResult guarded = engine.score(bundle("b1", Fixtures.parserBefore(), "b2", Fixtures.parserAfter()));

        assertEquals(List.of(ScoringRules.UNGUARDED_ALLOCATION_SIZING, ScoringRules.PARSING_LOGIC_CHANGED),
                unguarded.reasons().stream().map(Reason::ruleId).toList());
        assertEquals(5.0, unguarded.totalScore(), 1e-9);

        assertEquals(1, guarded.reasons().size());
        final Reason reason = guarded.reasons().get(0);
        assertEquals(ScoringRules.ALLOCATION_GUARD_ADDED, reason.ruleId());
        assertEquals(1.5, guarded.totalScore(), 1e-9);
        assertTrue(reason.text().startsWith("Bounds check added at parser.c:15"), reason.text());

        assertTrue(unguarded.totalScore() > guarded.totalScore());
    }

    @Test
    void shouldOnlyCiteEvidenceInsideTheBundle() throws IOException {
        final EvidenceBundle bundle = bundle("b0", empty, "b1", Fixtures.parserBefore());
        final EvidenceIndex index = EvidenceIndex.of(bundle);

        for (Reason r : engine.score(bundle).reasons()) {
            assertFalse(r.evidenceRefs().isEmpty());
            for (EvidenceRef ref : r.evidenceRefs()) {
                assertTrue(index.resolves(ref), ref.toString());
            }
        }
    }

    @Test
    void shouldProduceIdenticalBytesForIdenticalInput() throws IOException {
        final EvidenceWriter writer = new EvidenceWriter(empty);

        final String first = writer.toJson(engine.score(bundle("b1", Fixtures.parserBefore(), "b2", Fixtures.parserAfter())));
        final String second = writer.toJson(engine.score(bundle("b1", Fixtures.parserBefore(), "b2", Fixtures.parserAfter())));

        assertEquals(first, second);
    }

    @Test
    void shouldScoreEmptyBundleAsZero() {
        final ScoreResult result = engine.score(assembler.assemble(new BundleDraft("b1", "b2", COMPONENT)));

        assertEquals(0.0, result.totalScore());
        assertTrue(result.reasons().isEmpty());
        assertEquals(ScoringRules.VERSION, result.rulesVersion());
    }

    @Test
    void shouldApplyProfileWeights() throws IOException {
        final Map<String, Double> weights = new LinkedHashMap<>(ScoringProfile.defaults().weights());
        weights.put(ScoringRules.ALLOCATION_GUARD_ADDED, 4.0);
        final ScoringEngine tuned = new ScoringEngine(new ScoringProfile(ScoringRules.VERSION, weights));

        final ScoreResult result = tuned.score(bundle("b1", Fixtures.parserBefore(), "b2", Fixtures.parserAfter()));

        assertEquals(4.0, result.totalScore(), 1e-9);
    }

    @Test
    void shouldRejectRuleCitingForeignEvidence() {
        final ScoringRule rogue = new ScoringRule("rogue", "always", 1.0,
                b -> List.of(new RuleHit(List.of(), List.of(EvidenceRef.hunk("hunk:ffffffffffffffff")))));
        final ScoringEngine withRogue = new ScoringEngine(List.of(rogue),
                new ScoringProfile("test", Map.of("rogue", 1.0)));
        final EvidenceBundle bundle = assembler.assemble(new BundleDraft("b1", "b2", COMPONENT));

        assertThrows(EvidenceIntegrityException.class, () -> withRogue.score(bundle));
    }

    @Test
    void shouldRefuseProfileMissingARule() {
        final Map<String, Double> weights = new LinkedHashMap<>(ScoringProfile.defaults().weights());
        weights.remove(ScoringRules.NEW_LOG_TEMPLATE);

        assertThrows(IllegalArgumentException.class,
                () -> new ScoringEngine(new ScoringProfile(ScoringRules.VERSION, weights)));
    }

    private EvidenceBundle bundle(String fromBuild, Path fromTree, String toBuild, Path toTree) throws IOException {
        return assembler.assemble(new BundleDraft(fromBuild, toBuild, COMPONENT)
                .sourceDiff(analyzer.analyze(fromTree, toTree)));
    }
}
