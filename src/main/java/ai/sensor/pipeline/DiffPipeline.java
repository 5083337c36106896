package ai.sensor.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.bundle.BundleDraft;
import ai.sensor.bundle.EvidenceBundleAssembler;
import ai.sensor.config.SensorConfig;
import ai.sensor.match.BinaryDiffMatcher;
import ai.sensor.match.BinaryDiffMatchers;
import ai.sensor.match.LogBinaryCorrelator;
import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.EvidenceBundle;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.model.Notice;
import ai.sensor.model.ScoreResult;
import ai.sensor.model.SourceDiff;
import ai.sensor.report.CitationPolicy;
import ai.sensor.report.Enricher;
import ai.sensor.report.HypothesisGenerator;
import ai.sensor.report.NoOpEnricher;
import ai.sensor.report.TriageReport;
import ai.sensor.report.TriageReportGenerator;
import ai.sensor.report.VulnHypothesis;
import ai.sensor.scan.BinaryFeatureExtractor;
import ai.sensor.scan.LogTemplateExtractor;
import ai.sensor.scan.SourceDiffAnalyzer;
import ai.sensor.scan.SourceFeatureDetector;
import ai.sensor.scan.SourceTreeWalker;
import ai.sensor.score.ScoringEngine;

/**
 * One diff run end to end. Phase one runs the per-build extractors concurrently; phase two
 * matches, correlates, assembles and scores on the calling thread.
 * <p>
 * Closing the pipeline abandons any run in flight. Nothing is persisted here.
 */
public final class DiffPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiffPipeline.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final SourceDiffAnalyzer sourceAnalyzer;
    private final BinaryFeatureExtractor binaryExtractor;
    private final LogTemplateExtractor logExtractor;
    private final BinaryDiffMatcher matcher;
    private final LogBinaryCorrelator correlator;
    private final EvidenceBundleAssembler assembler;
    private final ScoringEngine scoring;
    private final TriageReportGenerator triage;
    private final HypothesisGenerator hypotheses;
    private final Enricher enricher;
    private final ExecutorService executor;

    public DiffPipeline(SensorConfig config) {
        this(config, new NoOpEnricher());
    }

    public DiffPipeline(SensorConfig config, Enricher enricher) {
        Objects.requireNonNull(config, "config");
        this.sourceAnalyzer = new SourceDiffAnalyzer(new SourceTreeWalker(),
                new SourceFeatureDetector(config.source().lookaheadLines()));
        this.binaryExtractor = new BinaryFeatureExtractor(config.binary().minStringLength());
        this.logExtractor = new LogTemplateExtractor();
        this.matcher = BinaryDiffMatchers.defaults().resolve(config.pipeline().matcher());
        this.correlator = new LogBinaryCorrelator(config.logs().minFragmentLength());
        this.assembler = new EvidenceBundleAssembler();
        this.scoring = new ScoringEngine(config.scoringProfile());
        this.triage = new TriageReportGenerator();
        this.hypotheses = new HypothesisGenerator();
        this.enricher = CitationPolicy.guard(Objects.requireNonNull(enricher, "enricher"));

        final AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.pipeline().parallelism(), r -> {
            final Thread t = new Thread(r, "sensor-extract-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws IOException if a source tree cannot be walked or read
     * @throws ai.sensor.bundle.EvidenceIntegrityException if the assembled evidence is inconsistent
     */
    public DiffRun run(ArtifactSet from, ArtifactSet to) throws IOException {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!from.component().equals(to.component())) {
            throw new IllegalArgumentException("builds belong to different components: "
                    + from.component() + " vs " + to.component());
        }
        log.info("Diff {} {} -> {}", from.component(), from.buildId(), to.buildId());

        final CompletableFuture<SourceDiff> sourceF = CompletableFuture.supplyAsync(() -> {
            try {
                return sourceAnalyzer.analyze(from.sourceDir(), to.sourceDir());
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }, executor);
        final CompletableFuture<BinaryFeatureSet> binFromF = CompletableFuture.supplyAsync(
                () -> binaryExtractor.extract(from.buildId(), from.component(), from.binaryPath()), executor);
        final CompletableFuture<BinaryFeatureSet> binToF = CompletableFuture.supplyAsync(
                () -> binaryExtractor.extract(to.buildId(), to.component(), to.binaryPath()), executor);
        final CompletableFuture<LogExtraction> logsFromF = CompletableFuture.supplyAsync(() -> logs(from), executor);
        final CompletableFuture<LogExtraction> logsToF = CompletableFuture.supplyAsync(() -> logs(to), executor);

        final SourceDiff sourceDiff = await(sourceF);
        final BinaryFeatureSet binFrom = await(binFromF);
        final BinaryFeatureSet binTo = await(binToF);
        final LogExtraction logsFrom = await(logsFromF);
        final LogExtraction logsTo = await(logsToF);

        final List<BinaryDiffPair> pairs = matcher.match(binFrom, binTo);
        final List<LogToBinaryMatch> matches = correlator.correlate(logsTo.templates(), binTo);

        final BundleDraft draft = new BundleDraft(from.buildId(), to.buildId(), from.component())
                .sourceDiff(sourceDiff)
                .binaries(binFrom, binTo)
                .binaryDiffPairs(pairs)
                .logTemplates(logsTo.templates(), logsFrom.templates())
                .logToBinaryMatches(matches);
        logsFrom.notices().forEach(draft::notice);
        logsTo.notices().forEach(draft::notice);

        final EvidenceBundle bundle = assembler.assemble(draft);
        final ScoreResult score = scoring.score(bundle);
        final TriageReport report = enricher.enrich(triage.generate(score), bundle, score);
        final List<VulnHypothesis> hyps = CitationPolicy.enforce(bundle, hypotheses.generate(bundle));
        return new DiffRun(bundle, score, report, hyps);
    }

    private record LogExtraction(List<LogTemplate> templates, List<Notice> notices) {
    }

    private LogExtraction logs(ArtifactSet build) {
        try {
            return new LogExtraction(logExtractor.extract(build.logPath()), List.of());
        } catch (IOException ex) {
            log.warn("Log stream {} unreadable: {}", build.logArtifactId(), ex.getMessage());
            return new LogExtraction(List.of(),
                    List.of(new Notice(build.logArtifactId(), "unreadable: " + ex.getMessage())));
        }
    }

    private static <T> T await(CompletableFuture<T> future) throws IOException {
        try {
            return future.join();
        } catch (CompletionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw ex;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Extraction workers did not stop within {}s", TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
