package ai.sensor.scan;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.model.DiffHunk;
import ai.sensor.model.Ids;
import ai.sensor.model.Notice;
import ai.sensor.model.SourceDiff;
import ai.sensor.model.SourceFeature;

/**
 * Computes zero-context hunks between two source trees and derives features from them.
 * Hunks come out in file-path order, then position order within each file.
 */
public final class SourceDiffAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SourceDiffAnalyzer.class);

    /**
     * Reads the bytes of one source file.
     */
    @FunctionalInterface
    interface SourceFileReader {
        byte[] read(Path file) throws IOException;
    }

    private final SourceTreeWalker walker;
    private final SourceFeatureDetector detector;
    private final SourceFileReader reader;

    public SourceDiffAnalyzer(SourceTreeWalker walker, SourceFeatureDetector detector) {
        this(walker, detector, Files::readAllBytes);
    }

    SourceDiffAnalyzer(SourceTreeWalker walker, SourceFeatureDetector detector, SourceFileReader reader) {
        this.walker = Objects.requireNonNull(walker, "walker");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * @param fromRoot source tree of the older build, may be null or missing (treated as empty)
     * @param toRoot   source tree of the newer build, may be null or missing (treated as empty)
     * @throws IOException when a tree root cannot be walked; a single unreadable file only adds a notice
     */
    public SourceDiff analyze(Path fromRoot, Path toRoot) throws IOException {
        final List<Notice> walkNotices = new ArrayList<>();
        final TreeSet<String> paths = new TreeSet<>(walker.listFiles(fromRoot, walkNotices));
        paths.addAll(walker.listFiles(toRoot, walkNotices));

        final List<DiffHunk> hunks = new ArrayList<>();
        final List<SourceFeature> features = new ArrayList<>();
        // an entry skipped in both trees is reported once
        final List<Notice> notices = new ArrayList<>(new LinkedHashSet<>(walkNotices));
        for (Notice n : notices) {
            log.warn("Skipping {}: {}", n.subject(), n.message());
        }

        for (String rel : paths) {
            final List<String> oldLines;
            final List<String> newLines;
            try {
                oldLines = readSide(fromRoot, rel);
                newLines = readSide(toRoot, rel);
            } catch (UndecodableTextException ex) {
                log.warn("Skipping {}: {}", rel, ex.getMessage());
                notices.add(new Notice(rel, "skipped: " + ex.getMessage()));
                continue;
            } catch (IOException ex) {
                log.warn("Cannot read {}: {}", rel, ex.toString());
                notices.add(new Notice(rel, "unreadable: " + ex.getMessage()));
                continue;
            }

            final List<LineDiff.Region> regions = LineDiff.compute(oldLines, newLines);
            if (regions.isEmpty()) {
                continue;
            }

            final List<DiffHunk> fileHunks = new ArrayList<>(regions.size());
            for (LineDiff.Region r : regions) {
                fileHunks.add(toHunk(rel, r, oldLines, newLines));
            }
            hunks.addAll(fileHunks);
            features.addAll(detector.detect(
                    new SourceFeatureDetector.FileChange(rel, oldLines, newLines, fileHunks, regions)));
            log.debug("{}: {} hunk(s)", rel, fileHunks.size());
        }

        log.info("Source diff: {} file(s) compared, {} hunk(s), {} feature(s), {} skipped",
                paths.size(), hunks.size(), features.size(), notices.size());
        return new SourceDiff(hunks, features, notices);
    }

    static DiffHunk toHunk(String rel, LineDiff.Region r, List<String> oldLines, List<String> newLines) {
        final List<String> lines = new ArrayList<>(r.oldCount() + r.newCount());
        for (int i = r.oldFrom(); i < r.oldTo(); i++) {
            lines.add("-" + oldLines.get(i));
        }
        for (int i = r.newFrom(); i < r.newTo(); i++) {
            lines.add("+" + newLines.get(i));
        }
        // unified convention: an empty side points at the line the change follows
        final int oldStart = r.oldCount() > 0 ? r.oldFrom() + 1 : r.oldFrom();
        final int newStart = r.newCount() > 0 ? r.newFrom() + 1 : r.newFrom();
        final String hunkId = Ids.hunkId(rel, oldStart, r.oldCount(), newStart, r.newCount(), lines);
        return new DiffHunk(hunkId, rel, oldStart, r.oldCount(), newStart, r.newCount(), lines);
    }

    private List<String> readSide(Path root, String rel) throws IOException, UndecodableTextException {
        if (root == null) {
            return List.of();
        }
        final Path file = root.resolve(rel);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        return decodeLines(reader.read(file));
    }

    static List<String> decodeLines(byte[] bytes) throws UndecodableTextException {
        for (byte b : bytes) {
            if (b == 0) {
                throw new UndecodableTextException("not a text file (contains NUL bytes)");
            }
        }
        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new UndecodableTextException("not valid UTF-8 text (" + ex.getClass().getSimpleName() + ")");
        }
        if (text.isEmpty()) {
            return List.of();
        }
        final List<String> lines = new ArrayList<>(List.of(text.split("\r?\n", -1)));
        // a trailing newline does not start another line
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    static final class UndecodableTextException extends Exception {
        UndecodableTextException(String message) {
            super(message);
        }
    }
}
