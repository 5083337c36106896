package ai.sensor.scan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.sensor.model.ChangeSide;
import ai.sensor.model.DiffHunk;
import ai.sensor.model.Ids;
import ai.sensor.model.SourceFeature;
import ai.sensor.model.SourceFeatureKind;

/**
 * Derives security-relevant features from the hunks of one file. Patterns are matched on the
 * changed lines only; the full old/new file is consulted to look around a guard or an
 * allocation site.
 */
public final class SourceFeatureDetector {

    private static final int MAX_SNIPPET = 200;

    private final int lookaheadLines;

    public SourceFeatureDetector(int lookaheadLines) {
        if (lookaheadLines < 1) {
            throw new IllegalArgumentException("lookaheadLines must be >= 1, got " + lookaheadLines);
        }
        this.lookaheadLines = lookaheadLines;
    }

    /**
     * One file's diff: both sides' full content and the hunks computed between them,
     * each hunk paired with the 0-based region it covers.
     */
    public record FileChange(
            String filePath,
            List<String> oldLines,
            List<String> newLines,
            List<DiffHunk> hunks,
            List<LineDiff.Region> regions
    ) {
        public FileChange {
            Objects.requireNonNull(filePath, "filePath");
            oldLines = List.copyOf(oldLines);
            newLines = List.copyOf(newLines);
            hunks = List.copyOf(hunks);
            regions = List.copyOf(regions);
            if (hunks.size() != regions.size()) {
                throw new IllegalArgumentException("hunks and regions differ in size for " + filePath);
            }
        }
    }

    public List<SourceFeature> detect(FileChange change) {
        final Map<Integer, String> oldLineToHunk = new HashMap<>();
        final Map<Integer, String> newLineToHunk = new HashMap<>();
        for (int h = 0; h < change.hunks().size(); h++) {
            final LineDiff.Region r = change.regions().get(h);
            final String hunkId = change.hunks().get(h).hunkId();
            for (int i = r.oldFrom(); i < r.oldTo(); i++) {
                oldLineToHunk.put(i, hunkId);
            }
            for (int i = r.newFrom(); i < r.newTo(); i++) {
                newLineToHunk.put(i, hunkId);
            }
        }

        final List<SourceFeature> out = new ArrayList<>();
        for (int h = 0; h < change.hunks().size(); h++) {
            final DiffHunk hunk = change.hunks().get(h);
            final LineDiff.Region r = change.regions().get(h);
            scanSide(change.filePath(), hunk, change.oldLines(), r.oldFrom(), r.oldTo(),
                    ChangeSide.REMOVED, oldLineToHunk, out);
            scanSide(change.filePath(), hunk, change.newLines(), r.newFrom(), r.newTo(),
                    ChangeSide.ADDED, newLineToHunk, out);
        }
        return out;
    }

    private void scanSide(String filePath,
                          DiffHunk hunk,
                          List<String> lines,
                          int from,
                          int to,
                          ChangeSide side,
                          Map<Integer, String> lineToHunk,
                          List<SourceFeature> out) {

        // one feature per (hunk, kind, side); first matching line wins
        final Map<SourceFeatureKind, SourceFeature> found = new LinkedHashMap<>();

        for (int idx = from; idx < to; idx++) {
            final String text = lines.get(idx);
            if (SourcePatterns.isCommentOrBlank(text)) {
                continue;
            }

            if (!found.containsKey(SourceFeatureKind.ALLOCATION_SIZING) && SourcePatterns.isAllocationSizing(text)) {
                final boolean guarded = guardPrecedes(lines, idx);
                found.put(SourceFeatureKind.ALLOCATION_SIZING, feature(SourceFeatureKind.ALLOCATION_SIZING, side,
                        List.of(hunk.hunkId()), filePath, idx, text,
                        guarded ? "size product guarded by a preceding check"
                                : "size product without a preceding bounds/overflow check", guarded));
            }

            final SourceFeatureKind boundsKind = side == ChangeSide.ADDED
                    ? SourceFeatureKind.BOUNDS_CHECK_ADDED
                    : SourceFeatureKind.BOUNDS_CHECK_REMOVED;
            if (!found.containsKey(boundsKind) && SourcePatterns.isGuard(text)) {
                final int target = guardedCall(lines, idx);
                if (target >= 0) {
                    final List<String> hunkIds = new ArrayList<>();
                    hunkIds.add(hunk.hunkId());
                    final String targetHunk = lineToHunk.get(target);
                    if (targetHunk != null && !targetHunk.equals(hunk.hunkId())) {
                        hunkIds.add(targetHunk);
                    }
                    found.put(boundsKind, feature(boundsKind, side, hunkIds, filePath, idx, text,
                            "guards " + snippet(lines.get(target)) + " at line " + (target + 1), false));
                }
            }

            if (!found.containsKey(SourceFeatureKind.PARSING_LOGIC) && SourcePatterns.isParsingLogic(text)) {
                found.put(SourceFeatureKind.PARSING_LOGIC, feature(SourceFeatureKind.PARSING_LOGIC, side,
                        List.of(hunk.hunkId()), filePath, idx, text, "reads a length/count or parses external input", false));
            }

            if (!found.containsKey(SourceFeatureKind.PRIVILEGE_CHECK) && SourcePatterns.isPrivilegeCheck(text)) {
                found.put(SourceFeatureKind.PRIVILEGE_CHECK, feature(SourceFeatureKind.PRIVILEGE_CHECK, side,
                        List.of(hunk.hunkId()), filePath, idx, text, "calls a privilege-test primitive", false));
            }
        }
        out.addAll(found.values());
    }

    /**
     * Index of the allocation or copy call the guard at guardIdx protects: the guard line
     * itself or one of the next lookaheadLines code lines. -1 when none.
     */
    private int guardedCall(List<String> lines, int guardIdx) {
        if (SourcePatterns.isAllocationOrCopy(lines.get(guardIdx))) {
            return guardIdx;
        }
        int seen = 0;
        for (int i = guardIdx + 1; i < lines.size() && seen < lookaheadLines; i++) {
            final String text = lines.get(i);
            if (SourcePatterns.isCommentOrBlank(text)) {
                continue;
            }
            seen++;
            if (SourcePatterns.isAllocationOrCopy(text)) {
                return i;
            }
        }
        return -1;
    }

    private boolean guardPrecedes(List<String> lines, int idx) {
        int seen = 0;
        for (int i = idx - 1; i >= 0 && seen < lookaheadLines; i--) {
            final String text = lines.get(i);
            if (SourcePatterns.isCommentOrBlank(text)) {
                continue;
            }
            seen++;
            if (SourcePatterns.isGuard(text)) {
                return true;
            }
        }
        return false;
    }

    private static SourceFeature feature(SourceFeatureKind kind,
                                         ChangeSide side,
                                         List<String> hunkIds,
                                         String filePath,
                                         int idx,
                                         String text,
                                         String detail,
                                         boolean guarded) {
        return new SourceFeature(
                Ids.featureId(kind, side, hunkIds.get(0)),
                kind,
                side,
                hunkIds,
                filePath,
                idx + 1,
                snippet(text),
                detail,
                guarded);
    }

    private static String snippet(String text) {
        final String t = text.trim();
        return t.length() > MAX_SNIPPET ? t.substring(0, MAX_SNIPPET) + "..." : t;
    }
}
