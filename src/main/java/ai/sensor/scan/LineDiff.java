package ai.sensor.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Longest-common-subsequence line diff. Common prefix and suffix are trimmed before the
 * quadratic table is built.
 */
public final class LineDiff {

    // Above this table size the trimmed middle is reported as a single region.
    static final long MAX_TABLE_CELLS = 25_000_000L;

    private LineDiff() {
    }

    /**
     * Contiguous changed region, 0-based and half-open on both sides.
     */
    public record Region(int oldFrom, int oldTo, int newFrom, int newTo) {

        public int oldCount() {
            return oldTo - oldFrom;
        }

        public int newCount() {
            return newTo - newFrom;
        }
    }

    public static List<Region> compute(List<String> oldLines, List<String> newLines) {
        int prefix = 0;
        final int maxPrefix = Math.min(oldLines.size(), newLines.size());
        while (prefix < maxPrefix && oldLines.get(prefix).equals(newLines.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < maxPrefix - prefix
                && oldLines.get(oldLines.size() - 1 - suffix).equals(newLines.get(newLines.size() - 1 - suffix))) {
            suffix++;
        }

        final List<String> a = oldLines.subList(prefix, oldLines.size() - suffix);
        final List<String> b = newLines.subList(prefix, newLines.size() - suffix);
        final int n = a.size();
        final int m = b.size();
        if (n == 0 && m == 0) {
            return List.of();
        }
        if ((long) (n + 1) * (m + 1) > MAX_TABLE_CELLS) {
            return List.of(new Region(prefix, prefix + n, prefix, prefix + m));
        }

        // lcs[i][j] = LCS length of a[i..] and b[j..]
        final int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (a.get(i).equals(b.get(j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        final List<Region> regions = new ArrayList<>();
        int i = 0;
        int j = 0;
        int regionOld = -1;
        int regionNew = -1;
        while (i < n || j < m) {
            if (i < n && j < m && a.get(i).equals(b.get(j))) {
                if (regionOld >= 0) {
                    regions.add(new Region(prefix + regionOld, prefix + i, prefix + regionNew, prefix + j));
                    regionOld = -1;
                }
                i++;
                j++;
                continue;
            }
            if (regionOld < 0) {
                regionOld = i;
                regionNew = j;
            }
            // Ties prefer deletion so removed lines come first within a region.
            if (j >= m || (i < n && lcs[i + 1][j] >= lcs[i][j + 1])) {
                i++;
            } else {
                j++;
            }
        }
        if (regionOld >= 0) {
            regions.add(new Region(prefix + regionOld, prefix + n, prefix + regionNew, prefix + m));
        }
        return regions;
    }
}
