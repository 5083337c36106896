package ai.sensor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One contiguous changed region of a file, without context lines.
 * <p>
 * lines: every removed line ("-" prefix) followed by every added line ("+" prefix).
 * Starts follow the unified-diff convention: a side with count 0 reports the line after
 * which the change sits, and a file missing on one side reports 0/0 for that side.
 */
public record DiffHunk(
        String hunkId,
        String filePath,  // repo-relative, '/' separated
        int oldStart,
        int oldCount,
        int newStart,
        int newCount,
        List<String> lines
) {
    public DiffHunk {
        Objects.requireNonNull(hunkId, "hunkId");
        Objects.requireNonNull(filePath, "filePath");
        lines = List.copyOf(lines);
    }

    public String header() {
        return "@@ -" + oldStart + "," + oldCount + " +" + newStart + "," + newCount + " @@";
    }

    public List<String> removedLines() {
        return linesWithPrefix('-');
    }

    public List<String> addedLines() {
        return linesWithPrefix('+');
    }

    private List<String> linesWithPrefix(char prefix) {
        final List<String> out = new ArrayList<>();
        for (String line : lines) {
            if (!line.isEmpty() && line.charAt(0) == prefix) {
                out.add(line.substring(1));
            }
        }
        return out;
    }
}
