package ai.sensor.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import ai.sensor.model.Ids;
import ai.sensor.model.Notice;

/**
 * Lists the regular files of a source tree as repo-relative, '/'-separated paths in sorted order.
 * Hidden entries and typical VCS/build directories are skipped. Links to regular files are listed;
 * any other entry that is not a regular file, or cannot be visited, is reported as a notice.
 */
public final class SourceTreeWalker {

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", ".svn", ".hg", ".idea", "build", "out", "target", "node_modules");

    public List<String> listFiles(Path root, List<Notice> skipped) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        final Path base = root.toAbsolutePath().normalize();
        final List<String> out = new ArrayList<>();

        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(base)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (name.startsWith(".") || SKIPPED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final String name = file.getFileName() != null ? file.getFileName().toString() : "";
                if (name.startsWith(".")) {
                    return FileVisitResult.CONTINUE;
                }
                final String rel = Ids.normalizePath(base.relativize(file).toString());
                // attrs describe the link itself; Files.isRegularFile follows it
                if (attrs.isRegularFile() || Files.isRegularFile(file)) {
                    out.add(rel);
                } else {
                    skipped.add(new Notice(rel, "skipped: not a regular file"));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                skipped.add(new Notice(Ids.normalizePath(base.relativize(file).toString()),
                        "unreadable: " + exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(out);
        return out;
    }
}
