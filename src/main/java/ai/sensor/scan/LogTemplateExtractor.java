package ai.sensor.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.model.LogTemplate;

/**
 * Reduces a build's log stream to message templates. Structurally identical messages collapse
 * to one template whatever their argument values; templates keep first-seen order.
 */
public final class LogTemplateExtractor {

    private static final Logger log = LoggerFactory.getLogger(LogTemplateExtractor.class);

    public static final String DEFAULT_SUBSYSTEM = "default";
    public static final String DEFAULT_CATEGORY = "default";

    public static final String ARG = "<arg>";
    public static final String STR = "<str>";
    public static final String HEX = "<hex>";
    public static final String NUM = "<num>";

    static final Pattern PLACEHOLDER = Pattern.compile("<(?:arg|str|hex|num)>");

    private static final int MAX_SAMPLE = 200;

    // ISO-8601 / unified log, syslog ("Jan  2 03:04:05") or bare clock prefixes
    private static final Pattern TIMESTAMP = Pattern.compile(
            "^\\s*(?:\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?"
                    + "|[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}"
                    + "|\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?)\\s*");

    // [subsystem:category] opening the line, optionally after a "process[pid]:" prefix
    private static final Pattern TAG = Pattern.compile(
            "(?:[\\w.\\-/]+\\[\\d+\\]:?\\s*)?\\[([A-Za-z][\\w.\\-]*):([A-Za-z][\\w.\\-]*)\\]");

    // no space flag, so rendered prose like "100% complete" is left alone
    private static final Pattern PRINTF = Pattern.compile(
            "%(?:\\{[^}]*\\})?(?:\\d+\\$)?[-+#0]*(?:\\d+|\\*)?(?:\\.(?:\\d+|\\*))?"
                    + "(?:hh|h|ll|l|j|z|t|L|q)?[@dDiuUoOxXfFeEgGsScCp]");
    private static final Pattern QUOTED = Pattern.compile("\"[^\"]*\"|(?<!\\w)'[^']*'(?!\\w)");
    private static final Pattern HEX_TOKEN = Pattern.compile("\\b0[xX][0-9a-fA-F]+\\b");
    private static final Pattern NUMBER = Pattern.compile("(?<!\\w)\\d+(?:\\.\\d+)*(?!\\w)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Message split from its log line.
     */
    record LogLine(String subsystem, String category, String message) {
    }

    /**
     * @param path a log file, or a directory whose regular files are read in sorted path order;
     *             null or missing yields no templates
     */
    public List<LogTemplate> extract(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return List.of();
        }
        final List<Path> files = new ArrayList<>();
        if (Files.isDirectory(path)) {
            try (Stream<Path> s = Files.walk(path)) {
                s.filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().startsWith("."))
                        .sorted()
                        .forEach(files::add);
            }
        } else {
            files.add(path);
        }

        final Map<String, LogTemplate> byId = new LinkedHashMap<>();
        for (Path file : files) {
            // malformed bytes become U+FFFD
            final String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            collect(text.split("\r?\n"), byId);
            log.debug("{}: {} template(s) so far", file, byId.size());
        }
        log.info("Log templates from {}: {} file(s), {} template(s)", path, files.size(), byId.size());
        return new ArrayList<>(byId.values());
    }

    public List<LogTemplate> extract(List<String> lines) {
        final Map<String, LogTemplate> byId = new LinkedHashMap<>();
        collect(lines.toArray(new String[0]), byId);
        return new ArrayList<>(byId.values());
    }

    private static void collect(String[] lines, Map<String, LogTemplate> byId) {
        for (String raw : lines) {
            final LogLine line = parseLine(raw);
            if (line == null) {
                continue;
            }
            final String format = normalize(line.message());
            if (format.isEmpty()) {
                continue;
            }
            final LogTemplate t = LogTemplate.of(line.subsystem(), line.category(), format, sample(line.message()));
            byId.putIfAbsent(t.templateId(), t);
        }
    }

    /**
     * @return null for a blank line
     */
    static LogLine parseLine(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        final String rest = TIMESTAMP.matcher(raw).replaceFirst("").trim();
        final Matcher tag = TAG.matcher(rest);
        if (tag.lookingAt()) {
            final String message = rest.substring(tag.end()).trim();
            return message.isEmpty() ? null : new LogLine(tag.group(1), tag.group(2), message);
        }
        return rest.isEmpty() ? null : new LogLine(DEFAULT_SUBSYSTEM, DEFAULT_CATEGORY, rest);
    }

    /**
     * Replaces variable tokens with placeholders. Applying it to its own output changes nothing.
     */
    public static String normalize(String message) {
        String s = PRINTF.matcher(message).replaceAll(ARG);
        s = QUOTED.matcher(s).replaceAll(STR);
        s = HEX_TOKEN.matcher(s).replaceAll(HEX);
        s = NUMBER.matcher(s).replaceAll(NUM);
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Literal text between placeholders, trimmed, keeping pieces of at least minLength chars.
     */
    public static List<String> literalFragments(String formatString, int minLength) {
        final List<String> out = new ArrayList<>();
        for (String piece : PLACEHOLDER.split(formatString)) {
            final String t = piece.trim();
            if (t.length() >= minLength && !out.contains(t)) {
                out.add(t);
            }
        }
        return out;
    }

    private static String sample(String message) {
        return message.length() > MAX_SAMPLE ? message.substring(0, MAX_SAMPLE) : message;
    }
}
