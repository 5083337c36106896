package ai.sensor.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;

/**
 * Stable identifiers for every evidence unit. Each kind carries its own prefix so ids of
 * different kinds never collide, and every id is a pure function of the evidence content.
 */
public final class Ids {

    public static final String HUNK_PREFIX = "hunk:";
    public static final String FEATURE_PREFIX = "feat:";
    public static final String SYMBOL_PREFIX = "sym:";
    public static final String STRING_PREFIX = "str:";
    public static final String IMPORT_PREFIX = "imp:";
    public static final String PAIR_PREFIX = "pair:";
    public static final String TEMPLATE_PREFIX = "tpl:";
    public static final String MATCH_PREFIX = "l2b:";

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Ids() {
    }

    public static String hunkId(String filePath, int oldStart, int oldCount, int newStart, int newCount,
                                List<String> lines) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(lines, "lines");
        final String position = oldStart + "," + oldCount + "," + newStart + "," + newCount;
        return HUNK_PREFIX + digest(filePath, position, String.join("\n", lines));
    }

    public static String featureId(SourceFeatureKind kind, ChangeSide side, String primaryHunkId) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(primaryHunkId, "primaryHunkId");
        return FEATURE_PREFIX + kind.label() + side.symbol() + ":" + stripPrefix(primaryHunkId);
    }

    /**
     * Symbol names repeat in real images (local statics, stubs). The first occurrence keeps the
     * bare name; later ones get an occurrence suffix.
     */
    public static String symbolId(String name, int occurrence) {
        Objects.requireNonNull(name, "name");
        return occurrence <= 1 ? SYMBOL_PREFIX + name : SYMBOL_PREFIX + name + "#" + occurrence;
    }

    public static String stringId(String value) {
        Objects.requireNonNull(value, "value");
        return STRING_PREFIX + digest(value);
    }

    public static String importId(String value) {
        Objects.requireNonNull(value, "value");
        return IMPORT_PREFIX + value;
    }

    public static String pairId(String fromName, String toName, int occurrence) {
        final String from = fromName == null ? "-" : fromName;
        final String to = toName == null ? "-" : toName;
        return PAIR_PREFIX + from + "->" + to + "#" + occurrence;
    }

    public static String templateId(String subsystem, String category, String formatString) {
        Objects.requireNonNull(subsystem, "subsystem");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(formatString, "formatString");
        return TEMPLATE_PREFIX + digest(subsystem, category, formatString);
    }

    public static String matchId(String templateId, String matchedString) {
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(matchedString, "matchedString");
        return MATCH_PREFIX + stripPrefix(templateId) + ":" + digest(matchedString);
    }

    public static String artifactId(String buildId, String component, String kind) {
        Objects.requireNonNull(buildId, "buildId");
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(kind, "kind");
        return "art:" + buildId + "/" + component + "/" + kind;
    }

    public static String diffId(String buildFrom, String buildTo, String component) {
        Objects.requireNonNull(buildFrom, "buildFrom");
        Objects.requireNonNull(buildTo, "buildTo");
        Objects.requireNonNull(component, "component");
        return "diff:" + component + "@" + buildFrom + ".." + buildTo;
    }

    public static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        return path.replace('\\', '/');
    }

    static String stripPrefix(String id) {
        final int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(colon + 1) : id;
    }

    /**
     * First 64 bits of SHA-256 over the NUL-joined parts, hex encoded.
     */
    static String digest(String... parts) {
        final MessageDigest sha;
        try {
            sha = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sha.update((byte) 0);
            }
            sha.update(parts[i].getBytes(StandardCharsets.UTF_8));
        }
        final byte[] hash = sha.digest();
        final StringBuilder sb = new StringBuilder(16);
        for (int i = 0; i < 8; i++) {
            sb.append(HEX[(hash[i] >> 4) & 0xf]).append(HEX[hash[i] & 0xf]);
        }
        return sb.toString();
    }
}
