package ai.sensor.match;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matcher variants by name, so a heavier matcher can be swapped in through configuration
 * without touching the pipeline.
 */
public final class BinaryDiffMatchers {

    private final Map<String, BinaryDiffMatcher> byName = new LinkedHashMap<>();

    public static BinaryDiffMatchers defaults() {
        return new BinaryDiffMatchers().register(new NameMatcher());
    }

    public BinaryDiffMatchers register(BinaryDiffMatcher matcher) {
        Objects.requireNonNull(matcher, "matcher");
        if (byName.putIfAbsent(matcher.name(), matcher) != null) {
            throw new IllegalArgumentException("matcher already registered: " + matcher.name());
        }
        return this;
    }

    public Set<String> names() {
        return byName.keySet();
    }

    public BinaryDiffMatcher resolve(String name) {
        final BinaryDiffMatcher m = byName.get(name);
        if (m == null) {
            throw new IllegalArgumentException("unknown matcher '" + name + "', known: " + byName.keySet());
        }
        return m;
    }
}
