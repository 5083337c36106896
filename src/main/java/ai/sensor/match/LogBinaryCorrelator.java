package ai.sensor.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.LogTemplate;
import ai.sensor.model.LogToBinaryMatch;
import ai.sensor.scan.LogTemplateExtractor;

/**
 * Finds log templates whose literal text occurs verbatim in an image's strings.
 * Plain substring membership; at most one match per (template, string).
 */
public final class LogBinaryCorrelator {

    private static final Logger log = LoggerFactory.getLogger(LogBinaryCorrelator.class);

    private final int minFragmentLength;

    public LogBinaryCorrelator(int minFragmentLength) {
        if (minFragmentLength < 1) {
            throw new IllegalArgumentException("minFragmentLength must be >= 1, got " + minFragmentLength);
        }
        this.minFragmentLength = minFragmentLength;
    }

    /**
     * @return matches in template order, then string order
     */
    public List<LogToBinaryMatch> correlate(List<LogTemplate> templates, BinaryFeatureSet binary) {
        Objects.requireNonNull(templates, "templates");
        Objects.requireNonNull(binary, "binary");

        final List<LogToBinaryMatch> out = new ArrayList<>();
        for (LogTemplate t : templates) {
            // a format string without placeholders is its own single fragment
            final List<String> fragments =
                    LogTemplateExtractor.literalFragments(t.formatString(), minFragmentLength);
            if (fragments.isEmpty()) {
                continue;
            }
            for (String s : binary.strings()) {
                final String fragment = firstContained(fragments, s);
                if (fragment != null) {
                    out.add(LogToBinaryMatch.of(t.templateId(), fragment, s));
                }
            }
        }
        log.info("Log/binary correlation against {}: {} template(s), {} match(es)",
                binary.artifactId(), templates.size(), out.size());
        return out;
    }

    private static String firstContained(List<String> fragments, String s) {
        for (String f : fragments) {
            if (s.contains(f)) {
                return f;
            }
        }
        return null;
    }
}
