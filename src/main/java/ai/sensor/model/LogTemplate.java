package ai.sensor.model;

import java.util.Objects;

/**
 * One message shape of a build's log stream; templateId derives from
 * (subsystem, category, formatString) only.
 */
public record LogTemplate(
        String templateId,
        String subsystem,
        String category,
        String formatString,
        String sampleMessage  // first raw message that produced the template
) {
    public LogTemplate {
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(subsystem, "subsystem");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(formatString, "formatString");
        sampleMessage = sampleMessage == null ? "" : sampleMessage;
    }

    public static LogTemplate of(String subsystem, String category, String formatString, String sampleMessage) {
        return new LogTemplate(Ids.templateId(subsystem, category, formatString),
                subsystem, category, formatString, sampleMessage);
    }
}
