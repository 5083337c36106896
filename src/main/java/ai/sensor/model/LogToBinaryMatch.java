package ai.sensor.model;

import java.util.Objects;

public record LogToBinaryMatch(
        String matchId,
        String templateId,
        String fragment,       // literal part of the template found in the binary string
        String matchedString,
        String stringId
) {
    public LogToBinaryMatch {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(fragment, "fragment");
        Objects.requireNonNull(matchedString, "matchedString");
        Objects.requireNonNull(stringId, "stringId");
    }

    public static LogToBinaryMatch of(String templateId, String fragment, String matchedString) {
        return new LogToBinaryMatch(Ids.matchId(templateId, matchedString), templateId, fragment,
                matchedString, Ids.stringId(matchedString));
    }
}
