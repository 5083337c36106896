package ai.sensor.model;

import java.util.Objects;

/**
 * Non-fatal note about an input that was skipped or only partially read.
 */
public record Notice(
        String subject,   // artifact id or repo-relative file path
        String message
) {
    public Notice {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }
}
