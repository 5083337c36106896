package ai.sensor.scan.binary;

import java.util.Objects;

import ai.sensor.model.ExtractionStatus;

/**
 * Raised by a reader when an image cannot be walked; the status tells the extractor how to
 * report the degraded artifact.
 */
public final class BinaryParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ExtractionStatus status;

    public BinaryParseException(ExtractionStatus status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
    }

    public static BinaryParseException truncated(String message) {
        return new BinaryParseException(ExtractionStatus.TRUNCATED, message);
    }

    public static BinaryParseException malformed(String message) {
        return new BinaryParseException(ExtractionStatus.MALFORMED, message);
    }

    public static BinaryParseException unsupported(String message) {
        return new BinaryParseException(ExtractionStatus.UNSUPPORTED, message);
    }

    public ExtractionStatus status() {
        return status;
    }
}
