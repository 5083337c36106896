package ai.sensor.bundle;

/**
 * A bundle, score or report that breaks the citation contract: a duplicate id, or a reference
 * that does not resolve inside its own bundle. Always a logic defect, never bad input.
 */
public final class EvidenceIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EvidenceIntegrityException(String message) {
        super(message);
    }
}
