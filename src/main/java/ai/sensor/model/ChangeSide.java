package ai.sensor.model;

/**
 * Side of a diff a line or feature belongs to.
 */
public enum ChangeSide {
    ADDED('+'),
    REMOVED('-');

    private final char symbol;

    ChangeSide(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }
}
