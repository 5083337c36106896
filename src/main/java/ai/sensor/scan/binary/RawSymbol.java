package ai.sensor.scan.binary;

/**
 * Symbol as read from an image, before stable ids are assigned.
 */
public record RawSymbol(String name, long address, boolean defined) {
}
