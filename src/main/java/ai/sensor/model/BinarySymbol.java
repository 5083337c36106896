package ai.sensor.model;

import java.util.Objects;

public record BinarySymbol(
        String symbolId,
        String name,
        long address,
        boolean defined  // false for undefined (imported) symbols
) {
    public BinarySymbol {
        Objects.requireNonNull(symbolId, "symbolId");
        Objects.requireNonNull(name, "name");
    }
}
