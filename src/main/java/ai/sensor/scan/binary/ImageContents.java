package ai.sensor.scan.binary;

import java.util.List;

import ai.sensor.model.BinaryFormat;

public record ImageContents(
        BinaryFormat format,
        List<String> imports,    // linked libraries in load order
        List<RawSymbol> symbols  // symbol-table order
) {
    public ImageContents {
        imports = List.copyOf(imports);
        symbols = List.copyOf(symbols);
    }
}
