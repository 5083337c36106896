package ai.sensor.model;

import java.util.List;

/**
 * Placeholder for Objective-C metadata: only class names recovered from the symbol table.
 */
public record ObjcMetadataStub(List<String> classNames) {

    public static final ObjcMetadataStub EMPTY = new ObjcMetadataStub(List.of());

    public ObjcMetadataStub {
        classNames = List.copyOf(classNames);
    }
}
