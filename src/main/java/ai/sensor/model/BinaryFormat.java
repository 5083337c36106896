package ai.sensor.model;

public enum BinaryFormat {
    MACH_O,
    MACH_O_FAT,
    ELF,
    UNKNOWN
}
