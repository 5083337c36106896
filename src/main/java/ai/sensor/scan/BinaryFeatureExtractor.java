package ai.sensor.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinaryFormat;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.ExtractionStatus;
import ai.sensor.model.Ids;
import ai.sensor.model.ObjcMetadataStub;
import ai.sensor.scan.binary.BinaryImageReader;
import ai.sensor.scan.binary.BinaryParseException;
import ai.sensor.scan.binary.ElfReader;
import ai.sensor.scan.binary.ImageContents;
import ai.sensor.scan.binary.MachOReader;
import ai.sensor.scan.binary.RawSymbol;
import ai.sensor.scan.binary.StringTableScanner;

/**
 * Reads strings, imports, symbols and Objective-C class names from one binary artifact.
 * Never throws for a bad artifact: the result carries a degraded status and a notice instead.
 */
public final class BinaryFeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(BinaryFeatureExtractor.class);

    static final String OBJC_CLASS_PREFIX = "_OBJC_CLASS_$_";

    private final StringTableScanner strings;
    private final List<BinaryImageReader> readers;

    public BinaryFeatureExtractor(int minStringLength) {
        this(new StringTableScanner(minStringLength), List.of(new MachOReader(), new ElfReader()));
    }

    BinaryFeatureExtractor(StringTableScanner strings, List<BinaryImageReader> readers) {
        this.strings = Objects.requireNonNull(strings, "strings");
        this.readers = List.copyOf(readers);
    }

    /**
     * @param path artifact to read; null means no artifact was supplied for this side
     */
    public BinaryFeatureSet extract(String buildId, String component, Path path) {
        Objects.requireNonNull(buildId, "buildId");
        Objects.requireNonNull(component, "component");
        if (path == null) {
            return BinaryFeatureSet.absent(buildId, component);
        }
        if (Files.isDirectory(path)) {
            return degraded(buildId, component, BinaryFormat.UNKNOWN, ExtractionStatus.UNSUPPORTED,
                    path + " is a directory");
        }

        final byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException ex) {
            return degraded(buildId, component, BinaryFormat.UNKNOWN, ExtractionStatus.UNREADABLE,
                    "cannot read " + path + ": " + safeMsg(ex));
        }
        return extract(buildId, component, data);
    }

    BinaryFeatureSet extract(String buildId, String component, byte[] data) {
        if (data.length < 4) {
            return degraded(buildId, component, BinaryFormat.UNKNOWN, ExtractionStatus.UNSUPPORTED,
                    "too short to carry a header magic (" + data.length + " bytes)");
        }
        final BinaryImageReader reader = readers.stream().filter(r -> r.accepts(data)).findFirst().orElse(null);
        if (reader == null) {
            return degraded(buildId, component, BinaryFormat.UNKNOWN, ExtractionStatus.UNSUPPORTED,
                    String.format("unrecognized header magic 0x%02x%02x%02x%02x",
                            data[0] & 0xff, data[1] & 0xff, data[2] & 0xff, data[3] & 0xff));
        }

        final ImageContents contents;
        try {
            contents = reader.read(data);
        } catch (BinaryParseException ex) {
            return degraded(buildId, component, formatOf(reader), ex.status(), ex.getMessage());
        }

        final List<BinarySymbol> symbols = assignIds(contents.symbols());
        final List<String> classNames = new ArrayList<>();
        for (BinarySymbol s : symbols) {
            if (s.name().startsWith(OBJC_CLASS_PREFIX) && s.name().length() > OBJC_CLASS_PREFIX.length()) {
                final String cls = s.name().substring(OBJC_CLASS_PREFIX.length());
                if (!classNames.contains(cls)) {
                    classNames.add(cls);
                }
            }
        }

        final BinaryFeatureSet set = new BinaryFeatureSet(
                buildId,
                component,
                BinaryFeatureSet.artifactId(buildId, component),
                contents.format(),
                ExtractionStatus.COMPLETE,
                List.of(),
                strings.scan(data),
                new ArrayList<>(new LinkedHashSet<>(contents.imports())),
                symbols,
                new ObjcMetadataStub(classNames));
        log.info("Binary {}/{}: {} {} string(s), {} import(s), {} symbol(s)", buildId, component,
                set.format(), set.strings().size(), set.imports().size(), set.symbols().size());
        return set;
    }

    /**
     * Drops exact repeats (a name listed in both .symtab and .dynsym) and numbers the
     * remaining occurrences of each name.
     */
    static List<BinarySymbol> assignIds(List<RawSymbol> raw) {
        final Map<String, Integer> occurrences = new HashMap<>();
        final List<BinarySymbol> out = new ArrayList<>();
        for (RawSymbol s : new LinkedHashSet<>(raw)) {
            final int n = occurrences.merge(s.name(), 1, Integer::sum);
            out.add(new BinarySymbol(Ids.symbolId(s.name(), n), s.name(), s.address(), s.defined()));
        }
        return out;
    }

    private static BinaryFormat formatOf(BinaryImageReader reader) {
        return reader instanceof ElfReader ? BinaryFormat.ELF : BinaryFormat.MACH_O;
    }

    private static BinaryFeatureSet degraded(String buildId, String component, BinaryFormat format,
                                             ExtractionStatus status, String notice) {
        log.warn("Binary {}/{} {}: {}", buildId, component, status, notice);
        return BinaryFeatureSet.degraded(buildId, component, format, status, notice);
    }

    private static String safeMsg(Throwable t) {
        final String m = t.getMessage();
        if (m == null) {
            return t.getClass().getSimpleName();
        }
        return m.length() > 300 ? m.substring(0, 300) + "..." : m;
    }
}
