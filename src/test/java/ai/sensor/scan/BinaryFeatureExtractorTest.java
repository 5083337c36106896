package ai.sensor.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinaryFormat;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.ExtractionStatus;
import ai.sensor.scan.binary.BinaryImageReader;
import ai.sensor.scan.binary.BinaryParseException;
import ai.sensor.scan.binary.ImageFixtures;
import ai.sensor.scan.binary.RawSymbol;
import ai.sensor.scan.binary.StringTableScanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BinaryFeatureExtractorTest {

    @TempDir
    Path tmp;

    private final BinaryFeatureExtractor extractor = new BinaryFeatureExtractor(6);

    @Test
    void shouldExtractStringsImportsSymbolsAndObjcClasses() throws IOException {
        final Path bin = write("parserd", ImageFixtures.machO()
                .dylib("/usr/lib/libobjc.A.dylib")
                .symbol("_OBJC_CLASS_$_EntryTable", 0x2000, true)
                .symbol("_parse_entries", 0x1000, true)
                .symbol("_parse_entries", 0x1800, true)
                .cstring("parse_entries: count %u exceeds limit")
                .build());

        final BinaryFeatureSet set = extractor.extract("b2", "parserd", bin);

        assertEquals(ExtractionStatus.COMPLETE, set.status());
        assertEquals(BinaryFormat.MACH_O, set.format());
        assertEquals("art:b2/parserd/binary", set.artifactId());
        assertEquals(List.of("/usr/lib/libobjc.A.dylib"), set.imports());
        assertEquals(List.of("EntryTable"), set.objcMetadataStub().classNames());
        assertTrue(set.strings().contains("parse_entries: count %u exceeds limit"));
        assertTrue(set.notices().isEmpty());

        final List<String> ids = set.symbols().stream().map(BinarySymbol::symbolId).toList();
        assertEquals(List.of("sym:_OBJC_CLASS_$_EntryTable", "sym:_parse_entries", "sym:_parse_entries#2"), ids);
    }

    @Test
    void shouldReturnTruncatedEmptySetForHeaderCutShort() throws IOException {
        final byte[] full = ImageFixtures.machO().symbol("_main", 0x1000, true).build();
        final Path bin = write("cut", Arrays.copyOf(full, 24));

        final BinaryFeatureSet set = extractor.extract("b1", "parserd", bin);

        assertEquals(ExtractionStatus.TRUNCATED, set.status());
        assertTrue(set.strings().isEmpty());
        assertTrue(set.imports().isEmpty());
        assertTrue(set.symbols().isEmpty());
        assertTrue(set.objcMetadataStub().classNames().isEmpty());
        assertEquals(1, set.notices().size());
        assertTrue(set.notices().get(0).contains("mach_header"), set.notices().get(0));
    }

    @Test
    void shouldReportAbsentWhenNoPathGiven() {
        final BinaryFeatureSet set = extractor.extract("b1", "parserd", (Path) null);

        assertEquals(ExtractionStatus.ABSENT, set.status());
        assertEquals(1, set.notices().size());
    }

    @Test
    void shouldReportUnsupportedForUnknownMagicAndTinyFiles() throws IOException {
        assertEquals(ExtractionStatus.UNSUPPORTED,
                extractor.extract("b1", "c", write("script", "#!/bin/sh\necho hi\n".getBytes())).status());
        assertEquals(ExtractionStatus.UNSUPPORTED,
                extractor.extract("b1", "c", write("tiny", new byte[] {0x7f, 'E'})).status());
        assertEquals(ExtractionStatus.UNSUPPORTED,
                extractor.extract("b1", "c", tmp).status());
    }

    @Test
    void shouldReportUnreadableForMissingFile() {
        final BinaryFeatureSet set = extractor.extract("b1", "c", tmp.resolve("gone"));

        assertEquals(ExtractionStatus.UNREADABLE, set.status());
        assertTrue(set.symbols().isEmpty());
    }

    @Test
    void shouldCarryReaderStatusIntoDegradedSet() throws Exception {
        final BinaryImageReader reader = mock(BinaryImageReader.class);
        when(reader.accepts(any())).thenReturn(true);
        when(reader.read(any())).thenThrow(BinaryParseException.malformed("symbol 3 name offset out of range"));
        final BinaryFeatureExtractor withMock = new BinaryFeatureExtractor(new StringTableScanner(6), List.of(reader));

        final BinaryFeatureSet set = withMock.extract("b1", "c", new byte[] {1, 2, 3, 4, 5});

        assertEquals(ExtractionStatus.MALFORMED, set.status());
        assertEquals(List.of("symbol 3 name offset out of range"), set.notices());
    }

    @Test
    void shouldDropExactDuplicateSymbols() {
        final List<BinarySymbol> symbols = BinaryFeatureExtractor.assignIds(List.of(
                new RawSymbol("main", 0x10, true),
                new RawSymbol("main", 0x10, true),
                new RawSymbol("main", 0x20, true)));

        assertEquals(2, symbols.size());
        assertEquals("sym:main#2", symbols.get(1).symbolId());
    }

    private Path write(String name, byte[] data) throws IOException {
        final Path p = tmp.resolve(name);
        Files.write(p, data);
        return p;
    }
}
