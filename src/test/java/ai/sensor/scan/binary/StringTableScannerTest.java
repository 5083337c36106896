package ai.sensor.scan.binary;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StringTableScannerTest {

    @Test
    void shouldKeepRunsAtOrAboveMinimumLengthInFirstSeenOrder() {
        final byte[] data = "\0\u0001hello!\0abc\0entries exceed\0hello!\0\u0002tail6x"
                .getBytes(StandardCharsets.ISO_8859_1);

        final List<String> strings = new StringTableScanner(6).scan(data);

        assertEquals(List.of("hello!", "entries exceed", "tail6x"), strings);
    }

    @Test
    void shouldSplitOnNonPrintableBytes() {
        final byte[] data = {'a', 'b', 'c', 'd', 'e', 'f', (byte) 0x80, 'g', 'h', 'i', 'j', 'k', 'l'};

        assertEquals(List.of("abcdef", "ghijkl"), new StringTableScanner(6).scan(data));
    }

    @Test
    void shouldRejectNonPositiveMinimum() {
        assertThrows(IllegalArgumentException.class, () -> new StringTableScanner(0));
    }
}
