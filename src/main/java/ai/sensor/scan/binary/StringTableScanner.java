package ai.sensor.scan.binary;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Printable ASCII runs of at least minLength bytes, deduplicated in first-seen order.
 */
public final class StringTableScanner {

    private final int minLength;

    public StringTableScanner(int minLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1, got " + minLength);
        }
        this.minLength = minLength;
    }

    public List<String> scan(byte[] data) {
        final Set<String> seen = new LinkedHashSet<>();
        int start = -1;
        for (int i = 0; i <= data.length; i++) {
            final boolean printable = i < data.length && isPrintable(data[i]);
            if (printable) {
                if (start < 0) {
                    start = i;
                }
            } else if (start >= 0) {
                if (i - start >= minLength) {
                    seen.add(new String(data, start, i - start, StandardCharsets.US_ASCII));
                }
                start = -1;
            }
        }
        return new ArrayList<>(seen);
    }

    private static boolean isPrintable(byte b) {
        return b >= 0x20 && b <= 0x7e || b == '\t';
    }
}
