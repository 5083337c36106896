package ai.sensor.scan.binary;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Bounds-checked view over a region of an image. Every read names what it reads so a
 * truncation notice says where the image ran out.
 */
final class ByteReader {

    private final byte[] data;
    private final int base;
    private final int length;
    private final ByteOrder order;

    ByteReader(byte[] data, ByteOrder order) {
        this(data, 0, data.length, order);
    }

    private ByteReader(byte[] data, int base, int length, ByteOrder order) {
        this.data = Objects.requireNonNull(data, "data");
        this.base = base;
        this.length = length;
        this.order = Objects.requireNonNull(order, "order");
    }

    int length() {
        return length;
    }

    ByteOrder order() {
        return order;
    }

    ByteReader withOrder(ByteOrder newOrder) {
        return new ByteReader(data, base, length, newOrder);
    }

    ByteReader slice(long offset, long size, String what) throws BinaryParseException {
        require(offset, size, what);
        return new ByteReader(data, base + (int) offset, (int) size, order);
    }

    void require(long offset, long size, String what) throws BinaryParseException {
        if (offset < 0 || size < 0 || offset > length || size > length - offset) {
            throw BinaryParseException.truncated(what + " at offset " + offset + " needs " + size
                    + " byte(s) but the image has " + length);
        }
    }

    int u8(long offset, String what) throws BinaryParseException {
        require(offset, 1, what);
        return data[base + (int) offset] & 0xff;
    }

    int u16(long offset, String what) throws BinaryParseException {
        require(offset, 2, what);
        final int p = base + (int) offset;
        final int b0 = data[p] & 0xff;
        final int b1 = data[p + 1] & 0xff;
        return order == ByteOrder.BIG_ENDIAN ? (b0 << 8) | b1 : (b1 << 8) | b0;
    }

    long u32(long offset, String what) throws BinaryParseException {
        require(offset, 4, what);
        final int p = base + (int) offset;
        long v = 0;
        for (int i = 0; i < 4; i++) {
            final int b = data[p + (order == ByteOrder.BIG_ENDIAN ? i : 3 - i)] & 0xff;
            v = (v << 8) | b;
        }
        return v;
    }

    long u64(long offset, String what) throws BinaryParseException {
        require(offset, 8, what);
        final int p = base + (int) offset;
        long v = 0;
        for (int i = 0; i < 8; i++) {
            final int b = data[p + (order == ByteOrder.BIG_ENDIAN ? i : 7 - i)] & 0xff;
            v = (v << 8) | b;
        }
        return v;
    }

    /**
     * NUL-terminated string starting at offset, never reading at or past limit.
     */
    String cString(long offset, long limit, String what) throws BinaryParseException {
        final long end = Math.min(limit, length);
        if (offset < 0 || offset >= end) {
            throw BinaryParseException.malformed(what + " offset " + offset + " lies outside its table");
        }
        int i = (int) offset;
        while (i < end && data[base + i] != 0) {
            i++;
        }
        return new String(data, base + (int) offset, i - (int) offset, StandardCharsets.UTF_8);
    }
}
