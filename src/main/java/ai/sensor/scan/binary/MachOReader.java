package ai.sensor.scan.binary;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import ai.sensor.model.BinaryFormat;

/**
 * Reads linked dylibs and the LC_SYMTAB symbol table of a Mach-O image. Universal (fat)
 * binaries are read from their first slice.
 */
public final class MachOReader implements BinaryImageReader {

    static final long MH_MAGIC = 0xFEEDFACEL;
    static final long MH_CIGAM = 0xCEFAEDFEL;
    static final long MH_MAGIC_64 = 0xFEEDFACFL;
    static final long MH_CIGAM_64 = 0xCFFAEDFEL;
    static final long FAT_MAGIC = 0xCAFEBABEL;
    static final long FAT_MAGIC_64 = 0xCAFEBABFL;

    static final long LC_SYMTAB = 0x2L;
    static final long LC_LOAD_DYLIB = 0xCL;
    static final long LC_LAZY_LOAD_DYLIB = 0x20L;
    static final long LC_LOAD_WEAK_DYLIB = 0x80000018L;
    static final long LC_REEXPORT_DYLIB = 0x8000001FL;
    static final long LC_LOAD_UPWARD_DYLIB = 0x80000023L;

    // Java class files share the fat magic; their minor/major version reads as a huge arch count.
    private static final long MAX_FAT_ARCHS = 30;

    private static final int N_STAB = 0xe0;
    private static final int N_TYPE = 0x0e;

    @Override
    public boolean accepts(byte[] data) {
        final long magic = magic(data);
        return magic == MH_MAGIC || magic == MH_CIGAM || magic == MH_MAGIC_64 || magic == MH_CIGAM_64
                || magic == FAT_MAGIC || magic == FAT_MAGIC_64;
    }

    @Override
    public ImageContents read(byte[] data) throws BinaryParseException {
        final long magic = magic(data);
        final ByteReader whole = new ByteReader(data, ByteOrder.BIG_ENDIAN);
        if (magic == FAT_MAGIC || magic == FAT_MAGIC_64) {
            return readThin(firstSlice(whole, magic == FAT_MAGIC_64), BinaryFormat.MACH_O_FAT);
        }
        return readThin(whole, BinaryFormat.MACH_O);
    }

    private static ByteReader firstSlice(ByteReader fat, boolean wide) throws BinaryParseException {
        final long count = fat.u32(4, "fat header");
        if (count > MAX_FAT_ARCHS) {
            throw BinaryParseException.unsupported("fat magic with " + count
                    + " architectures; not a universal binary");
        }
        if (count == 0) {
            throw BinaryParseException.malformed("universal binary lists no architectures");
        }
        final long offset;
        final long size;
        if (wide) {
            offset = fat.u64(8 + 8, "fat_arch_64 offset");
            size = fat.u64(8 + 16, "fat_arch_64 size");
        } else {
            offset = fat.u32(8 + 8, "fat_arch offset");
            size = fat.u32(8 + 12, "fat_arch size");
        }
        final ByteReader slice = fat.slice(offset, size, "first architecture slice");
        final long inner = slice.length() >= 4 ? slice.u32(0, "slice magic") : 0;
        if (inner != MH_MAGIC && inner != MH_CIGAM && inner != MH_MAGIC_64 && inner != MH_CIGAM_64) {
            throw BinaryParseException.malformed(String.format("first slice has no Mach-O magic (0x%08x)", inner));
        }
        return slice;
    }

    private static ImageContents readThin(ByteReader image, BinaryFormat format) throws BinaryParseException {
        final long magic = image.u32(0, "Mach-O magic");
        final boolean is64 = magic == MH_MAGIC_64 || magic == MH_CIGAM_64;
        final ByteReader in = (magic == MH_CIGAM || magic == MH_CIGAM_64)
                ? image.withOrder(ByteOrder.LITTLE_ENDIAN)
                : image.withOrder(ByteOrder.BIG_ENDIAN);

        final int headerSize = is64 ? 32 : 28;
        in.require(0, headerSize, "mach_header");
        final long ncmds = in.u32(16, "ncmds");
        final long sizeofcmds = in.u32(20, "sizeofcmds");
        in.require(headerSize, sizeofcmds, "load commands");

        final List<String> imports = new ArrayList<>();
        final List<RawSymbol> symbols = new ArrayList<>();

        long off = headerSize;
        final long end = headerSize + sizeofcmds;
        for (long i = 0; i < ncmds; i++) {
            if (off + 8 > end) {
                throw BinaryParseException.malformed("load command " + i + " starts past sizeofcmds");
            }
            final long cmd = in.u32(off, "load command");
            final long cmdsize = in.u32(off + 4, "load command size");
            if (cmdsize < 8 || off + cmdsize > end) {
                throw BinaryParseException.malformed("load command " + i + " has invalid size " + cmdsize);
            }

            if (cmd == LC_SYMTAB) {
                readSymtab(in, off, is64, symbols);
            } else if (cmd == LC_LOAD_DYLIB || cmd == LC_LOAD_WEAK_DYLIB || cmd == LC_REEXPORT_DYLIB
                    || cmd == LC_LAZY_LOAD_DYLIB || cmd == LC_LOAD_UPWARD_DYLIB) {
                final long nameOffset = in.u32(off + 8, "dylib name offset");
                imports.add(in.cString(off + nameOffset, off + cmdsize, "dylib name"));
            }
            off += cmdsize;
        }
        return new ImageContents(format, imports, symbols);
    }

    private static void readSymtab(ByteReader in, long cmdOff, boolean is64, List<RawSymbol> out)
            throws BinaryParseException {
        final long symoff = in.u32(cmdOff + 8, "symoff");
        final long nsyms = in.u32(cmdOff + 12, "nsyms");
        final long stroff = in.u32(cmdOff + 16, "stroff");
        final long strsize = in.u32(cmdOff + 20, "strsize");
        final int entrySize = is64 ? 16 : 12;

        in.require(symoff, nsyms * entrySize, "symbol table");
        in.require(stroff, strsize, "string table");

        for (long i = 0; i < nsyms; i++) {
            final long e = symoff + i * entrySize;
            final long strx = in.u32(e, "n_strx");
            final int type = in.u8(e + 4, "n_type");
            if ((type & N_STAB) != 0 || strx == 0) {
                continue;
            }
            if (strx >= strsize) {
                throw BinaryParseException.malformed("symbol " + i + " name offset " + strx
                        + " exceeds string table size " + strsize);
            }
            final long value = is64 ? in.u64(e + 8, "n_value") : in.u32(e + 8, "n_value");
            final String name = in.cString(stroff + strx, stroff + strsize, "symbol name");
            if (!name.isEmpty()) {
                out.add(new RawSymbol(name, value, (type & N_TYPE) != 0));
            }
        }
    }

    private static long magic(byte[] data) {
        if (data.length < 4) {
            return 0;
        }
        return ((long) (data[0] & 0xff) << 24) | ((data[1] & 0xff) << 16) | ((data[2] & 0xff) << 8) | (data[3] & 0xff);
    }
}
