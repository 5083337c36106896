package ai.sensor.scan.binary;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import ai.sensor.model.BinaryFormat;
import net.fornwall.jelf.ElfDynamicSection;
import net.fornwall.jelf.ElfException;
import net.fornwall.jelf.ElfFile;
import net.fornwall.jelf.ElfSection;
import net.fornwall.jelf.ElfStringTable;
import net.fornwall.jelf.ElfSymbol;
import net.fornwall.jelf.ElfSymbolTableSection;

/**
 * Reads DT_NEEDED entries and the .symtab/.dynsym tables of an ELF image with jelf. Names are
 * resolved through the string table each section links to, so images without a section name
 * table or program headers still read. An image without section headers yields nothing.
 */
public final class ElfReader implements BinaryImageReader {

    // jelf reports running off the end of the buffer with these messages
    private static final List<String> END_OF_DATA = List.of(
            "outside file", "Error reading", "Premature end");

    @Override
    public boolean accepts(byte[] data) {
        return data.length >= 4 && data[0] == 0x7f && data[1] == 'E' && data[2] == 'L' && data[3] == 'F';
    }

    @Override
    public ImageContents read(byte[] data) throws BinaryParseException {
        if (!hasSectionHeaders(data)) {
            return new ImageContents(BinaryFormat.ELF, List.of(), List.of());
        }
        try {
            final ElfFile elf = ElfFile.from(data);
            final List<String> imports = new ArrayList<>();
            final List<RawSymbol> symbols = new ArrayList<>();
            for (int i = 1; i < elf.e_shnum; i++) {
                final ElfSection section = elf.getSection(i);
                if (section instanceof ElfSymbolTableSection) {
                    readSymbols((ElfSymbolTableSection) section, linkedStrings(elf, section), symbols);
                } else if (section instanceof ElfDynamicSection) {
                    readNeeded((ElfDynamicSection) section, linkedStrings(elf, section), imports);
                }
            }
            return new ImageContents(BinaryFormat.ELF, imports, symbols);
        } catch (ElfException | IndexOutOfBoundsException | ArithmeticException | IllegalArgumentException e) {
            throw translate(e);
        }
    }

    /**
     * Validates the fixed header and the extent of the section header table before jelf walks
     * them, so a short image reports as truncated rather than as a generic parse failure.
     */
    private static boolean hasSectionHeaders(byte[] data) throws BinaryParseException {
        final ByteReader raw = new ByteReader(data, ByteOrder.LITTLE_ENDIAN);
        final int elfClass = raw.u8(4, "EI_CLASS");
        final int encoding = raw.u8(5, "EI_DATA");
        if (elfClass != ElfFile.CLASS_32 && elfClass != ElfFile.CLASS_64) {
            throw BinaryParseException.malformed("unknown ELF class " + elfClass);
        }
        if (encoding != ElfFile.DATA_LSB && encoding != ElfFile.DATA_MSB) {
            throw BinaryParseException.malformed("unknown ELF data encoding " + encoding);
        }
        final boolean is64 = elfClass == ElfFile.CLASS_64;
        final ByteReader in = raw.withOrder(encoding == ElfFile.DATA_MSB ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        in.require(0, is64 ? 64 : 52, "ELF header");

        final long shoff = is64 ? in.u64(0x28, "e_shoff") : in.u32(0x20, "e_shoff");
        final int shentsize = in.u16(is64 ? 0x3A : 0x2E, "e_shentsize");
        final int shnum = in.u16(is64 ? 0x3C : 0x30, "e_shnum");
        if (shoff == 0 || shnum == 0) {
            return false;
        }
        if (shnum > Short.MAX_VALUE) {
            throw BinaryParseException.unsupported("section count " + shnum + " is out of range");
        }
        if (shentsize < (is64 ? 64 : 40)) {
            throw BinaryParseException.malformed("section header entry size " + shentsize + " is too small");
        }
        in.require(shoff, (long) shnum * shentsize, "section header table");
        return true;
    }

    private static ElfStringTable linkedStrings(ElfFile elf, ElfSection section) throws BinaryParseException {
        final int link = section.header.sh_link;
        if (link <= 0 || link >= elf.e_shnum || !(elf.getSection(link) instanceof ElfStringTable)) {
            throw BinaryParseException.malformed("section links to missing string table " + link);
        }
        return (ElfStringTable) elf.getSection(link);
    }

    private static void readSymbols(ElfSymbolTableSection table, ElfStringTable strings, List<RawSymbol> out) {
        // entry 0 is the reserved null symbol
        for (int i = 1; i < table.symbols.length; i++) {
            final ElfSymbol sym = table.symbols[i];
            final int type = sym.getType();
            if (sym.st_name == 0 || type == ElfSymbol.STT_SECTION || type == ElfSymbol.STT_FILE) {
                continue;
            }
            final String name = strings.get(sym.st_name);
            if (!name.isEmpty()) {
                out.add(new RawSymbol(name, sym.st_value, sym.st_shndx != 0));
            }
        }
    }

    private static void readNeeded(ElfDynamicSection dynamic, ElfStringTable strings, List<String> out) {
        for (ElfDynamicSection.ElfDynamicStructure entry : dynamic.entries) {
            if (entry.d_tag == ElfDynamicSection.DT_NULL) {
                break;
            }
            if (entry.d_tag == ElfDynamicSection.DT_NEEDED) {
                out.add(strings.get((int) entry.d_val_or_ptr));
            }
        }
    }

    private static BinaryParseException translate(RuntimeException e) {
        final String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e instanceof ElfException && END_OF_DATA.stream().anyMatch(message::contains)) {
            return BinaryParseException.truncated(message);
        }
        return BinaryParseException.malformed(message);
    }
}
