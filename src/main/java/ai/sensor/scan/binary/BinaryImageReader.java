package ai.sensor.scan.binary;

/**
 * Format-specific walker of an image's import and symbol tables.
 */
public interface BinaryImageReader {

    /**
     * @param data whole image, at least four bytes long
     */
    boolean accepts(byte[] data);

    ImageContents read(byte[] data) throws BinaryParseException;
}
