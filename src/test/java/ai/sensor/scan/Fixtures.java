package ai.sensor.scan;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Paths of the checked-in fixtures under src/test/resources/fixtures.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Path path(String relative) {
        final URL url = Fixtures.class.getResource("/fixtures/" + relative);
        if (url == null) {
            throw new IllegalStateException("missing fixture " + relative);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static Path parserBefore() {
        return path("parser/before");
    }

    public static Path parserAfter() {
        return path("parser/after");
    }
}
