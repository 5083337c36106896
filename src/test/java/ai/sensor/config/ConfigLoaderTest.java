package ai.sensor.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.sensor.score.ScoringProfile;
import ai.sensor.score.ScoringRules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @TempDir
    Path tmp;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void shouldLoadDefaultsMatchingBuiltInProfile() {
        final SensorConfig config = loader.loadDefaults();

        assertEquals(6, config.binary().minStringLength());
        assertEquals(8, config.logs().minFragmentLength());
        assertEquals(3, config.source().lookaheadLines());
        assertEquals("name", config.pipeline().matcher());
        assertEquals(ScoringProfile.defaults(), config.scoringProfile());
    }

    @Test
    void shouldOverlayOnlyTheKeysGiven() throws IOException {
        final Path overlay = write("{\"logs\":{\"minFragmentLength\":12},"
                + "\"scoring\":{\"weights\":{\"new-log-template\":2.0}}}");

        final SensorConfig config = loader.load(overlay);

        assertEquals(12, config.logs().minFragmentLength());
        assertEquals(6, config.binary().minStringLength());
        assertEquals(2.0, config.scoringProfile().weightOf(ScoringRules.NEW_LOG_TEMPLATE));
        assertEquals(3.0, config.scoringProfile().weightOf(ScoringRules.UNGUARDED_ALLOCATION_SIZING));
    }

    @Test
    void shouldRejectMissingWeight() throws IOException {
        final Path overlay = write("{\"scoring\":{\"weights\":{\"binary-strings-added\":null}}}");

        final ConfigException ex = assertThrows(ConfigException.class, () -> loader.load(overlay));
        assertTrue(ex.getMessage().contains("binary-strings-added"), ex.getMessage());
    }

    @Test
    void shouldRejectWeightForUnknownRule() throws IOException {
        final Path overlay = write("{\"scoring\":{\"weights\":{\"made-up-rule\":1.0}}}");

        assertThrows(ConfigException.class, () -> loader.load(overlay));
    }

    @Test
    void shouldRejectUnknownMatcherAndVersion() throws IOException {
        assertThrows(ConfigException.class, () -> loader.load(write("{\"pipeline\":{\"matcher\":\"bindiff\"}}")));
        assertThrows(ConfigException.class, () -> loader.load(write("{\"scoring\":{\"version\":\"rules/v2\"}}")));
    }

    @Test
    void shouldRejectNonPositiveTunables() throws IOException {
        final ConfigException ex = assertThrows(ConfigException.class,
                () -> loader.load(write("{\"pipeline\":{\"parallelism\":0}}")));
        assertTrue(ex.getMessage().startsWith("pipeline.parallelism"));
    }

    @Test
    void shouldFailOnMissingOrBrokenFile() throws IOException {
        assertThrows(ConfigException.class, () -> loader.load(tmp.resolve("absent.json")));
        assertThrows(ConfigException.class, () -> loader.load(write("{not json")));
        assertThrows(ConfigException.class, () -> loader.load(write("{\"binary\":{\"minStrLen\":4}}")));
    }

    private Path write(String json) throws IOException {
        final Path p = Files.createTempFile(tmp, "sensor", ".json");
        Files.writeString(p, json, StandardCharsets.UTF_8);
        return p;
    }
}
