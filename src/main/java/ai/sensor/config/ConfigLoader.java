package ai.sensor.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.sensor.match.BinaryDiffMatchers;
import ai.sensor.score.ScoringRules;

/**
 * Loads {@link SensorConfig}: classpath defaults, deep-merged with an optional user file.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "/sensor-defaults.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public SensorConfig loadDefaults() {
        return load(null);
    }

    /**
     * @param overlay user JSON whose keys replace the defaults key by key; may be null
     */
    public SensorConfig load(Path overlay) {
        JsonNode tree = readDefaults();
        if (overlay != null) {
            if (!Files.isRegularFile(overlay)) {
                throw new ConfigException("config file not found: " + overlay);
            }
            try {
                tree = mapper.readerForUpdating(tree).readValue(overlay.toFile());
            } catch (IOException ex) {
                throw new ConfigException("cannot parse " + overlay + ": " + ex.getMessage(), ex);
            }
            log.info("Config overlay applied from {}", overlay);
        }

        final SensorConfig config;
        try {
            config = mapper.treeToValue(tree, SensorConfig.class);
        } catch (IOException | IllegalArgumentException ex) {
            throw new ConfigException("invalid configuration: " + ex.getMessage(), ex);
        }
        validate(config);
        return config;
    }

    private JsonNode readDefaults() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigException("missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return mapper.readTree(in);
        } catch (IOException ex) {
            throw new ConfigException("cannot read " + DEFAULTS_RESOURCE, ex);
        }
    }

    static void validate(SensorConfig c) {
        if (c.binary() == null || c.logs() == null || c.source() == null || c.pipeline() == null
                || c.scoring() == null) {
            throw new ConfigException("configuration is missing a section");
        }
        positive("binary.minStringLength", c.binary().minStringLength());
        positive("logs.minFragmentLength", c.logs().minFragmentLength());
        positive("source.lookaheadLines", c.source().lookaheadLines());
        positive("pipeline.parallelism", c.pipeline().parallelism());

        final var matchers = BinaryDiffMatchers.defaults().names();
        if (!matchers.contains(c.pipeline().matcher())) {
            throw new ConfigException("pipeline.matcher '" + c.pipeline().matcher() + "' is not one of " + matchers);
        }
        if (!ScoringRules.VERSION.equals(c.scoring().version())) {
            throw new ConfigException("scoring.version '" + c.scoring().version() + "' is not supported, expected "
                    + ScoringRules.VERSION);
        }
        if (c.scoring().weights() == null) {
            throw new ConfigException("scoring.weights is missing");
        }
        for (var e : c.scoring().weights().entrySet()) {
            if (e.getValue() == null) {
                throw new ConfigException("scoring.weights." + e.getKey() + " has no value");
            }
        }
        try {
            c.scoringProfile().requireCovers(ScoringRules.v1());
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("scoring.weights: " + ex.getMessage(), ex);
        }
    }

    private static void positive(String key, int value) {
        if (value < 1) {
            throw new ConfigException(key + " must be >= 1, got " + value);
        }
    }
}
