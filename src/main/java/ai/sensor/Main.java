package ai.sensor;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ai.sensor.bundle.EvidenceIntegrityException;
import ai.sensor.config.ConfigException;
import ai.sensor.config.ConfigLoader;
import ai.sensor.config.SensorConfig;
import ai.sensor.io.EvidenceWriter;
import ai.sensor.pipeline.ArtifactSet;
import ai.sensor.pipeline.DiffPipeline;
import ai.sensor.pipeline.DiffRun;

public final class Main {

    private static final List<String> PATH_OPTIONS = List.of(
            "from-source", "to-source", "from-binary", "to-binary", "from-logs", "to-logs", "outDir", "config");
    private static final List<String> VALUE_OPTIONS = List.of("component", "from", "to");

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        if (args.length == 0 || "--help".equals(args[0]) || "-h".equals(args[0])) {
            printUsage();
            return args.length == 0 ? 2 : 0;
        }
        if (!"diff".equals(args[0])) {
            System.err.println("ERROR: unknown command: " + args[0]);
            printUsage();
            return 2;
        }

        final Map<String, String> opts = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            final String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage();
                return 0;
            }
            final int eq = arg.indexOf('=');
            if (!arg.startsWith("--") || eq < 0) {
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }
            final String key = arg.substring(2, eq);
            if (!PATH_OPTIONS.contains(key) && !VALUE_OPTIONS.contains(key)) {
                System.err.println("ERROR: unknown argument: " + arg);
                printUsage();
                return 2;
            }
            opts.put(key, arg.substring(eq + 1));
        }
        for (String required : VALUE_OPTIONS) {
            if (opts.getOrDefault(required, "").isBlank()) {
                System.err.println("ERROR: missing --" + required + "=<value>");
                printUsage();
                return 2;
            }
        }

        final String component = opts.get("component");
        final Path outDir = path(opts, "outDir") != null ? path(opts, "outDir") : Paths.get(".oss-sensor");
        final ArtifactSet from = new ArtifactSet(opts.get("from"), component,
                path(opts, "from-source"), path(opts, "from-binary"), path(opts, "from-logs"));
        final ArtifactSet to = new ArtifactSet(opts.get("to"), component,
                path(opts, "to-source"), path(opts, "to-binary"), path(opts, "to-logs"));

        try {
            final SensorConfig config = new ConfigLoader().load(path(opts, "config"));
            final DiffRun run;
            try (DiffPipeline pipeline = new DiffPipeline(config)) {
                run = pipeline.run(from, to);
            }

            new EvidenceWriter(outDir).writeAll(run.bundle(), run.score(), run.triageReport(), run.hypotheses());

            System.out.println("Evidence written to: " + outDir.toAbsolutePath().normalize());
            System.out.println("Schema: " + EvidenceWriter.SCHEMA_VERSION + ", rules: " + run.score().rulesVersion());
            System.out.println("Diff: " + run.bundle().diffId()
                    + ", hunks: " + run.bundle().diffHunks().size()
                    + ", features: " + run.bundle().sourceFeatures().size()
                    + ", matches: " + run.bundle().logToBinaryMatches().size());
            System.out.println("Score: " + run.score().totalScore() + " from " + run.score().reasons().size()
                    + " reason(s)");
            if (!run.bundle().notices().isEmpty()) {
                System.err.println("WARN: notices: " + run.bundle().notices().size());
            }
            return 0;
        } catch (ConfigException ex) {
            System.err.println("ERROR: configuration: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (EvidenceIntegrityException ex) {
            System.err.println("ERROR: evidence integrity: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: diff failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Path path(Map<String, String> opts, String key) {
        final String v = opts.get(key);
        return v == null || v.isBlank() ? null : Paths.get(v);
    }

    private static void printUsage() {
        System.out.println("Usage: oss-sensor diff --component=<name> --from=<build> --to=<build> [options]");
        System.out.println("Options:");
        System.out.println("  --from-source=<dir>     Source tree of the older build");
        System.out.println("  --to-source=<dir>       Source tree of the newer build");
        System.out.println("  --from-binary=<file>    Binary of the older build");
        System.out.println("  --to-binary=<file>      Binary of the newer build");
        System.out.println("  --from-logs=<path>      Log file or directory of the older build");
        System.out.println("  --to-logs=<path>        Log file or directory of the newer build");
        System.out.println("  --outDir=<path>         Output directory (default: ./.oss-sensor)");
        System.out.println("  --config=<file>         JSON overlay for the bundled defaults");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
