package org.jsondelta.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jsondelta.engine.CompareOptions;
import org.jsondelta.engine.ComparisonResult;
import org.jsondelta.engine.DetectorSettings;
import org.jsondelta.engine.JsonDiffEngine;
import org.jsondelta.engine.KeyScope;
import org.jsondelta.engine.OneSidedMode;
import org.jsondelta.obs.CorrelationContext;
import org.jsondelta.obs.JsonLinesLogger;
import org.jsondelta.obs.StructuredJsonLinesLogger;
import org.jsondelta.pattern.IgnoreList;
import org.jsondelta.report.DiffReportGenerator;
import org.jsondelta.value.DocumentLoader;
import org.jsondelta.value.JsonValue;

/**
 * Compares two JSON or YAML files and prints a markdown or JSON report.
 *
 * <p>Exit code {@code 0} means no differences outside the ignore list, {@code 1} that differences
 * were found, {@code 2} a usage or input error.
 */
public final class JsonDiffLauncher {
    static final int EXIT_SAME = 0;
    static final int EXIT_DIFFERENT = 1;
    static final int EXIT_ERROR = 2;

    private JsonDiffLauncher() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != EXIT_SAME) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final LaunchConfig config;
        final IgnoreList ignoreList;
        try {
            config = LaunchConfig.parse(args);
            ignoreList = IgnoreList.of(config.ignorePatterns());
        } catch (final IllegalArgumentException exception) {
            err.println(exception.getMessage());
            printUsage(err);
            return EXIT_ERROR;
        }
        if (config.help()) {
            printUsage(out);
            return EXIT_SAME;
        }

        final JsonValue left;
        final JsonValue right;
        try {
            left = read(config.left());
            right = read(config.right());
        } catch (final IOException | IllegalArgumentException exception) {
            err.println("cannot read input: " + exception.getMessage());
            return EXIT_ERROR;
        }

        // not closed: err belongs to the caller
        final JsonLinesLogger logger = config.logToStderr() ? new StructuredJsonLinesLogger(err) : JsonLinesLogger.NOOP;
        final JsonDiffEngine engine = new JsonDiffEngine(config.compareOptions(), logger);
        final CorrelationContext correlation = CorrelationContext.next("compare")
            .withSources(config.left().toString(), config.right().toString());
        final ComparisonResult result = engine.compare(left, right, correlation);

        final DiffReportGenerator generator = new DiffReportGenerator(
            config.left().getFileName().toString(),
            config.right().getFileName().toString());
        final String report = config.format() == ReportFormat.JSON
            ? generator.toJson(result, ignoreList)
            : generator.toMarkdown(result, ignoreList);
        out.print(report);
        if (!report.endsWith("\n")) {
            out.println();
        }
        out.flush();
        return ignoreList.partition(result.diffs()).kept().isEmpty() ? EXIT_SAME : EXIT_DIFFERENT;
    }

    private static JsonValue read(final Path file) throws IOException {
        return DocumentLoader.load(file);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: JsonDiffLauncher --left=<file> --right=<file> [options]");
        stream.println("  --left=<file>                    Document treated as the old version");
        stream.println("  --right=<file>                   Document treated as the new version");
        stream.println("  --format=markdown|json           Report format (default: markdown)");
        stream.println("  --ignore=<pattern>               Hide differences matching the pattern (repeatable)");
        stream.println("  --one-sided=whole|expand         Report one-sided subtrees whole or leaf by leaf (default: whole)");
        stream.println("  --key-scope=location|pattern     Choose identity keys per array or per array pattern (default: location)");
        stream.println("  --min-overlap=<ratio>            Key values shared by both sides needed for a key (default: 0.5)");
        stream.println("  --min-array-size=<n>             Smaller arrays are compared by index (default: 2)");
        stream.println("  --preferred-keys=<a,b,...>       Fields tried first as identity keys");
        stream.println("  --log=stderr|none                Structured JSON-lines log destination (default: none)");
        stream.println("  --help                           Show usage");
    }

    enum ReportFormat {
        MARKDOWN,
        JSON;

        static ReportFormat fromText(final String text) {
            return switch (text.toLowerCase(Locale.ROOT)) {
                case "markdown", "md" -> MARKDOWN;
                case "json" -> JSON;
                default -> throw new IllegalArgumentException("unsupported format: " + text);
            };
        }
    }

    record LaunchConfig(
            Path left,
            Path right,
            ReportFormat format,
            List<String> ignorePatterns,
            CompareOptions compareOptions,
            boolean logToStderr,
            boolean help) {
        static LaunchConfig parse(final String[] args) {
            Path left = null;
            Path right = null;
            ReportFormat format = ReportFormat.MARKDOWN;
            final List<String> ignorePatterns = new ArrayList<>();
            OneSidedMode oneSidedMode = OneSidedMode.WHOLE_VALUE;
            KeyScope keyScope = KeyScope.LOCATION;
            final DetectorSettings.Builder detector = DetectorSettings.builder();
            boolean logToStderr = false;
            boolean help = false;

            for (final String arg : args) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    help = true;
                    continue;
                }
                if (arg.startsWith("--left=")) {
                    left = Path.of(requireValue(arg, "--left="));
                    continue;
                }
                if (arg.startsWith("--right=")) {
                    right = Path.of(requireValue(arg, "--right="));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = ReportFormat.fromText(requireValue(arg, "--format="));
                    continue;
                }
                if (arg.startsWith("--ignore=")) {
                    ignorePatterns.add(requireValue(arg, "--ignore="));
                    continue;
                }
                if (arg.startsWith("--one-sided=")) {
                    oneSidedMode = parseOneSided(requireValue(arg, "--one-sided="));
                    continue;
                }
                if (arg.startsWith("--key-scope=")) {
                    keyScope = parseKeyScope(requireValue(arg, "--key-scope="));
                    continue;
                }
                if (arg.startsWith("--min-overlap=")) {
                    detector.minOverlapRatio(parseRatio(requireValue(arg, "--min-overlap=")));
                    continue;
                }
                if (arg.startsWith("--min-array-size=")) {
                    detector.minArraySize(parsePositive(requireValue(arg, "--min-array-size="), "--min-array-size"));
                    continue;
                }
                if (arg.startsWith("--preferred-keys=")) {
                    detector.preferredKeys(parseList(requireValue(arg, "--preferred-keys=")));
                    continue;
                }
                if (arg.startsWith("--log=")) {
                    logToStderr = parseLog(requireValue(arg, "--log="));
                    continue;
                }
                throw new IllegalArgumentException("unsupported argument: " + arg);
            }

            if (!help && (left == null || right == null)) {
                throw new IllegalArgumentException("--left and --right are required");
            }
            final CompareOptions compareOptions = new CompareOptions(detector.build(), oneSidedMode, keyScope);
            return new LaunchConfig(left, right, format, List.copyOf(ignorePatterns), compareOptions, logToStderr, help);
        }

        private static String requireValue(final String arg, final String prefix) {
            final String value = Objects.requireNonNull(arg, "arg").substring(prefix.length()).trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("argument value is empty for " + prefix);
            }
            return value;
        }

        private static OneSidedMode parseOneSided(final String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "whole" -> OneSidedMode.WHOLE_VALUE;
                case "expand" -> OneSidedMode.EXPAND;
                default -> throw new IllegalArgumentException("unsupported --one-sided value: " + value);
            };
        }

        private static KeyScope parseKeyScope(final String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "location" -> KeyScope.LOCATION;
                case "pattern" -> KeyScope.PATTERN;
                default -> throw new IllegalArgumentException("unsupported --key-scope value: " + value);
            };
        }

        private static boolean parseLog(final String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "stderr" -> true;
                case "none" -> false;
                default -> throw new IllegalArgumentException("unsupported --log value: " + value);
            };
        }

        private static double parseRatio(final String value) {
            try {
                final double parsed = Double.parseDouble(value);
                if (!(parsed >= 0.0d && parsed <= 1.0d)) {
                    throw new IllegalArgumentException("--min-overlap must be between 0 and 1: " + value);
                }
                return parsed;
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid --min-overlap: " + value, numberFormatException);
            }
        }

        private static int parsePositive(final String value, final String name) {
            try {
                final int parsed = Integer.parseInt(value);
                if (parsed < 1) {
                    throw new IllegalArgumentException(name + " must be at least 1: " + value);
                }
                return parsed;
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid " + name + ": " + value, numberFormatException);
            }
        }

        private static List<String> parseList(final String value) {
            final List<String> items = new ArrayList<>();
            for (final String item : Arrays.asList(value.split(","))) {
                final String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
            return items;
        }
    }
}
