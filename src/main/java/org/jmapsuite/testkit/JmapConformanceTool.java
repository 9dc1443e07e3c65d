package org.jmapsuite.testkit;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jmapsuite.batch.BatchInvariantChecker;
import org.jmapsuite.client.HttpJmapTransport;
import org.jmapsuite.client.JmapTransport;
import org.jmapsuite.client.RequestOrchestrator;
import org.jmapsuite.obs.JsonLinesLogger;
import org.jmapsuite.obs.StructuredJsonLinesLogger;

/**
 * CLI that runs the built-in conformance catalog against a JMAP server.
 */
public final class JmapConformanceTool {
    private JmapConformanceTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err, System.getenv());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(
            final String[] args,
            final PrintStream out,
            final PrintStream err,
            final Map<String, String> environment) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        Objects.requireNonNull(environment, "environment");

        final Config config;
        final HarnessConfig harnessConfig;
        try {
            config = parseArgs(args);
            if (config.help()) {
                printUsage(out);
                return 0;
            }
            harnessConfig = HarnessConfig.load(config.configPath(), environment, config.overrides());
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        } catch (final IOException e) {
            err.println("cannot read config: " + e.getMessage());
            return 2;
        }

        return runSuite(
                harnessConfig,
                new HttpJmapTransport(harnessConfig.apiUrl(), harnessConfig.bearerToken()),
                config.jsonOutput(),
                out,
                err);
    }

    static int runSuite(
            final HarnessConfig harnessConfig,
            final JmapTransport transport,
            final boolean jsonOutput,
            final PrintStream out,
            final PrintStream err) {
        // err stays open after the run; the logger flushes every line
        final JsonLinesLogger logger = new StructuredJsonLinesLogger(err);
        try {
            final RequestOrchestrator orchestrator = new RequestOrchestrator(
                    transport,
                    new BatchInvariantChecker(harnessConfig.strictProperties()),
                    logger);
            final ServerAdapter adapter = new StaticAccountServerAdapter(
                    orchestrator,
                    harnessConfig.accountId(),
                    harnessConfig.pristineAccountId(),
                    harnessConfig.using());
            final SuiteReport report = new ConformanceRunner(adapter, logger, Clock.systemUTC())
                    .run(MailboxConformanceCatalog.registry());
            renderSummary(report, out);
            if (jsonOutput) {
                out.println();
                out.println(report.toJson());
            }
            return report.isSuccessful() ? 0 : 1;
        } catch (final RuntimeException e) {
            err.println("conformance run failed: " + e.getMessage());
            return 1;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path configPath = null;
        final Map<String, Object> overrides = new LinkedHashMap<>();
        boolean jsonOutput = false;
        boolean help = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if ("--json".equals(arg)) {
                jsonOutput = true;
                continue;
            }
            if ("--strict".equals(arg)) {
                overrides.put(HarnessConfig.STRICT_PROPERTIES, true);
                continue;
            }
            if (arg.startsWith("--config=")) {
                configPath = Path.of(valueAfterPrefix(arg, "--config="));
                continue;
            }
            if (arg.startsWith("--url=")) {
                overrides.put(HarnessConfig.API_URL, valueAfterPrefix(arg, "--url="));
                continue;
            }
            if (arg.startsWith("--token=")) {
                overrides.put(HarnessConfig.BEARER_TOKEN, valueAfterPrefix(arg, "--token="));
                continue;
            }
            if (arg.startsWith("--account=")) {
                overrides.put(HarnessConfig.ACCOUNT_ID, valueAfterPrefix(arg, "--account="));
                continue;
            }
            if (arg.startsWith("--pristine-account=")) {
                overrides.put(HarnessConfig.PRISTINE_ACCOUNT_ID, valueAfterPrefix(arg, "--pristine-account="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }
        return new Config(configPath, overrides, jsonOutput, help);
    }

    private static void renderSummary(final SuiteReport report, final PrintStream out) {
        out.println("JMAP conformance run");
        out.println("- server: " + report.serverName());
        out.println("- total: " + report.totalTests());
        out.println("- passed: " + report.passedCount());
        out.println("- failed: " + report.failedCount());
        out.println("- skipped: " + report.skippedCount());
        out.println("- error: " + report.errorCount());
        for (final TestResult result : report.results()) {
            out.println("  - " + result.status().name().toLowerCase(Locale.ROOT) + " " + result.name());
            for (final String diagnostic : result.diagnostics()) {
                out.println("      " + diagnostic.replace(System.lineSeparator(), System.lineSeparator() + "      "));
            }
        }
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: JmapConformanceTool [--config=<path>] [--url=<apiUrl>] [--account=<id>] [options]");
        stream.println("  --config=<path>            Config JSON/YAML path");
        stream.println("  --url=<apiUrl>             JMAP API URL (or JMAP_API_URL)");
        stream.println("  --token=<bearer>           Bearer token (or JMAP_BEARER_TOKEN)");
        stream.println("  --account=<id>             Account id (or JMAP_ACCOUNT_ID)");
        stream.println("  --pristine-account=<id>    Empty account for pristine tests (or JMAP_PRISTINE_ACCOUNT_ID)");
        stream.println("  --strict                   Report unknown properties (or JMAP_STRICT_PROPERTIES)");
        stream.println("  --json                     Print the suite report as JSON");
        stream.println("  --help                     Show usage");
    }

    private record Config(Path configPath, Map<String, Object> overrides, boolean jsonOutput, boolean help) {}
}
