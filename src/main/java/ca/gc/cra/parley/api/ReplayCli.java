package ca.gc.cra.parley.api;

import ca.gc.cra.parley.application.events.rules.ClassificationRuleSetProvider;
import ca.gc.cra.parley.application.events.rules.CompiledRuleSet;
import ca.gc.cra.parley.application.gate.GateVerdict;
import ca.gc.cra.parley.application.pipeline.TelemetryEngine;
import ca.gc.cra.parley.application.port.ClockPort;
import ca.gc.cra.parley.application.port.MetricsPort;
import ca.gc.cra.parley.config.GateConfig;
import ca.gc.cra.parley.config.YamlConfigLoader;
import ca.gc.cra.parley.domain.latency.LatencyTargets;
import ca.gc.cra.parley.domain.latency.TargetAssessment;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.infrastructure.replay.RecordFileReader;
import ca.gc.cra.parley.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded telemetry file through a fresh {@link TelemetryEngine} and gates on the
 * result.
 *
 * <p>Prints the conversation summary, one line per latency assessment and the threshold verdict.
 * Exits {@link ExitCode#GATE_FAILED} when any target or threshold fails.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: replay file=PATH [config=PATH] [profile=NAME] [metrics=none|otlp]";
  private static final String HELP_TEXT = """
      PARLEY conversation replay

      Usage:
        replay file=PATH [config=PATH] [profile=NAME] [metrics=none|otlp]

      Options:
        file=PATH             Recorded telemetry: '<epochMillis> [LEVEL] text' or JSON message lines
        config=PATH           Gate configuration YAML (thresholds, targets, rules)
        profile=NAME          Profile section merged over 'common' (default ci)
        rules=PATHS           Extra rule files, comma separated, evaluated before the built-in table
        metrics=none|otlp     Mirror counters and latency samples to OpenTelemetry (default none)
        otelEndpoint=URL      OTLP endpoint override

      Flags:
        --help               Show this message
        --verbose            Enable DEBUG logging (guard rejections, malformed messages)
        --quiet              Only log warnings and errors

      Exit status:
        0 gate passed, 1 gate failed, 2 invalid arguments, 3 IO error, 4 configuration error
      """;

  private ReplayCli() {}

  /**
   * Runs the replay workflow.
   *
   * @param args raw CLI arguments following the {@code replay} subcommand
   * @return exit code communicated to the invoking shell
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay");
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    Map<String, String> options;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String file = options.remove("file");
    if (file == null) {
      CliPrinter.println("Missing required option file=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path replayFile = Path.of(file);
    if (!Files.isRegularFile(replayFile)) {
      CliPrinter.println("Replay file not found: " + replayFile);
      return ExitCode.INVALID_ARGS;
    }

    GateConfig config;
    try {
      config = loadConfig(options);
    } catch (IOException ex) {
      log.error("Failed to read gate configuration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid configuration: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    MetricsPort metrics;
    try {
      metrics = TelemetryConfigurator.configureMetrics(options);
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (!options.isEmpty()) {
      CliPrinter.println("Unknown option(s): " + String.join(", ", options.keySet()));
      CliPrinter.println(SUMMARY_USAGE);
      closeQuietly(metrics);
      return ExitCode.INVALID_ARGS;
    }

    try {
      CompiledRuleSet rules = new ClassificationRuleSetProvider()
          .load(config.ruleFiles(), config.includeDefaultRules());
      List<RawRecord> records = new RecordFileReader().read(replayFile);
      // Session time starts at the first recorded receipt; an empty recording starts now.
      ClockPort sessionClock = records.isEmpty()
          ? ClockPort.SYSTEM
          : firstRecordClock(records.get(0).receivedAt());
      TelemetryEngine engine = TelemetryEngine.create(rules, metrics, sessionClock);
      for (RawRecord record : records) {
        engine.recordEvent(record);
      }
      log.info("Replayed {} record(s) from {}", records.size(), replayFile);
      return report(engine, config) ? ExitCode.SUCCESS : ExitCode.GATE_FAILED;
    } catch (IOException ex) {
      log.error("Failed to replay {}", replayFile, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid input: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } finally {
      closeQuietly(metrics);
    }
  }

  private static ClockPort firstRecordClock(long startedAt) {
    return () -> startedAt;
  }

  private static GateConfig loadConfig(Map<String, String> options) throws IOException {
    String configPath = options.remove("config");
    String profile = options.getOrDefault("profile", "ci");
    options.remove("profile");
    String extraRules = options.remove("rules");

    Map<String, String> values = new LinkedHashMap<>();
    Path baseDir = Path.of(".");
    if (configPath != null) {
      Path path = Path.of(configPath);
      Map<String, String> loaded = YamlConfigLoader.load(path, profile)
          .orElseThrow(() -> new IllegalArgumentException("Configuration file not found: " + path));
      values.putAll(loaded);
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        baseDir = parent;
      }
    }
    GateConfig config = GateConfig.fromMap(values, baseDir);
    if (extraRules == null) {
      return config;
    }
    GateConfig cliRules = GateConfig.fromMap(Map.of("rules.files", extraRules), Path.of("."));
    List<Path> files = new ArrayList<>(cliRules.ruleFiles());
    files.addAll(config.ruleFiles());
    return new GateConfig(config.thresholds(), config.targets(), files, config.includeDefaultRules());
  }

  private static boolean report(TelemetryEngine engine, GateConfig config) {
    CliPrinter.printBlock(engine.getSummary());
    CliPrinter.println("");
    CliPrinter.println("=== Gate ===");

    boolean pass = true;
    TreeSet<String> metrics = new TreeSet<>(config.targets().keySet());
    for (String builtIn : LatencyTargets.BUILT_IN.keySet()) {
      if (!engine.getStats(builtIn).isEmpty()) {
        metrics.add(builtIn);
      }
    }
    for (String metric : metrics) {
      TargetAssessment assessment = engine.assertTargets(metric, config.targets().get(metric));
      pass &= assessment.pass();
      CliPrinter.println((assessment.pass() ? "PASS " : "FAIL ") + metric
          + " (" + assessment.sampleCount() + " sample(s))");
      assessment.failures().forEach(f -> CliPrinter.println("  - " + f));
      assessment.notes().forEach(n -> CliPrinter.println("  note: " + n));
    }

    GateVerdict verdict = engine.assertQualityThresholds(config.thresholds());
    pass &= verdict.pass();
    CliPrinter.println((verdict.pass() ? "PASS " : "FAIL ") + "thresholds ("
        + verdict.checked() + " checked)");
    verdict.failures().forEach(f -> CliPrinter.println("  - " + f));
    verdict.notes().forEach(n -> CliPrinter.println("  note: " + n));
    CliPrinter.println(pass ? "GATE PASSED" : "GATE FAILED");
    return pass;
  }

  private static void closeQuietly(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
