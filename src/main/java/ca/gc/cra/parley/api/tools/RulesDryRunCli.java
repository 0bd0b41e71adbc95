package ca.gc.cra.parley.api.tools;

import ca.gc.cra.parley.api.CliArgsParser;
import ca.gc.cra.parley.api.CliInput;
import ca.gc.cra.parley.api.CliPrinter;
import ca.gc.cra.parley.api.ExitCode;
import ca.gc.cra.parley.application.events.ClassificationResult;
import ca.gc.cra.parley.application.events.EventClassifier;
import ca.gc.cra.parley.application.events.rules.ClassificationRuleSetProvider;
import ca.gc.cra.parley.application.events.rules.CompiledRuleSet;
import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import ca.gc.cra.parley.logging.LoggingConfigurator;
import ca.gc.cra.parley.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI that loads the classification rule table and evaluates it against sample lines.
 */
public final class RulesDryRunCli {
  private static final Logger log = LoggerFactory.getLogger(RulesDryRunCli.class);
  private static final Pattern LEVEL_PREFIX = Pattern.compile("^\\[([A-Za-z]+)]\\s*(.*)$");
  private static final String SUMMARY_USAGE =
      "usage: rules samples=PATH [rules=PATHS] [--no-defaults]";
  private static final String HELP_TEXT = """
      PARLEY rule table dry-run utility

      Usage:
        rules samples=PATH [rules=PATHS] [--no-defaults]

      Options:
        samples=PATH          File with one sample per line: '[LEVEL] text' or a JSON message
        rules=PATHS           Comma separated rule files evaluated before the built-in table

      Flags:
        --no-defaults        Do not load the built-in rule table
        --help               Show this message
        --verbose            Enable verbose logging

      Example:
        parley rules samples=dev/samples/console.txt rules=config/extra-rules.yaml
      """;

  private RulesDryRunCli() {}

  /**
   * Executes the dry run.
   *
   * <p>Every sample is classified independently; the output lists the rule ids that matched and the
   * events they produced, or flags the sample as unmatched or malformed.</p>
   *
   * @param args raw CLI arguments following the {@code rules} subcommand
   * @return success or failure exit code
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for rules dry run");
    }

    Map<String, String> options;
    List<Path> rulePaths;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
      rulePaths = resolveRulePaths(options.get("rules"));
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    String samples = options.get("samples");
    if (samples == null) {
      CliPrinter.println("Missing required option samples=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path samplesFile = Path.of(samples);
    if (!Files.isRegularFile(samplesFile)) {
      CliPrinter.println("Samples file not found: " + samplesFile);
      return ExitCode.INVALID_ARGS;
    }

    try {
      CompiledRuleSet ruleSet = new ClassificationRuleSetProvider()
          .load(rulePaths, !input.hasFlag("--no-defaults"));
      if (ruleSet.isEmpty()) {
        CliPrinter.println("Loaded rule files contained no active rules.");
      }
      EventClassifier classifier = new EventClassifier(ruleSet);
      List<String> lines = Files.readAllLines(samplesFile, StandardCharsets.UTF_8);
      int total = 0;
      int matched = 0;
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i).strip();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        total++;
        ClassificationResult result = classifier.classifyDetailed(toRecord(i + 1L, line));
        String label = "Line " + (i + 1) + ": ";
        if (result.malformed()) {
          CliPrinter.println(label + "malformed structured message");
        } else if (result.events().isEmpty()) {
          CliPrinter.println(label + "no matching rules (" + Logs.truncate(line, 60) + ")");
        } else {
          matched++;
          CliPrinter.println(label + String.join(", ", result.ruleIds()));
          for (DomainEvent event : result.events()) {
            CliPrinter.println("  - " + event);
          }
        }
      }
      CliPrinter.println("");
      CliPrinter.println("Evaluated " + ruleSet.size() + " rule(s) over " + total
          + " sample(s); " + matched + " produced events.");
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to run rules dry-run", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid rule file: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }

  private static RawRecord toRecord(long timestamp, String line) {
    if (line.startsWith("{")) {
      return RawRecord.messageJson(timestamp, line);
    }
    Matcher matcher = LEVEL_PREFIX.matcher(line);
    if (matcher.matches()) {
      return RawRecord.log(timestamp, RecordLevel.parse(matcher.group(1)), matcher.group(2));
    }
    return RawRecord.log(timestamp, line);
  }

  private static List<Path> resolveRulePaths(String raw) {
    List<Path> paths = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return paths;
    }
    for (String token : raw.split("[,;]")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      Path path = Path.of(trimmed);
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("Rule file not found: " + path);
      }
      paths.add(path);
    }
    return paths;
  }
}
