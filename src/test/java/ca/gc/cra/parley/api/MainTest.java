package ca.gc.cra.parley.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir
  Path tempDir;

  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(out.toString().contains("usage: parley"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("replay"));
    assertTrue(out.toString().contains("rules"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"record"}));
  }

  @Test
  void rulesDryRunReportsMatchesPerLine() throws IOException, URISyntaxException {
    Path samples = tempDir.resolve("samples.txt");
    Files.writeString(samples, String.join("\n",
        "# samples",
        "[INFO] PTT pressed",
        "hello there",
        "{broken"), StandardCharsets.UTF_8);
    Path rules = Path.of(MainTest.class.getResource("/parley/extra-rules.yaml").toURI());

    ExitCode exit = Main.run(new String[] {
        "rules", "samples=" + samples, "rules=" + rules, "--no-defaults"});

    String report = out.toString();
    assertEquals(ExitCode.SUCCESS, exit, report);
    assertTrue(report.contains("Line 2: push-to-talk"), report);
    assertTrue(report.contains("Line 3: no matching rules (hello there)"), report);
    assertTrue(report.contains("Line 4: malformed structured message"), report);
    assertTrue(report.contains("Evaluated 1 rule(s) over 3 sample(s); 1 produced events."), report);
  }

  @Test
  void rulesDryRunRejectsMissingRuleFile() throws IOException {
    Path samples = Files.writeString(tempDir.resolve("s.txt"), "x", StandardCharsets.UTF_8);

    ExitCode exit = Main.run(new String[] {"rules", "samples=" + samples, "rules=" + tempDir.resolve("nope.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, exit);
  }
}
