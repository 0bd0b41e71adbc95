package ca.gc.cra.parley.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplayCliTest {
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
  void ciProfilePassesTheGate() throws URISyntaxException {
    ExitCode exit = ReplayCli.run(new String[] {
        "file=" + fixture("conversation.log"), "config=" + fixture("gate-config.yaml")});

    assertEquals(ExitCode.SUCCESS, exit, out.toString());
    String report = out.toString();
    assertTrue(report.contains("PASS response (2 sample(s))"), report);
    assertTrue(report.contains("PASS bargeIn (1 sample(s))"), report);
    assertTrue(report.contains("GATE PASSED"), report);
  }

  @Test
  void strictProfileFailsOnAverageLatency() throws URISyntaxException {
    ExitCode exit = ReplayCli.run(new String[] {
        "file=" + fixture("conversation.log"), "config=" + fixture("gate-config.yaml"), "profile=strict"});

    assertEquals(ExitCode.GATE_FAILED, exit, out.toString());
    assertTrue(out.toString().contains("FAIL thresholds"), out.toString());
    assertTrue(out.toString().contains("GATE FAILED"), out.toString());
  }

  @Test
  void missingFileIsAnArgumentError() {
    assertEquals(ExitCode.INVALID_ARGS, ReplayCli.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, ReplayCli.run(new String[] {"file=does/not/exist.log"}));
    assertTrue(out.toString().contains("Replay file not found"));
  }

  @Test
  void unknownOptionIsRejected() throws URISyntaxException {
    ExitCode exit = ReplayCli.run(new String[] {"file=" + fixture("conversation.log"), "colour=blue"});

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(out.toString().contains("Unknown option(s): colour"));
  }

  @Test
  void brokenRuleFileIsAConfigurationError() throws URISyntaxException {
    ExitCode exit = ReplayCli.run(new String[] {
        "file=" + fixture("conversation.log"), "rules=" + fixture("broken-rules.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, exit, out.toString());
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ReplayCli.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("replay file=PATH"));
  }

  private static Path fixture(String name) throws URISyntaxException {
    return Path.of(ReplayCliTest.class.getResource("/parley/" + name).toURI());
  }
}
