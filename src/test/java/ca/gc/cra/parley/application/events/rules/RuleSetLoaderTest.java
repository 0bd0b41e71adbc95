package ca.gc.cra.parley.application.events.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.domain.events.EventKind;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RuleSetLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void parsesContainsGroupsAndExtractors() throws IOException {
    Path file = write("rules.yaml", """
        version: 1
        rules:
          - id: custom-overflow
            category: overflow
            event: queue_overflow
            level: warn
            match:
              contains:
                - "queue"
                - ["full", "overflow"]
              excludes: ["test"]
            extract:
              message: 'queue (?<value>\\w+)'
        """);

    RuleSetLoader loader = new RuleSetLoader();
    loader.addFiles(List.of(file));
    List<RuleDefinition> rules = loader.rules();

    assertEquals(1, rules.size());
    RuleDefinition rule = rules.get(0);
    assertEquals("custom-overflow", rule.id());
    assertEquals(EventKind.QUEUE_OVERFLOW, rule.event());
    assertEquals(RecordLevel.WARN, rule.level());
    assertEquals(List.of(List.of("queue"), List.of("full", "overflow")), rule.match().contains());
    assertEquals(List.of("test"), rule.match().excludes());
    assertEquals("queue (?<value>\\w+)", rule.extract().get("message"));
  }

  @Test
  void rejectsDuplicateIdsAcrossFiles() throws IOException {
    String body = """
        version: 1
        rules:
          - id: same
            category: speech
            event: speech_started
            match:
              contains: "speech"
        """;
    Path first = write("a.yaml", body);
    Path second = write("b.yaml", body);

    RuleSetLoader loader = new RuleSetLoader();
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.addFiles(List.of(first, second)));
    assertTrue(ex.getMessage().contains("Duplicate rule id"));
  }

  @Test
  void rejectsUnknownEventKind() throws IOException {
    Path file = write("bad.yaml", """
        version: 1
        rules:
          - id: bad
            category: misc
            event: teleport
            match:
              contains: "x"
        """);

    RuleSetLoader loader = new RuleSetLoader();
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.addFiles(List.of(file)));
    assertTrue(ex.getMessage().startsWith("Rule bad:"));
  }

  @Test
  void rejectsRuleWithoutCondition() throws IOException {
    Path file = write("empty.yaml", """
        version: 1
        rules:
          - id: anything
            category: misc
            event: error
        """);

    assertThrows(IllegalArgumentException.class, () -> new RuleSetLoader().addFiles(List.of(file)));
  }

  @Test
  void rejectsUnsupportedVersion() throws IOException {
    Path file = write("v2.yaml", "version: 2\nrules: []\n");

    assertThrows(IllegalArgumentException.class, () -> new RuleSetLoader().addFiles(List.of(file)));
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(IOException.class,
        () -> new RuleSetLoader().addFiles(List.of(tempDir.resolve("missing.yaml"))));
  }

  @Test
  void bundledTableLoads() throws IOException {
    RuleSetLoader loader = new RuleSetLoader();
    loader.addResource(ClassificationRuleSetProvider.DEFAULT_RULES);

    assertEquals("error-level", loader.rules().get(0).id());
    assertTrue(loader.rules().size() >= 14);
  }

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
