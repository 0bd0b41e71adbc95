package ca.gc.cra.parley.infrastructure.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import ca.gc.cra.parley.domain.telemetry.RecordSource;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordFileReaderTest {
  private final RecordFileReader reader = new RecordFileReader();

  @Test
  void readsLogAndMessageLines() throws IOException {
    List<RawRecord> records = reader.read(new StringReader("""
        # comment

        1000 [warn] Playback queue overflow
        1200 Speech started
        {"type":"speech_started"}
        {"type":"error","timestamp":"1970-01-01T00:00:02Z","payload":{"message":"x"}}
        {broken
        """), "inline");

    assertEquals(5, records.size());
    assertEquals(RecordLevel.WARN, records.get(0).level());
    assertEquals("Playback queue overflow", records.get(0).text());
    assertEquals(RecordLevel.INFO, records.get(1).level());
    assertEquals(RecordSource.MESSAGE, records.get(2).source());
    assertEquals(1200L, records.get(2).receivedAt());
    assertNull(records.get(2).payload());
    assertEquals(2000L, records.get(3).receivedAt());
    assertEquals(2000L, records.get(4).receivedAt());
  }

  @Test
  void lineWithoutTimestampIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> reader.read(new StringReader("1 ok\nno timestamp here\n"), "inline"));
    assertTrue(ex.getMessage().startsWith("inline:2:"));
  }

  @Test
  void readsBundledConversation() throws IOException, URISyntaxException {
    Path file = Path.of(RecordFileReaderTest.class.getResource("/parley/conversation.log").toURI());

    List<RawRecord> records = reader.read(file);

    assertEquals(10, records.size());
    assertEquals(1000L, records.get(0).receivedAt());
    assertEquals(7100L, records.get(9).receivedAt());
  }
}
