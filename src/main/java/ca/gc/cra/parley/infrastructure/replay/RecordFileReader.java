package ca.gc.cra.parley.infrastructure.replay;

import ca.gc.cra.parley.application.events.json.JsonSupport;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads a recorded telemetry file into {@link RawRecord}s.
 * <p><strong>Format:</strong> one record per line. Blank lines and lines starting with {@code #}
 * are skipped. A line starting with <code>{</code> is a structured message whose receipt time is its
 * {@code timestamp} field, or the previous record's time when absent. Any other line must read
 * {@code <epochMillis> [LEVEL] <text>}; the level token is optional.</p>
 * <p><strong>Thread-safety:</strong> Instances are stateless apart from the shared JSON factory.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class RecordFileReader {
  private static final Logger log = LoggerFactory.getLogger(RecordFileReader.class);
  private static final Pattern LOG_LINE =
      Pattern.compile("^(\\d+)\\s+(?:\\[([A-Za-z]+)]\\s*)?(.*)$");

  private final JsonSupport json = new JsonSupport();

  /**
   * Reads every record from {@code path}.
   *
   * @param path replay file
   * @return records in file order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when a log line does not start with an epoch timestamp
   */
  public List<RawRecord> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    }
  }

  /**
   * Reads every record from an open reader. The reader is not closed.
   *
   * @param reader source of replay lines
   * @param sourceName name used in error messages
   * @return records in source order
   * @throws IOException when reading fails
   */
  public List<RawRecord> read(Reader reader, String sourceName) throws IOException {
    BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    List<RawRecord> records = new ArrayList<>();
    long previous = 0L;
    int lineNumber = 0;
    String line;
    while ((line = buffered.readLine()) != null) {
      lineNumber++;
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      RawRecord record = trimmed.startsWith("{")
          ? structured(trimmed, previous)
          : logLine(trimmed, sourceName, lineNumber);
      previous = record.receivedAt();
      records.add(record);
    }
    log.debug("Read {} record(s) from {}", records.size(), sourceName);
    return records;
  }

  private RawRecord structured(String line, long previous) {
    Optional<Map<String, Object>> message = json.parseObject(line);
    long receivedAt = message.map(m -> timestampOf(m.get("timestamp"), previous)).orElse(previous);
    // The classifier decides whether the message is malformed; keep the raw text.
    return RawRecord.messageJson(receivedAt, line);
  }

  private static RawRecord logLine(String line, String sourceName, int lineNumber) {
    Matcher matcher = LOG_LINE.matcher(line);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          sourceName + ":" + lineNumber + ": expected '<epochMillis> [LEVEL] <text>'");
    }
    long receivedAt;
    try {
      receivedAt = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(sourceName + ":" + lineNumber + ": timestamp out of range", ex);
    }
    RecordLevel level = RecordLevel.parse(matcher.group(2));
    return RawRecord.log(receivedAt, level, matcher.group(3));
  }

  private static long timestampOf(Object node, long fallback) {
    if (node instanceof Number number) {
      return number.longValue();
    }
    if (node instanceof String str && !str.isBlank()) {
      try {
        return Instant.parse(str.trim()).toEpochMilli();
      } catch (DateTimeParseException ex) {
        return fallback;
      }
    }
    return fallback;
  }
}
