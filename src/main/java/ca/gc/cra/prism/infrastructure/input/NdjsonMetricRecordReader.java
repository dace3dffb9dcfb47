package ca.gc.cra.prism.infrastructure.input;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.domain.metric.FieldValue;
import ca.gc.cra.prism.domain.metric.MetricKind;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Reads newline-delimited JSON metric records.
 * <p><strong>Format:</strong> one object per line,
 * {@code {"name":"cpu","tags":{"host":"a"},"fields":{"idle":12.5},"timestamp":1700000000000000000,"type":"gauge"}}.
 * {@code timestamp} is epoch nanoseconds and defaults to the clock's now; {@code type} defaults to
 * {@code untyped}. Blank lines are skipped.</p>
 * <p><strong>Field mapping:</strong> integers become {@link FieldValue.Int64}, or {@link FieldValue.UInt64} above
 * {@link Long#MAX_VALUE}; decimals become {@link FieldValue.Float64}; strings {@link FieldValue.Text}; booleans
 * {@link FieldValue.Bool}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonMetricRecordReader {
  private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final JsonFactory factory = new JsonFactory();
  private final ClockPort clock;

  public NdjsonMetricRecordReader(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads every record from {@code file}.
   *
   * @param file UTF-8 NDJSON file
   * @return records in file order
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if a line is malformed; the message names the line number
   */
  public List<MetricRecord> read(Path file) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  /**
   * Reads every record from {@code source}; the reader is not closed.
   *
   * @param source character source
   * @return records in input order
   * @throws IOException if reading fails
   * @throws IllegalArgumentException if a line is malformed
   */
  public List<MetricRecord> read(Reader source) throws IOException {
    BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
    List<MetricRecord> records = new ArrayList<>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      records.add(parseLine(line, lineNumber));
    }
    return records;
  }

  /**
   * Parses a single NDJSON line.
   *
   * @param line JSON object text
   * @param lineNumber 1-based line number used in error messages
   * @return parsed record
   * @throws IllegalArgumentException if the line is not a valid record
   */
  public MetricRecord parseLine(String line, int lineNumber) {
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("expected a JSON object");
      }
      String name = null;
      Map<String, String> tags = Map.of();
      Map<String, FieldValue> fields = Map.of();
      Instant timestamp = null;
      MetricKind kind = MetricKind.UNTYPED;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String key = parser.currentName();
        JsonToken token = parser.nextToken();
        switch (key) {
          case "name" -> name = requireString(parser, token, "name");
          case "tags" -> tags = readTags(parser, token);
          case "fields" -> fields = readFields(parser, token);
          case "timestamp" -> timestamp = readTimestamp(parser, token);
          case "type" -> kind = MetricKind.fromString(requireString(parser, token, "type"));
          default -> parser.skipChildren();
        }
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after record");
      }
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("record has no name");
      }
      if (timestamp == null) {
        timestamp = Instant.ofEpochMilli(clock.nowMillis());
      }
      return new MetricRecord(name, tags, fields, timestamp, kind);
    } catch (IOException | RuntimeException ex) {
      throw new IllegalArgumentException("line " + lineNumber + ": " + ex.getMessage(), ex);
    }
  }

  private static String requireString(JsonParser parser, JsonToken token, String key) throws IOException {
    if (token != JsonToken.VALUE_STRING) {
      throw new IllegalArgumentException(key + " must be a string");
    }
    return parser.getText();
  }

  private static Map<String, String> readTags(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("tags must be an object");
    }
    Map<String, String> tags = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.currentName();
      JsonToken value = parser.nextToken();
      if (!value.isScalarValue() || value == JsonToken.VALUE_NULL) {
        throw new IllegalArgumentException("tag " + key + " must be a scalar");
      }
      tags.put(key, parser.getText());
    }
    return tags;
  }

  private static Map<String, FieldValue> readFields(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("fields must be an object");
    }
    Map<String, FieldValue> fields = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.currentName();
      fields.put(key, readFieldValue(parser, parser.nextToken(), key));
    }
    return fields;
  }

  private static FieldValue readFieldValue(JsonParser parser, JsonToken token, String key) throws IOException {
    return switch (token) {
      case VALUE_NUMBER_INT -> integerValue(parser.getBigIntegerValue(), key);
      case VALUE_NUMBER_FLOAT -> FieldValue.of(parser.getDoubleValue());
      case VALUE_STRING -> FieldValue.of(parser.getText());
      case VALUE_TRUE -> FieldValue.of(true);
      case VALUE_FALSE -> FieldValue.of(false);
      default -> throw new IllegalArgumentException("field " + key + " has unsupported value " + token);
    };
  }

  private static FieldValue integerValue(BigInteger value, String key) {
    if (value.bitLength() < Long.SIZE) {
      return FieldValue.of(value.longValue());
    }
    if (value.signum() > 0 && value.compareTo(UINT64_MAX) <= 0) {
      return FieldValue.ofUnsigned(value.longValue());
    }
    throw new IllegalArgumentException("field " + key + " is outside the 64-bit range: " + value);
  }

  private static Instant readTimestamp(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw new IllegalArgumentException("timestamp must be an integer (epoch nanoseconds)");
    }
    long nanos = parser.getLongValue();
    return Instant.ofEpochSecond(
        Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
  }
}
