package ca.gc.cra.prism.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.metric.FieldValue;
import ca.gc.cra.prism.domain.metric.MetricKind;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonMetricRecordReaderTest {
  private final NdjsonMetricRecordReader reader = new NdjsonMetricRecordReader(() -> 1_234L);

  @TempDir Path tempDir;

  @Test
  void parsesFullRecord() {
    MetricRecord record = reader.parseLine(
        "{\"name\":\"cpu\",\"tags\":{\"host\":\"a\",\"core\":3},\"fields\":{\"idle\":12.5,\"count\":7,"
            + "\"up\":true,\"state\":\"ok\"},\"timestamp\":1700000000123456789,\"type\":\"gauge\"}",
        1);

    assertEquals("cpu", record.name());
    assertEquals(Map.of("host", "a", "core", "3"), record.tags());
    assertEquals(FieldValue.of(12.5), record.fields().get("idle"));
    assertEquals(FieldValue.of(7L), record.fields().get("count"));
    assertEquals(FieldValue.of(true), record.fields().get("up"));
    assertEquals(FieldValue.of("ok"), record.fields().get("state"));
    assertEquals(Instant.ofEpochSecond(1_700_000_000L, 123_456_789L), record.timestamp());
    assertEquals(1_700_000_000_123L, record.timestampMillis());
    assertEquals(MetricKind.GAUGE, record.kind());
  }

  @Test
  void defaultsTimestampAndKind() {
    MetricRecord record = reader.parseLine("{\"name\":\"mem\",\"fields\":{\"used\":1}}", 1);

    assertEquals(1_234L, record.timestampMillis());
    assertEquals(MetricKind.UNTYPED, record.kind());
    assertTrue(record.tags().isEmpty());
  }

  @Test
  void integersAboveLongRangeBecomeUnsigned() {
    MetricRecord record = reader.parseLine(
        "{\"name\":\"n\",\"fields\":{\"big\":18446744073709551615,\"neg\":-4}}", 1);

    assertInstanceOf(FieldValue.UInt64.class, record.fields().get("big"));
    assertEquals(1.8446744073709552E19, record.fields().get("big").asDouble().getAsDouble());
    assertEquals(FieldValue.of(-4L), record.fields().get("neg"));
  }

  @Test
  void integersBeyondUnsignedRangeAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"name\":\"n\",\"fields\":{\"huge\":18446744073709551616}}", 4));

    assertTrue(ex.getMessage().startsWith("line 4: "), ex.getMessage());
  }

  @Test
  void readsFileSkippingBlankLines() throws Exception {
    Path file = tempDir.resolve("metrics.ndjson");
    Files.writeString(file,
        "{\"name\":\"a\",\"fields\":{\"v\":1}}\n\n   \n{\"name\":\"b\",\"fields\":{\"v\":2}}\n",
        StandardCharsets.UTF_8);

    List<MetricRecord> records = reader.read(file);

    assertEquals(2, records.size());
    assertEquals("a", records.get(0).name());
    assertEquals("b", records.get(1).name());
  }

  @Test
  void malformedLineReportsItsNumber() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> reader.read(new StringReader("{\"name\":\"a\"}\n{\"name\":\n")));

    assertTrue(ex.getMessage().startsWith("line 2: "), ex.getMessage());
  }

  @Test
  void rejectsStructuralMistakes() {
    assertThrows(IllegalArgumentException.class, () -> reader.parseLine("[1,2]", 1));
    assertThrows(IllegalArgumentException.class, () -> reader.parseLine("{\"fields\":{\"v\":1}}", 1));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"name\":\"a\",\"tags\":{\"t\":[1]}}", 1));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"name\":\"a\",\"fields\":{\"v\":null}}", 1));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"name\":\"a\",\"timestamp\":1.5}", 1));
    assertThrows(IllegalArgumentException.class, () -> reader.parseLine("{\"name\":\"a\"} {}", 1));
  }

  @Test
  void ignoresUnknownMembers() {
    MetricRecord record = reader.parseLine("{\"name\":\"a\",\"extra\":{\"nested\":[1,2]},\"fields\":{\"v\":1}}", 1);

    assertEquals(1, record.fields().size());
  }
}
