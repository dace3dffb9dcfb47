package ca.gc.cra.prism.application.remotewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.metric.FieldValue;
import ca.gc.cra.prism.domain.metric.MetricKind;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import ca.gc.cra.prism.domain.remotewrite.Label;
import ca.gc.cra.prism.domain.remotewrite.LabelNames;
import ca.gc.cra.prism.domain.remotewrite.Sample;
import ca.gc.cra.prism.domain.remotewrite.TimeSeries;
import ca.gc.cra.prism.domain.remotewrite.WriteRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TimeSeriesEncoderTest {
  private static final Instant TIME = Instant.parse("2024-03-01T12:00:00.123456789Z");

  private final TimeSeriesEncoder encoder = new TimeSeriesEncoder();

  @Test
  void memUsedGaugeProducesOneSortedSeries() {
    MetricRecord record = new MetricRecord(
        "mem", Map.of("host", "a"), Map.of("used", FieldValue.of(1024.0)), TIME, MetricKind.GAUGE);

    WriteRequest request = encoder.encode(List.of(record));

    assertEquals(1, request.size());
    TimeSeries series = request.timeseries().get(0);
    assertEquals(List.of(new Label("__name__", "mem_used"), new Label("host", "a")), series.labels());
    assertEquals(List.of(new Sample(TIME.toEpochMilli(), 1024.0)), series.samples());
  }

  @ParameterizedTest
  @EnumSource(value = MetricKind.class, names = {"HISTOGRAM", "SUMMARY"})
  void distributionRecordsProduceNoSeries(MetricKind kind) {
    MetricRecord record = new MetricRecord(
        "latency", Map.of("route", "/"), Map.of("p99", FieldValue.of(3.5), "count", FieldValue.of(10L)),
        TIME, kind);

    EncodedBatch batch = encoder.encodeBatch(List.of(record));

    assertTrue(batch.request().isEmpty());
    assertEquals(1, batch.recordsSkipped());
    assertEquals(1, batch.recordsSeen());
  }

  @Test
  void nonNumericFieldsAreSkippedButSiblingsShip() {
    Map<String, FieldValue> fields = new LinkedHashMap<>();
    fields.put("state", FieldValue.of("up"));
    fields.put("idle", FieldValue.of(12.5));
    fields.put("ok", FieldValue.of(true));
    fields.put("count", FieldValue.of(3L));
    MetricRecord record = new MetricRecord("cpu", Map.of(), fields, TIME, MetricKind.UNTYPED);

    EncodedBatch batch = encoder.encodeBatch(List.of(record));

    assertEquals(2, batch.seriesEmitted());
    assertEquals(2, batch.fieldsSkipped());
    assertEquals(0, batch.recordsSkipped());
    assertEquals("cpu_idle", batch.request().timeseries().get(0).metricName().orElseThrow());
    assertEquals("cpu_count", batch.request().timeseries().get(1).metricName().orElseThrow());
    assertEquals(3.0, batch.request().timeseries().get(1).samples().get(0).value());
  }

  @Test
  void tagNamedMetricNameIsKeptAlongsideDerivedName() {
    MetricRecord record = new MetricRecord(
        "cpu", Map.of("__name__", "override", "host", "a"), Map.of("idle", FieldValue.of(1.0)), TIME,
        MetricKind.GAUGE);

    TimeSeries series = encoder.encode(List.of(record)).timeseries().get(0);

    assertEquals(List.of(
        new Label("__name__", "override"), new Label("__name__", "cpu_idle"), new Label("host", "a")),
        series.labels());
  }

  @Test
  void sanitizationExampleLeavesNoDashInLabelNames() {
    MetricRecord record = new MetricRecord(
        "cpu.usage", Map.of("server-name", "web-01"), Map.of("idle", FieldValue.of(97.0)),
        TIME, MetricKind.GAUGE);

    TimeSeries series = encoder.encode(List.of(record)).timeseries().get(0);

    assertEquals("cpu_usage_idle", series.metricName().orElseThrow());
    for (Label label : series.labels()) {
      assertFalse(label.name().contains("-"), label.name());
    }
    assertTrue(series.labels().contains(new Label("server_name", "web-01")));
  }

  @Test
  void everySeriesHasStrictlySortedLabelsAndOneMetricName() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("zone", "b");
    tags.put("app", "api");
    tags.put("Host", "x");
    tags.put("_tier", "gold");
    Map<String, FieldValue> fields = new LinkedHashMap<>();
    fields.put("a", FieldValue.of(1L));
    fields.put("b", FieldValue.ofUnsigned(-1L));
    List<MetricRecord> records = List.of(
        new MetricRecord("svc", tags, fields, TIME, MetricKind.COUNTER),
        new MetricRecord("svc.other", Map.of("app", "web"), Map.of("v", FieldValue.of(0.5)), TIME, null));

    WriteRequest request = encoder.encode(records);

    assertEquals(3, request.size());
    for (TimeSeries series : request.timeseries()) {
      long names = series.labels().stream().filter(l -> l.name().equals(Label.METRIC_NAME)).count();
      assertEquals(1, names);
      for (int i = 1; i < series.labels().size(); i++) {
        String previous = series.labels().get(i - 1).name();
        String current = series.labels().get(i).name();
        assertTrue(previous.compareTo(current) < 0, previous + " !< " + current);
      }
      for (Label label : series.labels()) {
        assertTrue(label.name().equals(Label.METRIC_NAME) || LabelNames.isValid(label.name()));
      }
    }
  }

  @Test
  void seriesFollowRecordThenFieldOrder() {
    Map<String, FieldValue> first = new LinkedHashMap<>();
    first.put("b", FieldValue.of(1L));
    first.put("a", FieldValue.of(2L));
    List<MetricRecord> records = List.of(
        new MetricRecord("one", Map.of(), first, TIME, MetricKind.GAUGE),
        new MetricRecord("two", Map.of(), Map.of("x", FieldValue.of(3L)), TIME, MetricKind.GAUGE));

    List<String> names = encoder.encode(records).timeseries().stream()
        .map(series -> series.metricName().orElseThrow())
        .toList();

    assertEquals(List.of("one_b", "one_a", "two_x"), names);
  }

  @Test
  void emptyInputYieldsEmptyRequest() {
    EncodedBatch batch = encoder.encodeBatch(List.of());
    assertTrue(batch.request().isEmpty());
    assertEquals(0, batch.recordsSeen());
  }
}
