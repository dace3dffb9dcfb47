package ca.gc.cra.prism.application.remotewrite;

import ca.gc.cra.prism.domain.metric.FieldValue;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import ca.gc.cra.prism.domain.remotewrite.Label;
import ca.gc.cra.prism.domain.remotewrite.LabelNames;
import ca.gc.cra.prism.domain.remotewrite.Sample;
import ca.gc.cra.prism.domain.remotewrite.TimeSeries;
import ca.gc.cra.prism.domain.remotewrite.WriteRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Maps metric records onto remote-write time series.
 * <p><strong>Why:</strong> The remote store identifies series by sorted label sets and only accepts float samples,
 * so records are flattened to one series per numeric field.</p>
 * <p><strong>Role:</strong> Pure application service used by {@link RemoteWriteShipper}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop histogram and summary records entirely.</li>
 *   <li>Sanitize tag keys into label names and derive {@code __name__} from the record and field names.</li>
 *   <li>Drop text and boolean fields without affecting sibling numeric fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(records x fields x labels log labels); common labels are built once per record.</p>
 *
 * @implNote Duplicate label names (for instance two tag keys that sanitize to the same name) are kept as-is. This
 *     includes a tag keyed {@code __name__}: the series then carries two {@code __name__} labels, the tag's first,
 *     and the receiver decides whether to reject it.
 * @since 0.1.0
 */
public final class TimeSeriesEncoder {

  /**
   * Encodes {@code records} into a write request.
   *
   * @param records records in producer order; must not be {@code null}
   * @return request whose series follow record-then-field order
   */
  public WriteRequest encode(List<MetricRecord> records) {
    return encodeBatch(records).request();
  }

  /**
   * Encodes {@code records} and reports how many records and fields were dropped.
   *
   * @param records records in producer order; must not be {@code null}
   * @return encoded request plus drop counts
   */
  public EncodedBatch encodeBatch(List<MetricRecord> records) {
    Objects.requireNonNull(records, "records");
    List<TimeSeries> series = new ArrayList<>();
    int recordsSkipped = 0;
    int fieldsSkipped = 0;
    for (MetricRecord record : records) {
      if (!record.kind().isShippable()) {
        recordsSkipped++;
        continue;
      }
      List<Label> common = commonLabels(record);
      long timestampMillis = record.timestampMillis();
      for (Map.Entry<String, FieldValue> field : record.fields().entrySet()) {
        OptionalDouble value = field.getValue().asDouble();
        if (value.isEmpty()) {
          fieldsSkipped++;
          continue;
        }
        List<Label> labels = new ArrayList<>(common.size() + 1);
        labels.addAll(common);
        labels.add(new Label(Label.METRIC_NAME, LabelNames.seriesName(record.name(), field.getKey())));
        labels.sort(Label.BY_NAME);
        series.add(TimeSeries.of(labels, new Sample(timestampMillis, value.getAsDouble())));
      }
    }
    return new EncodedBatch(new WriteRequest(series), records.size(), recordsSkipped, fieldsSkipped);
  }

  private static List<Label> commonLabels(MetricRecord record) {
    List<Label> labels = new ArrayList<>(record.tags().size());
    for (Map.Entry<String, String> tag : record.tags().entrySet()) {
      labels.add(new Label(LabelNames.sanitize(tag.getKey()), tag.getValue()));
    }
    return labels;
  }
}
