package ca.gc.cra.prism.domain.remotewrite;

import java.util.List;
import java.util.Objects;

/**
 * Ordered batch of series shipped in one delivery call.
 *
 * @param timeseries series in record-then-field order
 * @since 0.1.0
 */
public record WriteRequest(List<TimeSeries> timeseries) {
  public WriteRequest {
    timeseries = List.copyOf(Objects.requireNonNull(timeseries, "timeseries"));
  }

  public static WriteRequest empty() {
    return new WriteRequest(List.of());
  }

  public boolean isEmpty() {
    return timeseries.isEmpty();
  }

  public int size() {
    return timeseries.size();
  }
}
