package ca.gc.cra.prism.domain.remotewrite;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A label set plus the samples observed for it.
 * <p><strong>Role:</strong> Element of {@link WriteRequest}; the encoder emits exactly one sample per series.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied with {@link List#copyOf}.</p>
 *
 * @param labels labels sorted by name
 * @param samples samples in emission order
 * @since 0.1.0
 */
public record TimeSeries(List<Label> labels, List<Sample> samples) {
  public TimeSeries {
    labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
    samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
  }

  /**
   * Creates a series holding a single sample.
   *
   * @param labels sorted labels
   * @param sample the only sample
   * @return new series
   */
  public static TimeSeries of(List<Label> labels, Sample sample) {
    return new TimeSeries(labels, List.of(sample));
  }

  /**
   * Returns the value of the {@code __name__} label.
   *
   * @return metric name when present
   */
  public Optional<String> metricName() {
    for (Label label : labels) {
      if (Label.METRIC_NAME.equals(label.name())) {
        return Optional.of(label.value());
      }
    }
    return Optional.empty();
  }
}
