package ca.gc.cra.prism.domain.remotewrite;

import java.util.Comparator;
import java.util.Objects;

/**
 * Name/value pair identifying a time series.
 *
 * @param name label name; expected to match {@code [a-zA-Z_][a-zA-Z0-9_]*}
 * @param value label value, copied verbatim
 * @since 0.1.0
 */
public record Label(String name, String value) {
  /** Reserved label carrying the series (metric) name. */
  public static final String METRIC_NAME = "__name__";

  /** Orders labels by name only; equal names keep their relative order under a stable sort. */
  public static final Comparator<Label> BY_NAME = Comparator.comparing(Label::name);

  public Label {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }
}
