package ca.gc.cra.prism.domain.metric;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class MetricKindTest {

  @ParameterizedTest
  @EnumSource(value = MetricKind.class, names = {"COUNTER", "GAUGE", "UNTYPED"})
  void scalarKindsAreShippable(MetricKind kind) {
    assertTrue(kind.isShippable());
  }

  @ParameterizedTest
  @EnumSource(value = MetricKind.class, names = {"HISTOGRAM", "SUMMARY"})
  void distributionKindsAreDropped(MetricKind kind) {
    assertFalse(kind.isShippable());
  }

  @Test
  void fromStringIsCaseInsensitiveAndDefaultsToUntyped() {
    assertEquals(MetricKind.GAUGE, MetricKind.fromString(" Gauge "));
    assertEquals(MetricKind.UNTYPED, MetricKind.fromString(""));
    assertEquals(MetricKind.UNTYPED, MetricKind.fromString(null));
  }

  @Test
  void fromStringRejectsUnknownKind() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> MetricKind.fromString("timer"));
    assertTrue(ex.getMessage().contains("timer"));
  }
}
