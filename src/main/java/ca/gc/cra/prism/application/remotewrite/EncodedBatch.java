package ca.gc.cra.prism.application.remotewrite;

import ca.gc.cra.prism.domain.remotewrite.WriteRequest;
import java.util.Objects;

/**
 * Result of encoding one batch of records, with counts of what was dropped.
 *
 * @param request encoded request
 * @param recordsSeen records passed to the encoder
 * @param recordsSkipped records dropped because their kind is not shipped
 * @param fieldsSkipped fields dropped because their value is not numeric
 * @since 0.1.0
 */
public record EncodedBatch(WriteRequest request, int recordsSeen, int recordsSkipped, int fieldsSkipped) {
  public EncodedBatch {
    Objects.requireNonNull(request, "request");
  }

  public int seriesEmitted() {
    return request.size();
  }
}
