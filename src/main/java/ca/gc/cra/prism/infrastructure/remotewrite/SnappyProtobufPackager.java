package ca.gc.cra.prism.infrastructure.remotewrite;

import ca.gc.cra.prism.application.port.WriteRequestPackager;
import ca.gc.cra.prism.application.remotewrite.EncodingException;
import ca.gc.cra.prism.domain.remotewrite.Label;
import ca.gc.cra.prism.domain.remotewrite.Sample;
import ca.gc.cra.prism.domain.remotewrite.TimeSeries;
import ca.gc.cra.prism.domain.remotewrite.WriteRequest;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.xerial.snappy.Snappy;

/**
 * <strong>What:</strong> Serializes a {@link WriteRequest} as the {@code prometheus.WriteRequest} protobuf message and
 * compresses it with the snappy block format.
 * <p><strong>Why:</strong> Remote-write receivers expect exactly this pairing, announced through
 * {@code Content-Type: application/x-protobuf} and {@code Content-Encoding: snappy}.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link WriteRequestPackager}.</p>
 * <p><strong>Wire layout:</strong>
 * <ul>
 *   <li>{@code WriteRequest.timeseries = 1} (repeated message)</li>
 *   <li>{@code TimeSeries.labels = 1}, {@code TimeSeries.samples = 2} (repeated messages)</li>
 *   <li>{@code Label.name = 1}, {@code Label.value = 2} (strings)</li>
 *   <li>{@code Sample.value = 1} (double), {@code Sample.timestamp = 2} (int64 milliseconds)</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; thread-safe.</p>
 *
 * @implNote Uses {@link CodedOutputStream} directly instead of generated message classes; field numbers above are the
 *     whole contract.
 * @since 0.1.0
 */
public final class SnappyProtobufPackager implements WriteRequestPackager {
  /** {@code Content-Encoding} header value. */
  public static final String CONTENT_ENCODING = "snappy";
  /** {@code Content-Type} header value. */
  public static final String CONTENT_TYPE = "application/x-protobuf";

  private static final int WRITE_REQUEST_TIMESERIES = 1;
  private static final int TIMESERIES_LABELS = 1;
  private static final int TIMESERIES_SAMPLES = 2;
  private static final int LABEL_NAME = 1;
  private static final int LABEL_VALUE = 2;
  private static final int SAMPLE_VALUE = 1;
  private static final int SAMPLE_TIMESTAMP = 2;

  @Override
  public byte[] pack(WriteRequest request) throws EncodingException {
    Objects.requireNonNull(request, "request");
    byte[] serialized = serialize(request);
    try {
      return Snappy.compress(serialized);
    } catch (IOException ex) {
      throw new EncodingException("snappy compression failed for " + serialized.length + " bytes", ex);
    }
  }

  @Override
  public String contentEncoding() {
    return CONTENT_ENCODING;
  }

  @Override
  public String contentType() {
    return CONTENT_TYPE;
  }

  /**
   * Serializes {@code request} without compression.
   *
   * @param request request to serialize
   * @return protobuf bytes
   * @throws EncodingException if the protobuf encoder fails
   */
  public static byte[] serialize(WriteRequest request) throws EncodingException {
    int size = 0;
    for (TimeSeries series : request.timeseries()) {
      size += messageFieldSize(WRITE_REQUEST_TIMESERIES, seriesSize(series));
    }
    byte[] buffer = new byte[size];
    CodedOutputStream out = CodedOutputStream.newInstance(buffer);
    try {
      for (TimeSeries series : request.timeseries()) {
        out.writeTag(WRITE_REQUEST_TIMESERIES, WireFormat.WIRETYPE_LENGTH_DELIMITED);
        out.writeUInt32NoTag(seriesSize(series));
        writeSeries(out, series);
      }
      out.checkNoSpaceLeft();
    } catch (IOException | IllegalStateException ex) {
      throw new EncodingException("protobuf serialization failed", ex);
    }
    return buffer;
  }

  /**
   * Decompresses and parses a payload produced by {@link #pack(WriteRequest)}.
   *
   * @param payload snappy-compressed protobuf bytes
   * @return decoded request
   * @throws IOException if the payload is not valid snappy or protobuf data
   */
  public static WriteRequest unpack(byte[] payload) throws IOException {
    CodedInputStream in = CodedInputStream.newInstance(Snappy.uncompress(payload));
    List<TimeSeries> series = new ArrayList<>();
    int tag;
    while ((tag = in.readTag()) != 0) {
      if (WireFormat.getTagFieldNumber(tag) == WRITE_REQUEST_TIMESERIES) {
        int limit = in.pushLimit(in.readRawVarint32());
        series.add(readSeries(in));
        in.popLimit(limit);
      } else {
        in.skipField(tag);
      }
    }
    return new WriteRequest(series);
  }

  private static void writeSeries(CodedOutputStream out, TimeSeries series) throws IOException {
    for (Label label : series.labels()) {
      out.writeTag(TIMESERIES_LABELS, WireFormat.WIRETYPE_LENGTH_DELIMITED);
      out.writeUInt32NoTag(labelSize(label));
      out.writeString(LABEL_NAME, label.name());
      out.writeString(LABEL_VALUE, label.value());
    }
    for (Sample sample : series.samples()) {
      out.writeTag(TIMESERIES_SAMPLES, WireFormat.WIRETYPE_LENGTH_DELIMITED);
      out.writeUInt32NoTag(sampleSize(sample));
      out.writeDouble(SAMPLE_VALUE, sample.value());
      out.writeInt64(SAMPLE_TIMESTAMP, sample.timestampMillis());
    }
  }

  private static TimeSeries readSeries(CodedInputStream in) throws IOException {
    List<Label> labels = new ArrayList<>();
    List<Sample> samples = new ArrayList<>();
    int tag;
    while ((tag = in.readTag()) != 0) {
      int field = WireFormat.getTagFieldNumber(tag);
      if (field == TIMESERIES_LABELS) {
        int limit = in.pushLimit(in.readRawVarint32());
        String name = "";
        String value = "";
        int inner;
        while ((inner = in.readTag()) != 0) {
          switch (WireFormat.getTagFieldNumber(inner)) {
            case LABEL_NAME -> name = in.readString();
            case LABEL_VALUE -> value = in.readString();
            default -> in.skipField(inner);
          }
        }
        in.popLimit(limit);
        labels.add(new Label(name, value));
      } else if (field == TIMESERIES_SAMPLES) {
        int limit = in.pushLimit(in.readRawVarint32());
        double value = 0;
        long timestamp = 0;
        int inner;
        while ((inner = in.readTag()) != 0) {
          switch (WireFormat.getTagFieldNumber(inner)) {
            case SAMPLE_VALUE -> value = in.readDouble();
            case SAMPLE_TIMESTAMP -> timestamp = in.readInt64();
            default -> in.skipField(inner);
          }
        }
        in.popLimit(limit);
        samples.add(new Sample(timestamp, value));
      } else {
        in.skipField(tag);
      }
    }
    return new TimeSeries(labels, samples);
  }

  private static int seriesSize(TimeSeries series) {
    int size = 0;
    for (Label label : series.labels()) {
      size += messageFieldSize(TIMESERIES_LABELS, labelSize(label));
    }
    for (Sample sample : series.samples()) {
      size += messageFieldSize(TIMESERIES_SAMPLES, sampleSize(sample));
    }
    return size;
  }

  private static int labelSize(Label label) {
    return CodedOutputStream.computeStringSize(LABEL_NAME, label.name())
        + CodedOutputStream.computeStringSize(LABEL_VALUE, label.value());
  }

  private static int sampleSize(Sample sample) {
    return CodedOutputStream.computeDoubleSize(SAMPLE_VALUE, sample.value())
        + CodedOutputStream.computeInt64Size(SAMPLE_TIMESTAMP, sample.timestampMillis());
  }

  private static int messageFieldSize(int field, int length) {
    return CodedOutputStream.computeTagSize(field) + CodedOutputStream.computeUInt32SizeNoTag(length) + length;
  }
}
