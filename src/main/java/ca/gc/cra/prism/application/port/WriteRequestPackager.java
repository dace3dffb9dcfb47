package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.remotewrite.EncodingException;
import ca.gc.cra.prism.domain.remotewrite.WriteRequest;

/**
 * <strong>What:</strong> Port turning a write request into the compressed wire payload.
 * <p><strong>Role:</strong> Output port implemented by {@code SnappyProtobufPackager}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless.</p>
 *
 * @since 0.1.0
 */
public interface WriteRequestPackager {
  /**
   * Serializes and compresses {@code request}.
   *
   * @param request request to pack
   * @return compressed payload bytes
   * @throws EncodingException if serialization or compression fails
   */
  byte[] pack(WriteRequest request) throws EncodingException;

  /**
   * Returns the {@code Content-Encoding} header value describing the compression codec.
   *
   * @return codec token, e.g. {@code snappy}
   */
  String contentEncoding();

  /**
   * Returns the {@code Content-Type} header value describing the wire schema.
   *
   * @return media type, e.g. {@code application/x-protobuf}
   */
  String contentType();
}
