/**
 * <strong>Purpose:</strong> Wire-format adapters for the Prometheus remote-write protocol.
 * <p><strong>Pipeline role:</strong> Implements {@link ca.gc.cra.prism.application.port.WriteRequestPackager} with
 * protobuf serialization and snappy block compression.
 * <p><strong>Concurrency:</strong> Packagers are stateless and thread-safe.
 * <p><strong>Performance:</strong> Messages are sized up front so the protobuf encoder writes into one exact array.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.remotewrite;
