/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.prism.application.port.MetricsPort}.
 * <p><strong>Pipeline role:</strong> Adapter layer exporting shipper self-telemetry.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.
 * <p><strong>Performance:</strong> Instruments are cached per metric key.
 * <p><strong>Metrics:</strong> Exports {@code remote_write.deliver.*}, {@code remote_write.pool.*},
 * {@code remote_write.encode.*}, and {@code remote_write.payload.bytes}.
 * <p><strong>Security:</strong> Metric attributes never include credentials.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.metrics;
