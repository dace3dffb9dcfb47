/**
 * <strong>Purpose:</strong> Input adapters that turn files into {@link ca.gc.cra.prism.domain.metric.MetricRecord}s.
 * <p><strong>Concurrency:</strong> Readers are stateless apart from their clock; thread-safe.
 * <p><strong>Performance:</strong> Jackson streaming parser, one line at a time.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.input;
