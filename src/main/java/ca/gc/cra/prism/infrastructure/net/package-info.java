/**
 * <strong>Purpose:</strong> Name resolution adapters for the transport pool.
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.net;
