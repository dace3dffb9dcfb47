/**
 * Validation helpers for configuration and CLI inputs.
 * <p><strong>Role:</strong> Domain support utilities invoked before adapters open sockets or read TLS material.</p>
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException} with the offending key.</p>
 */
package ca.gc.cra.prism.validation;
