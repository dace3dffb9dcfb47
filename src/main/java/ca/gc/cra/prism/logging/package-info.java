/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for CLI diagnostics and delivery failure reporting.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction helpers so credentials never reach operator logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.logging;
