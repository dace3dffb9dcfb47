/**
 * Command-line entry points for PRISM: {@code ship} and {@code sample-config}.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges configuration, configures
 * logging and telemetry, and invokes the remote-write shipper.</p>
 * <p><strong>Concurrency:</strong> Commands run on the calling thread.</p>
 * <p><strong>Security:</strong> Passwords are redacted in dry-run output and never logged.</p>
 */
package ca.gc.cra.prism.api;
