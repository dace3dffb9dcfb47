/**
 * Port interfaces defining PRISM's hexagonal boundaries.
 * <p><strong>Role:</strong> Application-facing contracts for DNS, HTTP transport, wire packing, clocks, and metrics.</p>
 * <p><strong>Concurrency:</strong> Each port documents its own guarantees; the remote-write ports assume a single writer.</p>
 * <p><strong>Performance:</strong> Ports are thin so adapters can be swapped in tests without a network.</p>
 * <p><strong>Metrics:</strong> Implementations report under {@code remote_write.*} through {@link ca.gc.cra.prism.application.port.MetricsPort}.</p>
 * <p><strong>Security:</strong> Transport adapters own TLS material; credentials travel only inside request headers.</p>
 */
package ca.gc.cra.prism.application.port;
