/**
 * <strong>Purpose:</strong> Infrastructure adapters implementing PRISM application ports.
 * <p><strong>Pipeline role:</strong> Adapter layer bridging the shipper to DNS, HTTP, compression, input files, and
 * telemetry backends.
 * <p><strong>Concurrency:</strong> See individual adapters; transport handles are confined to one shipper.
 * <p><strong>Performance:</strong> Adapters avoid per-request allocation of clients and SSL contexts.
 * <p><strong>Metrics:</strong> Metrics adapters translate {@code remote_write.*} keys into exporter instruments.
 * <p><strong>Security:</strong> TLS material is loaded once per pool generation; secrets never reach logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure;
