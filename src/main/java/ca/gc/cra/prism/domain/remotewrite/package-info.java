/**
 * Remote-write payload model: labels, samples, time series, and write requests.
 * <p><strong>Role:</strong> Outbound domain values built by the encoder and serialized by the wire packager.</p>
 * <p><strong>Concurrency:</strong> Immutable records; list components are unmodifiable copies.</p>
 * <p><strong>Performance:</strong> One request is built per delivery call and discarded after packing.</p>
 */
package ca.gc.cra.prism.domain.remotewrite;
