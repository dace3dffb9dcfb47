package ca.gc.cra.prism.application.remotewrite;

import java.util.Locale;

/**
 * Failure categories surfaced by a delivery call.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Malformed URL or unusable TLS material; fatal at connect. */
  CONFIGURATION,
  /** DNS lookup failed during connect or a post-delivery refresh. */
  RESOLUTION,
  /** Connect, TLS handshake, timeout, or I/O failure while talking to the endpoint. */
  TRANSPORT,
  /** Endpoint answered with a non-2xx status. */
  REMOTE_REJECTED,
  /** Payload could not be serialized; indicates a bug rather than bad input. */
  ENCODING;

  /**
   * Returns the lower-case token used in metric names, e.g. {@code remote_rejected}.
   *
   * @return metric-friendly token
   */
  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }
}
