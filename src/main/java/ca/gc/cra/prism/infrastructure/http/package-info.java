/**
 * <strong>Purpose:</strong> HTTP transport adapters built on {@link java.net.http.HttpClient}.
 * <p><strong>Pipeline role:</strong> Implements the transport ports used by the remote-write pool.
 * <p><strong>Concurrency:</strong> Each handle owns one client and its connection pool; handles are confined to a
 * single shipper.
 * <p><strong>Security:</strong> Loads PEM trust anchors and client identities; skip-verify disables both chain and
 * hostname checks and is logged at WARN.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.http;
