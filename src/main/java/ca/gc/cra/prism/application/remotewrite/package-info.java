/**
 * Remote-write shipping: time-series encoding, the DNS-refreshed transport pool, and the delivery client.
 * <p><strong>Role:</strong> Use cases behind {@link ca.gc.cra.prism.application.remotewrite.RemoteWriteShipper}.</p>
 * <p><strong>Concurrency:</strong> Not thread-safe. One shipper instance serves one logical writer; callers wanting
 * concurrent throughput create one instance per writer or serialize calls externally.</p>
 * <p><strong>Performance:</strong> Every delivery call blocks on network I/O and, when the refresh deadline has
 * passed, on a DNS lookup plus transport rebuild.</p>
 * <p><strong>Metrics:</strong> Emits {@code remote_write.deliver.*}, {@code remote_write.encode.*}, and
 * {@code remote_write.pool.refresh}.</p>
 * <p><strong>Security:</strong> Basic-auth credentials are encoded into the request header and never logged.</p>
 */
package ca.gc.cra.prism.application.remotewrite;
