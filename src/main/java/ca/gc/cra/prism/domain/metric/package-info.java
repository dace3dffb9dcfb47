/**
 * Metric records handed to PRISM by the metric pipeline.
 * <p><strong>Role:</strong> Inbound domain values: names, tags, typed fields, timestamps, and kinds.</p>
 * <p><strong>Concurrency:</strong> Immutable; records may be shared between the reader and the shipper.</p>
 */
package ca.gc.cra.prism.domain.metric;
