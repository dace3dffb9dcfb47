/**
 * Core domain model for PRISM metric records and remote-write payloads.
 * <p><strong>Role:</strong> Domain layer values describing inbound metrics and outbound time series without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain values feed the {@code remote_write.*} self-telemetry namespace.</p>
 * <p><strong>Security:</strong> Label values are copied verbatim from tags; callers own tag hygiene.</p>
 */
package ca.gc.cra.prism.domain;
