package ca.gc.cra.prism.domain.remotewrite;

/**
 * One observation of a series.
 *
 * @param timestampMillis milliseconds since the epoch
 * @param value sample value
 * @since 0.1.0
 */
public record Sample(long timestampMillis, double value) {}
