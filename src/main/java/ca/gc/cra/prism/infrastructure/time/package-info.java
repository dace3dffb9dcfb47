/**
 * <strong>Purpose:</strong> Clock adapter implementing {@link ca.gc.cra.prism.application.port.ClockPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.time;
