/**
 * Clock adapters backing {@link ca.gc.cra.relay.application.port.ClockPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.time;
