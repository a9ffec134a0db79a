/**
 * Bus-level value types: error taxonomy, subscriber states, and connection lifecycle notifications.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.bus;
