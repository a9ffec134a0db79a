/**
 * Adapters for the connection lifecycle collaborator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.events;
