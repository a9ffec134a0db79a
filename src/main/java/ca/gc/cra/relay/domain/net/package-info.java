/**
 * Network addressing value types shared by publishers, subscribers, and configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.net;
