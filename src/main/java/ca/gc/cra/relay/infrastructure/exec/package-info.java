/**
 * Thread and executor factories for accept loops, connection writers, and subscriber supervisors.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.exec;
