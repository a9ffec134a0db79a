/**
 * {@code relay} command-line entry points.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges YAML and defaults,
 * configures logging and telemetry, and drives a {@code Publisher} or {@code Subscriber}.</p>
 * <p><strong>Output:</strong> stdout carries usage, dry-run plans, and received events; logs go to stderr.</p>
 */
package ca.gc.cra.relay.api;
