/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Role:</strong> Rejects malformed addresses, capacities, and topic patterns before a publisher
 * binds or a subscriber connects.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Enforces printable ASCII constraints to avoid control character injection.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.validation;
