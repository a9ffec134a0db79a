/**
 * <strong>Purpose:</strong> Typed publisher and subscriber settings plus the YAML/CLI loading chain that
 * produces them.
 * <p><strong>Precedence:</strong> CLI arguments override YAML values, which override mode defaults.
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.
 * <p><strong>Security:</strong> All values are validated before a socket is bound or opened.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.config;
