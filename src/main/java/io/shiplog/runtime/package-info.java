/**
 * Daemon wiring.
 *
 * <p>{@link io.shiplog.runtime.ShipLogRuntime} builds every component from one
 * {@link io.shiplog.config.ShipLogConfig}, owns startup and shutdown ordering, and exposes
 * the operator actions used by the CLI.
 */
package io.shiplog.runtime;
