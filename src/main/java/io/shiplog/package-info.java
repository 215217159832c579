/**
 * shiplog source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.shiplog.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.shiplog.cli.ShipLogCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.shiplog.runtime.ShipLogRuntime} wires detection, queueing, upload, deletion and scheduling.</li>
 *   <li>{@code io.shiplog.storage.PersistentQueue} and {@code io.shiplog.storage.ProcessedFileRegistry} hold all durable state.</li>
 * </ul>
 */
package io.shiplog;
