/**
 * SyncMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.syncmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.syncmesh.runtime.SyncMeshRuntime} wires one node from a data root.</li>
 *   <li>{@code io.syncmesh.session.SessionSynchronizer} reconciles sessions with vector clocks.</li>
 *   <li>{@code io.syncmesh.webhook.WebhookGateway} and {@code io.syncmesh.processor.SyncOperationProcessor}
 *       form the idempotent ingestion pipeline that ends in the dead-letter store.</li>
 * </ul>
 */
package io.syncmesh;
