/**
 * Composition root.
 *
 * <p>{@link io.syncmesh.runtime.SyncMeshRuntime} builds every component of a node from one
 * data root and settings file, owns the worker pools, and exposes the pieces the CLI and
 * HTTP boundary drive.
 */
package io.syncmesh.runtime;
