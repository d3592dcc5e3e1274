/**
 * Schema-version synchronization engine.
 *
 * <p>A {@link com.verso.versioner.Versioner} moves a versioned structure (usually a database
 * schema) from the version recorded by its {@link com.verso.versioner.VersionApplier} to a target
 * version, applying the {@link com.verso.versioner.Version} scripts that lie strictly between the
 * two. Observers plug in through {@link com.verso.versioner.SyncListener} and can veto the sync by
 * throwing.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.verso.versioner.Versioner}: ordering, direction, apply loop, event emission
 *   <li>{@link com.verso.versioner.Version} / {@link com.verso.versioner.VersionApplier}:
 *       collaborator contracts implemented by backends
 *   <li>{@link com.verso.versioner.NoOpListener}, {@link com.verso.versioner.BroadcastListener},
 *       {@link com.verso.versioner.LoggingListener}: stock listeners
 *   <li>{@link com.verso.versioner.SyncException} and friends: the error taxonomy
 * </ul>
 */
package com.verso.versioner;
