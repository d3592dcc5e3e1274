/**
 * Observability listeners for the versioner.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.verso.observability.MetricsSyncListener}: Micrometer counters, timer and gauge
 *       fed by sync events
 *   <li>{@link com.verso.observability.TracingSyncListener}: OpenTelemetry spans per sync and
 *       per change
 *   <li>{@link com.verso.observability.VersionMdcListener}: SLF4J MDC bridge for the version in
 *       flight
 *   <li>{@link com.verso.observability.MetricFactory}: meter creation with the structure tag
 * </ul>
 */
package com.verso.observability;
