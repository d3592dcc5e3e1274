/**
 * Script discovery and Spring Boot wiring of the schema versioner.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.verso.database.migration.ClasspathScriptVersions}: finds {@code V{n}__*.sql}
 *       and {@code U{n}__*.sql} scripts
 *   <li>{@link com.verso.database.migration.VersionerProperties}: externalized configuration
 *   <li>{@link com.verso.database.migration.VersionerConfig}: Spring {@code @Configuration}
 *       creating the versioner beans
 *   <li>{@link com.verso.database.migration.VersionerRunner}: syncs at application startup
 *   <li>{@link com.verso.database.migration.VersionStatusService}: read-only version status
 * </ul>
 */
package com.verso.database.migration;
