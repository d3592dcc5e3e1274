/**
 * JDBC backend of the versioner.
 *
 * <ul>
 *   <li>{@link com.verso.database.JdbcVersionApplier}: version history in a tracking table
 *   <li>{@link com.verso.database.VersionTableVersion}: bootstrap version creating that table
 *   <li>{@link com.verso.database.SqlScriptVersion}: version backed by SQL script resources
 *   <li>{@link com.verso.database.TransactionalChangesListener}: one transaction per change
 *   <li>{@link com.verso.database.ConnectionSource}: where the above get their connections
 * </ul>
 *
 * @see com.verso.database.migration.VersionerConfig
 */
package com.verso.database;
