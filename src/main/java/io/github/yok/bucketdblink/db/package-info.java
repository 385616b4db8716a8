/**
 * JDBC plumbing package.
 *
 * <p>
 * Provides the connection factory used by the connection manager and the identifier quoting used
 * by every generated DDL and DML statement. The loader targets PostgreSQL only.
 * </p>
 */
package io.github.yok.bucketdblink.db;
