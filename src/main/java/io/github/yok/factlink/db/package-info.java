/**
 * Database access shared by the write path.
 *
 * <p>
 * Holds the connection pool with transient-error retry, and catalog introspection with column
 * projection.
 * </p>
 */
package io.github.yok.factlink.db;
