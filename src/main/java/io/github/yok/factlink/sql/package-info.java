/**
 * Parameterized PostgreSQL statement generation. Pure functions, no I/O.
 */
package io.github.yok.factlink.sql;
