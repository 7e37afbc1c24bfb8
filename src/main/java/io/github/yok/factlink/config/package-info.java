/**
 * Configuration classes bound from {@code application.yml} and {@code foreign-keys.yml}.
 *
 * <p>
 * Also wires the write path into a Spring application context.
 * </p>
 */
package io.github.yok.factlink.config;
