/**
 * Error taxonomy of the write path.
 *
 * <p>
 * Every failure is an unchecked {@link io.github.yok.factlink.error.WarehouseWriteException}
 * tagged with an {@link io.github.yok.factlink.error.ErrorCategory}.
 * </p>
 */
package io.github.yok.factlink.error;
