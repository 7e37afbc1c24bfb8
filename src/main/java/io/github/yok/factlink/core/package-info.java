/**
 * Reference backfill, the load gate and transactional fact loading.
 */
package io.github.yok.factlink.core;
