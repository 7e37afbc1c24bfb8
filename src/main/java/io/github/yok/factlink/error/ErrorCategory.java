package io.github.yok.factlink.error;

/**
 * Classifies write-path failures so that callers can distinguish configuration problems from
 * connectivity, schema drift and data errors.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorCategory {

    /**
     * Malformed foreign key configuration, missing required fields, identifier too long.
     */
    CONFIGURATION,

    /**
     * Non-transient connection failure (authentication, unknown host, unreachable database).
     */
    CONNECTION,

    /**
     * Transient acquisition failures persisted after all retries.
     */
    POOL_EXHAUSTED,

    /**
     * Target table or column missing from the warehouse catalog.
     */
    SCHEMA_DRIFT,

    /**
     * Type mismatch or constraint violation while writing rows.
     */
    DATA,

    /**
     * Loader invoked without a matching successful backfill.
     */
    GATE
}
