package io.github.yok.factlink.sql;

/**
 * What happens when a row's key already exists in the target table.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConflictPolicy {

    /**
     * Insert rows whose key is absent; leave existing rows untouched.
     */
    INSERT_MISSING,

    /**
     * Insert rows whose key is absent; on existing rows, set only the columns that are currently
     * {@code NULL}. A non-null value is never overwritten.
     */
    FILL_NULL_ONLY
}
