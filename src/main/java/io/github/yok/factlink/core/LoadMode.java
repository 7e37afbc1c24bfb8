package io.github.yok.factlink.core;

/**
 * How the loader writes fact rows. Shares the conflict vocabulary of the backfill engine.
 *
 * @author Yasuharu.Okawauchi
 */
public enum LoadMode {

    /**
     * Plain insert; a duplicate key fails the whole load.
     */
    INSERT(false),

    /**
     * Insert, overwriting non-key columns of rows whose conflict keys already exist.
     */
    UPSERT(true),

    /**
     * Delete every row matching a distinct conflict-key combination of the batch, then insert all
     * rows. Needs no unique constraint.
     */
    REFRESH(true),

    /**
     * Insert rows whose conflict keys are absent; skip the others.
     */
    INSERT_MISSING(true),

    /**
     * Insert rows whose conflict keys are absent; fill only null columns of the others.
     */
    FILL_NULL_ONLY(true);

    private final boolean keysRequired;

    LoadMode(boolean keysRequired) {
        this.keysRequired = keysRequired;
    }

    /**
     * Returns whether the mode needs conflict keys.
     *
     * @return {@code true} if conflict keys are mandatory
     */
    public boolean requiresKeys() {
        return keysRequired;
    }
}
