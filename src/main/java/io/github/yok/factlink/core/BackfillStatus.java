package io.github.yok.factlink.core;

/**
 * Outcome of one foreign key entry within a backfill run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum BackfillStatus {
    SUCCEEDED,
    FAILED,
    // Not attempted because a depends-on entry failed or was skipped
    SKIPPED
}
