package io.github.yok.factlink.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of {@link WritePathRun#write}: the backfill result, and the load result when the gate
 * opened.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class WriteResult {

    private final BackfillResult backfill;
    // Null when backfill failed and the load was not attempted
    private final LoadResult load;

    /**
     * Returns whether both steps succeeded.
     *
     * @return {@code true} if the fact rows were committed
     */
    public boolean isSuccess() {
        return backfill.isSuccess() && load != null && load.isSuccess();
    }
}
