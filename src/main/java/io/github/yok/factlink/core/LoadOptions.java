package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-call loader options.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class LoadOptions {

    private final LoadMode mode;
    private final List<String> conflictKeys;
    // Bounds pool acquisition only; null means no caller deadline
    private final Duration acquireTimeout;

    private LoadOptions(LoadMode mode, List<String> conflictKeys, Duration acquireTimeout) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.conflictKeys = ImmutableList.copyOf(conflictKeys);
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Options for a plain insert.
     *
     * @return options
     */
    public static LoadOptions insert() {
        return new LoadOptions(LoadMode.INSERT, ImmutableList.of(), null);
    }

    /**
     * Options for the given mode and conflict keys.
     *
     * @param mode load mode
     * @param conflictKeys key columns
     * @return options
     */
    public static LoadOptions of(LoadMode mode, List<String> conflictKeys) {
        return new LoadOptions(mode, conflictKeys, null);
    }

    /**
     * Options for an upsert on the given keys.
     *
     * @param conflictKeys key columns of a unique constraint
     * @return options
     */
    public static LoadOptions upsert(String... conflictKeys) {
        return of(LoadMode.UPSERT, ImmutableList.copyOf(conflictKeys));
    }

    /**
     * Options for a delete-then-insert refresh on the given keys.
     *
     * @param refreshKeys columns defining the refresh scope
     * @return options
     */
    public static LoadOptions refresh(String... refreshKeys) {
        return of(LoadMode.REFRESH, ImmutableList.copyOf(refreshKeys));
    }

    /**
     * Returns a copy with a caller deadline for pool acquisition.
     *
     * @param timeout acquisition timeout
     * @return new options
     */
    public LoadOptions withAcquireTimeout(Duration timeout) {
        return new LoadOptions(mode, conflictKeys, timeout);
    }
}
