package io.github.yok.factlink.core;

import io.github.yok.factlink.config.FactTableEntry;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One pipeline run of a domain: a backfill engine and a loader sharing one schema cache.
 *
 * <p>
 * Not thread-safe; create one per run with {@link WritePathFactory#newRun(String)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class WritePathRun {

    private final String domain;
    private final FactTableEntry factTable;
    private final ReferenceBackfillEngine backfillEngine;
    private final BatchTransactionalLoader loader;

    WritePathRun(String domain, FactTableEntry factTable, ReferenceBackfillEngine backfillEngine,
            BatchTransactionalLoader loader) {
        this.domain = domain;
        this.factTable = factTable;
        this.backfillEngine = backfillEngine;
        this.loader = loader;
    }

    /**
     * Wraps records into a batch for this domain's fact table.
     *
     * @param records transformed fact records
     * @return batch
     */
    public FactBatch newBatch(List<? extends Map<String, ?>> records) {
        return FactBatch.of(domain, factTable.getTableRef(), records);
    }

    /**
     * Backfills references, then loads the batch if backfill succeeded.
     *
     * @param batch fact batch
     * @param options load options
     * @return both results; the load is absent when backfill failed
     */
    public WriteResult write(FactBatch batch, LoadOptions options) {
        BackfillResult backfill = backfillEngine.backfill(batch);
        if (!backfill.isSuccess()) {
            log.error("[{}] Load not attempted: backfill failed for batch {}", domain,
                    batch.getBatchId());
            return new WriteResult(backfill, null);
        }
        return new WriteResult(backfill, loader.load(backfill, batch, options));
    }
}
