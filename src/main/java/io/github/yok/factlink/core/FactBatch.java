package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.factlink.sql.TableRef;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;

/**
 * Immutable snapshot of the fact records handed over by the upstream pipeline for one fact table.
 *
 * <p>
 * Every batch gets a unique id. A {@link BackfillResult} remembers the id of the batch it was
 * computed for, which is how the loader verifies that backfill ran for exactly this batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class FactBatch {

    private final String batchId;
    private final String domain;
    private final TableRef factTable;
    // Defensive copies; key order preserved, null values allowed
    private final List<Map<String, Object>> records;

    private FactBatch(String domain, TableRef factTable, List<Map<String, Object>> records) {
        this.batchId = UUID.randomUUID().toString();
        this.domain = domain;
        this.factTable = factTable;
        this.records = records;
    }

    /**
     * Creates a batch, copying every record.
     *
     * @param domain domain name (used as {@code _derived_from_domain})
     * @param factTable target fact table
     * @param records records with uniform string keys
     * @return batch
     */
    public static FactBatch of(String domain, TableRef factTable,
            List<? extends Map<String, ?>> records) {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(factTable, "factTable");
        Objects.requireNonNull(records, "records");
        ImmutableList.Builder<Map<String, Object>> copy = ImmutableList.builder();
        for (Map<String, ?> record : records) {
            Objects.requireNonNull(record, "record");
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        return new FactBatch(domain, factTable, copy.build());
    }

    /**
     * Returns the number of records.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Returns whether the batch has no records.
     *
     * @return {@code true} if empty
     */
    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "FactBatch[" + batchId + ", " + factTable + ", rows=" + records.size() + "]";
    }
}
