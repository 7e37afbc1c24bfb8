package io.github.yok.factlink.config;

import io.github.yok.factlink.sql.ConflictPolicy;
import io.github.yok.factlink.sql.TableRef;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;

/**
 * One foreign key relationship of a fact table and how its reference table is backfilled.
 *
 * <pre>
 * - name: plans
 *   target-schema: mapping
 *   target-table: 年金计划
 *   source-columns: [计划代码]
 *   target-key-columns: [年金计划号]
 *   conflict-policy: insert_missing
 *   tracking-fields-enabled: true
 *   skip-values: ["(空白)"]
 *   backfill-columns:
 *     - source: 客户名称
 *       target: 客户名称
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ForeignKeyEntry {

    // Unique name within the fact table's entries
    private String name;
    // Schema of the reference table
    private String targetSchema = "public";
    // Reference table to backfill
    private String targetTable;
    // Fact columns holding the foreign key (composite keys list several)
    private List<String> sourceColumns = new ArrayList<>();
    // Key columns of the reference table, positionally matching sourceColumns
    private List<String> targetKeyColumns = new ArrayList<>();
    // Additional columns derived from the fact rows
    private List<BackfillColumnMapping> backfillColumns = new ArrayList<>();
    // What to do with keys that already exist
    private ConflictPolicy conflictPolicy = ConflictPolicy.INSERT_MISSING;
    // Write _source/_needs_review/_derived_from_domain/_derived_at when the table has them
    private boolean trackingFieldsEnabled;
    // Sentinel literals never treated as real keys
    private Set<String> skipValues = new LinkedHashSet<>();
    // Treat empty or whitespace-only keys as absent
    private boolean skipBlankValues = true;
    // When true, a failure of this entry does not fail the whole backfill
    private boolean optional;
    // Names of entries (declared earlier) that must succeed before this one runs
    private List<String> dependsOn = new ArrayList<>();

    /**
     * Returns the reference table as a {@link TableRef}.
     *
     * @return target table reference
     */
    public TableRef getTargetTableRef() {
        return TableRef.of(targetSchema, targetTable);
    }
}
