package io.github.yok.factlink.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class DataWriteExceptionTest {

    @Test
    void constructor_正常ケース_SQLExceptionを原因に持つ_チャンク番号とSQLStateが取得できること() {
        SQLException cause = new SQLException("null value violates not-null", "23502");
        DataWriteException ex =
                new DataWriteException("load.insert", "business.规模明细", 3, cause);

        assertEquals(ErrorCategory.DATA, ex.getCategory());
        assertEquals("load.insert", ex.getOperation());
        assertEquals(3, ex.getChunkIndex());
        assertEquals("23502", ex.getSqlState());
        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().startsWith("load.insert failed for business.规模明细 at chunk 3"),
                ex.getMessage());
    }

    @Test
    void getSqlState_正常ケース_原因がラップされている_原因連鎖から取得されること() {
        RuntimeException wrapper =
                new RuntimeException(new SQLException("duplicate key", "23505"));
        DataWriteException ex = new DataWriteException("load.insert", "s.t", -1, wrapper);
        assertEquals("23505", ex.getSqlState());
        assertTrue(!ex.getMessage().contains("chunk"));
    }

    @Test
    void getSqlState_正常ケース_SQLExceptionがない_nullが返ること() {
        DataWriteException ex = new DataWriteException("load.insert", "s.t", 0,
                new IllegalStateException("boom"));
        assertNull(ex.getSqlState());
    }

    @Test
    void getCategory_正常ケース_各例外_カテゴリが対応すること() {
        assertEquals(ErrorCategory.CONFIGURATION, new ConfigurationException("x").getCategory());
        assertEquals(ErrorCategory.CONFIGURATION,
                new InvalidIdentifierException("x").getCategory());
        assertEquals(ErrorCategory.GATE, new GateViolationException("x").getCategory());
        assertEquals(ErrorCategory.SCHEMA_DRIFT, new SchemaDriftException("x").getCategory());
        assertEquals(ErrorCategory.CONNECTION,
                new WarehouseConnectionException("x", null).getCategory());
        PoolExhaustedException pool = new PoolExhaustedException(4, new SQLException("t"));
        assertEquals(ErrorCategory.POOL_EXHAUSTED, pool.getCategory());
        assertEquals(4, pool.getAttempts());
    }
}
