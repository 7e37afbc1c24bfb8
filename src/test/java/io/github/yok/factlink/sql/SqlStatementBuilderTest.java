package io.github.yok.factlink.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.factlink.error.InvalidIdentifierException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SqlStatementBuilderTest {

    private static final TableRef PLANS = TableRef.of("mapping", "年金计划");

    @Test
    void constructor_異常ケース_リフレクションで生成する_AssertionErrorが送出されること()
            throws Exception {
        Constructor<SqlStatementBuilder> c = SqlStatementBuilder.class.getDeclaredConstructor();
        c.setAccessible(true);
        InvocationTargetException ex =
                assertThrows(InvocationTargetException.class, c::newInstance);
        assertTrue(ex.getCause() instanceof AssertionError);
    }

    @Test
    void quoteIdentifier_正常ケース_二重引用符を含む_二重化して囲まれること() {
        assertEquals("\"a\"\"b\"", SqlStatementBuilder.quoteIdentifier("a\"b"));
        assertEquals("\"年金计划号\"", SqlStatementBuilder.quoteIdentifier("年金计划号"));
    }

    @Test
    void quoteIdentifier_正常ケース_63バイトちょうど_受け付けられること() {
        // 21 CJK characters x 3 bytes = 63 bytes
        String name = "计".repeat(21);
        assertEquals('"' + name + '"', SqlStatementBuilder.quoteIdentifier(name));
    }

    @Test
    void quoteIdentifier_異常ケース_64バイトを超える_InvalidIdentifierExceptionが送出されること() {
        String name = "计".repeat(22);
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
                () -> SqlStatementBuilder.quoteIdentifier(name));
        assertTrue(ex.getMessage().contains("66 bytes"));
    }

    @Test
    void quoteIdentifier_異常ケース_空白またはNULを含む_InvalidIdentifierExceptionが送出されること() {
        assertThrows(InvalidIdentifierException.class,
                () -> SqlStatementBuilder.quoteIdentifier(" "));
        assertThrows(InvalidIdentifierException.class,
                () -> SqlStatementBuilder.quoteIdentifier(null));
        assertThrows(InvalidIdentifierException.class,
                () -> SqlStatementBuilder.quoteIdentifier("a\0b"));
    }

    @Test
    void qualify_正常ケース_スキーマとテーブル_引用符付きで連結されること() {
        assertEquals("\"mapping\".\"年金计划\"", SqlStatementBuilder.qualify(PLANS));
    }

    @Test
    void maxRowsPerStatement_正常ケース_列数を指定する_バインド上限内の行数が返ること() {
        assertEquals(65535, SqlStatementBuilder.maxRowsPerStatement(1));
        assertEquals(6553, SqlStatementBuilder.maxRowsPerStatement(10));
        assertEquals(1, SqlStatementBuilder.maxRowsPerStatement(70000));
        assertThrows(IllegalArgumentException.class,
                () -> SqlStatementBuilder.maxRowsPerStatement(0));
    }

    @Test
    void buildInsert_正常ケース_2行2列_複数行VALUESとRETURNINGが生成されること() {
        SqlTemplate t = SqlStatementBuilder.buildInsert(PLANS, List.of("a", "b"), 2);
        assertEquals("INSERT INTO \"mapping\".\"年金计划\" AS \"target\" (\"a\",\"b\") "
                + "VALUES (?,?),(?,?) RETURNING TRUE", t.getSql());
        assertEquals(4, t.getParameterCount());
    }

    @Test
    void buildInsert_異常ケース_バインド上限を超える_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> SqlStatementBuilder.buildInsert(PLANS, List.of("a", "b"), 40000));
    }

    @Test
    void buildInsertWithConflict_正常ケース_insertMissing_DO_NOTHINGが生成されること() {
        SqlTemplate t = SqlStatementBuilder.buildInsertWithConflict(PLANS,
                List.of("k", "name"), 1, List.of("k"), ConflictPolicy.INSERT_MISSING, Set.of());
        assertEquals("INSERT INTO \"mapping\".\"年金计划\" AS \"target\" (\"k\",\"name\") "
                + "VALUES (?,?) ON CONFLICT (\"k\") DO NOTHING RETURNING TRUE", t.getSql());
    }

    @Test
    void buildInsertWithConflict_正常ケース_fillNullOnly_COALESCEとWHERE条件が生成されること() {
        SqlTemplate t = SqlStatementBuilder.buildInsertWithConflict(PLANS,
                List.of("k", "name", "_source"), 1, List.of("k"), ConflictPolicy.FILL_NULL_ONLY,
                Set.of("_source"));
        assertEquals("INSERT INTO \"mapping\".\"年金计划\" AS \"target\" "
                + "(\"k\",\"name\",\"_source\") VALUES (?,?,?) ON CONFLICT (\"k\") DO UPDATE SET "
                + "\"name\" = COALESCE(\"target\".\"name\", EXCLUDED.\"name\") WHERE "
                + "(\"target\".\"name\" IS NULL AND EXCLUDED.\"name\" IS NOT NULL) "
                + "RETURNING (xmax = 0)", t.getSql());
    }

    @Test
    void buildInsertWithConflict_正常ケース_更新可能列がない_DO_NOTHINGに退化すること() {
        SqlTemplate t = SqlStatementBuilder.buildInsertWithConflict(PLANS,
                List.of("k", "_source"), 1, List.of("k"), ConflictPolicy.FILL_NULL_ONLY,
                Set.of("_source"));
        assertTrue(t.getSql().endsWith("ON CONFLICT (\"k\") DO NOTHING RETURNING TRUE"));
    }

    @Test
    void buildInsertWithConflict_異常ケース_キーが列に含まれない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> SqlStatementBuilder.buildInsertWithConflict(PLANS, List.of("name"), 1,
                        List.of("k"), ConflictPolicy.INSERT_MISSING, Set.of()));
    }

    @Test
    void buildUpsert_正常ケース_非キー列_EXCLUDEDで上書きされること() {
        SqlTemplate t = SqlStatementBuilder.buildUpsert(PLANS, List.of("k", "v"), 1,
                List.of("k"));
        assertTrue(t.getSql().endsWith(
                "ON CONFLICT (\"k\") DO UPDATE SET \"v\" = EXCLUDED.\"v\" RETURNING (xmax = 0)"));
    }

    @Test
    void buildUpsert_正常ケース_キー列のみ_キー自身で更新され構文が有効であること() {
        SqlTemplate t = SqlStatementBuilder.buildUpsert(PLANS, List.of("k"), 1, List.of("k"));
        assertTrue(t.getSql().contains("DO UPDATE SET \"k\" = EXCLUDED.\"k\""));
    }

    @Test
    void buildSelectExisting_正常ケース_複合キー2タプル_IN句が生成されること() {
        SqlTemplate t = SqlStatementBuilder.buildSelectExisting(PLANS, List.of("a", "b"), 2);
        assertEquals("SELECT \"a\",\"b\" FROM \"mapping\".\"年金计划\" WHERE (\"a\",\"b\") IN "
                + "((?,?),(?,?))", t.getSql());
        assertEquals(4, t.getParameterCount());
    }

    @Test
    void buildDeleteByKeys_正常ケース_複合キー_IS_NOT_DISTINCT_FROMで結合されること() {
        SqlTemplate t = SqlStatementBuilder.buildDeleteByKeys(PLANS, List.of("a", "b"));
        assertEquals("DELETE FROM \"mapping\".\"年金计划\" WHERE \"a\" IS NOT DISTINCT FROM ? "
                + "AND \"b\" IS NOT DISTINCT FROM ?", t.getSql());
        assertEquals(1, t.getRowCount());
    }

    @Test
    void buildColumnCatalogQuery_正常ケース_ordinal順_プレースホルダのみで構成されること() {
        String sql = SqlStatementBuilder.buildColumnCatalogQuery();
        assertTrue(sql.contains("information_schema.columns"));
        assertTrue(sql.endsWith("ORDER BY ordinal_position"));
    }

    @Test
    void build_正常ケース_ランダムな値と識別子_値がSQL文字列に現れないこと() {
        String[] fragments = {"'", "\"", ";", "--", "DROP TABLE x", "' OR '1'='1", "计划", "/*",
            "\\", "$$"};
        Random random = new Random(42);
        for (int n = 0; n < 200; n++) {
            List<String> columns = new ArrayList<>();
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < 1 + random.nextInt(4); c++) {
                String column = "c" + c + fragments[random.nextInt(fragments.length)];
                columns.add(column);
                row.put(column, "v" + n + fragments[random.nextInt(fragments.length)] + "@@");
            }
            TableRef table = TableRef.of("s" + fragments[random.nextInt(fragments.length)], "t");
            List<SqlTemplate> templates = List.of(
                    SqlStatementBuilder.buildInsert(table, columns, 1),
                    SqlStatementBuilder.buildUpsert(table, columns, 1, columns.subList(0, 1)),
                    SqlStatementBuilder.buildInsertWithConflict(table, columns, 1,
                            columns.subList(0, 1), ConflictPolicy.FILL_NULL_ONLY, Set.of()),
                    SqlStatementBuilder.buildSelectExisting(table, columns.subList(0, 1), 1),
                    SqlStatementBuilder.buildDeleteByKeys(table, columns.subList(0, 1)));
            for (SqlTemplate t : templates) {
                for (Object value : row.values()) {
                    assertFalse(t.getSql().contains((String) value), t.getSql());
                }
                assertFalse(t.getSql().contains("@@"), t.getSql());
            }
        }
    }

    @Test
    void bindRows_正常ケース_欠落キーとnull_setNullで束縛されること() throws Exception {
        SqlTemplate t = SqlStatementBuilder.buildInsert(PLANS, List.of("a", "b"), 2);
        PreparedStatement ps = mock(PreparedStatement.class);
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", "x");
        first.put("b", null);
        t.bindRows(ps, List.of(first, Map.of("b", 2)));
        verify(ps).setObject(1, "x");
        verify(ps).setNull(2, Types.NULL);
        verify(ps).setNull(3, Types.NULL);
        verify(ps).setObject(4, 2);
    }

    @Test
    void bindRows_異常ケース_行数不一致_IllegalArgumentExceptionが送出されること() throws Exception {
        SqlTemplate t = SqlStatementBuilder.buildInsert(PLANS, List.of("a"), 2);
        PreparedStatement ps = mock(PreparedStatement.class);
        assertThrows(IllegalArgumentException.class, () -> t.bindRows(ps, List.of(Map.of())));
        verify(ps, never()).setNull(anyInt(), anyInt());
    }
}
