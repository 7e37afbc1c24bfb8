package io.github.yok.factlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.factlink.config.AggregationConfig;
import io.github.yok.factlink.config.AggregationType;
import io.github.yok.factlink.config.BackfillColumnMapping;
import io.github.yok.factlink.config.ForeignKeyEntry;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CandidateDeriverTest {

    private final CandidateDeriver deriver = new CandidateDeriver();

    private static ForeignKeyEntry plans() {
        ForeignKeyEntry e = new ForeignKeyEntry();
        e.setName("plans");
        e.setTargetSchema("mapping");
        e.setTargetTable("年金计划");
        e.setSourceColumns(List.of("计划代码"));
        e.setTargetKeyColumns(List.of("年金计划号"));
        return e;
    }

    private static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static BackfillColumnMapping mapping(String source, String target,
            AggregationConfig aggregation) {
        BackfillColumnMapping m = new BackfillColumnMapping();
        m.setSource(source);
        m.setTarget(target);
        m.setAggregation(aggregation);
        return m;
    }

    private static AggregationConfig agg(AggregationType type) {
        AggregationConfig a = new AggregationConfig();
        a.setType(type);
        return a;
    }

    @Test
    void derive_正常ケース_重複キーと前後空白_初出順で重複除去されること() {
        List<BackfillCandidate> result = deriver.derive(List.of(row("计划代码", " P002 "),
                row("计划代码", "P001"), row("计划代码", "P002")), plans());

        assertEquals(2, result.size());
        assertEquals(List.of("P002"), result.get(0).getKey());
        assertEquals(List.of("P001"), result.get(1).getKey());
        assertEquals(Map.of("年金计划号", "P002"), result.get(0).getValues());
    }

    @Test
    void derive_正常ケース_null空白除外値_行がスキップされること() {
        ForeignKeyEntry entry = plans();
        entry.setSkipValues(new LinkedHashSet<>(Set.of("(空白)")));

        List<BackfillCandidate> result = deriver.derive(List.of(row("计划代码", null),
                row("计划代码", "  "), row("计划代码", " (空白) "), row("计划代码", "P003")),
                entry);

        assertEquals(1, result.size());
        assertEquals(List.of("P003"), result.get(0).getKey());
    }

    @Test
    void derive_正常ケース_空白除外を無効化_空文字がキーとして残ること() {
        ForeignKeyEntry entry = plans();
        entry.setSkipBlankValues(false);

        List<BackfillCandidate> result = deriver.derive(List.of(row("计划代码", "")), entry);

        assertEquals(1, result.size());
        assertEquals(List.of(""), result.get(0).getKey());
    }

    @Test
    void derive_正常ケース_整数型が混在_同一キーとして扱われること() {
        List<BackfillCandidate> result = deriver.derive(
                List.of(row("计划代码", 1), row("计划代码", 1L)), plans());

        assertEquals(1, result.size());
        assertEquals(List.of(1L), result.get(0).getKey());
    }

    @Test
    void derive_正常ケース_スケール違いの数値キー_最初の値で1件にまとめられること() {
        BackfillColumnMapping name = mapping("计划名称", "计划全称", null);
        ForeignKeyEntry entry = plans();
        entry.setBackfillColumns(List.of(name));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", new BigDecimal("1.0"), "计划名称", "甲"),
                row("计划代码", new BigDecimal("1.00"), "计划名称", "乙"),
                row("计划代码", 1L, "计划名称", "丙"),
                row("计划代码", new BigDecimal("2"), "计划名称", "丁")), entry);

        assertEquals(2, result.size());
        assertEquals(List.of(new BigDecimal("1.0")), result.get(0).getKey());
        assertEquals(new BigDecimal("1.0"), result.get(0).getValues().get("年金计划号"));
        assertEquals("甲", result.get(0).getValues().get("计划全称"));
        assertEquals(List.of(new BigDecimal("2")), result.get(1).getKey());
    }

    @Test
    void derive_正常ケース_複合キー_いずれかが欠ける行は除外されること() {
        ForeignKeyEntry entry = plans();
        entry.setSourceColumns(List.of("计划代码", "组合代码"));
        entry.setTargetKeyColumns(List.of("年金计划号", "组合代码"));

        List<BackfillCandidate> result = deriver.derive(List.of(row("计划代码", "P1", "组合代码",
                "C1"), row("计划代码", "P1", "组合代码", null), row("计划代码", "P1", "组合代码",
                        "C1")), entry);

        assertEquals(1, result.size());
        assertEquals(List.of("P1", "C1"), result.get(0).getKey());
    }

    @Test
    void derive_正常ケース_ソース列がレコードにない_空リストが返ること() {
        assertTrue(deriver.derive(List.of(row("other", "x")), plans()).isEmpty());
        assertTrue(deriver.derive(List.of(), plans()).isEmpty());
    }

    @Test
    void derive_正常ケース_first集計_最初の非空白値が採用されること() {
        ForeignKeyEntry entry = plans();
        entry.setBackfillColumns(List.of(mapping("计划名称", "计划全称", null)));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "计划名称", " "), row("计划代码", "P1", "计划名称", "甲计划"),
                row("计划代码", "P1", "计划名称", "乙计划")), entry);

        assertEquals("甲计划", result.get(0).getValues().get("计划全称"));
    }

    @Test
    void derive_正常ケース_maxBy集計_順序列最大の行の値が採用されること() {
        ForeignKeyEntry entry = plans();
        AggregationConfig maxBy = agg(AggregationType.MAX_BY);
        maxBy.setOrderColumn("期末资产规模");
        entry.setBackfillColumns(List.of(mapping("客户名称", "客户名称", maxBy)));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "客户名称", "小客户", "期末资产规模", new BigDecimal("10.5")),
                row("计划代码", "P1", "客户名称", "大客户", "期末资产规模", "200"),
                row("计划代码", "P1", "客户名称", "平客户", "期末资产规模", 200),
                row("计划代码", "P1", "客户名称", "坏值", "期末资产规模", "n/a")), entry);

        assertEquals("大客户", result.get(0).getValues().get("客户名称"));
    }

    @Test
    void derive_正常ケース_maxBy集計で順序列がすべて無効_firstに退化すること() {
        ForeignKeyEntry entry = plans();
        AggregationConfig maxBy = agg(AggregationType.MAX_BY);
        maxBy.setOrderColumn("期末资产规模");
        entry.setBackfillColumns(List.of(mapping("客户名称", "客户名称", maxBy)));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "客户名称", "甲", "期末资产规模", null),
                row("计划代码", "P1", "客户名称", "乙", "期末资产规模", "x")), entry);

        assertEquals("甲", result.get(0).getValues().get("客户名称"));
    }

    @Test
    void derive_正常ケース_concatDistinct集計_重複除去し整列して連結されること() {
        ForeignKeyEntry entry = plans();
        entry.setBackfillColumns(List.of(mapping("业务类型", "主拓代码",
                agg(AggregationType.CONCAT_DISTINCT))));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "业务类型", "受托"), row("计划代码", "P1", "业务类型", "投资"),
                row("计划代码", "P1", "业务类型", "受托"), row("计划代码", "P1", "业务类型", null)),
                entry);

        assertEquals("受托+投资", result.get(0).getValues().get("主拓代码"));
    }

    @Test
    void derive_正常ケース_concatDistinct集計で整列なし_初出順で連結されること() {
        ForeignKeyEntry entry = plans();
        AggregationConfig concat = agg(AggregationType.CONCAT_DISTINCT);
        concat.setSort(false);
        concat.setSeparator(",");
        entry.setBackfillColumns(List.of(mapping("业务类型", "主拓代码", concat)));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "业务类型", "b"), row("计划代码", "P1", "业务类型", "a")),
                entry);

        assertEquals("b,a", result.get(0).getValues().get("主拓代码"));
    }

    @Test
    void derive_正常ケース_template集計_プレースホルダが置換されること() {
        ForeignKeyEntry entry = plans();
        AggregationConfig template = agg(AggregationType.TEMPLATE);
        template.setTemplate("{计划名称}-{缺失}企业年金");
        entry.setBackfillColumns(List.of(mapping("计划名称", "计划全称", template)));

        List<BackfillCandidate> result = deriver.derive(
                List.of(row("计划代码", "P1", "计划名称", "甲$1")), entry);

        assertEquals("甲$1-企业年金", result.get(0).getValues().get("计划全称"));
    }

    @Test
    void derive_正常ケース_countDistinct集計_異なる値の数が返り値がなければnullであること() {
        ForeignKeyEntry entry = plans();
        entry.setBackfillColumns(List.of(mapping("组合代码", "组合数",
                agg(AggregationType.COUNT_DISTINCT))));

        List<BackfillCandidate> result = deriver.derive(List.of(
                row("计划代码", "P1", "组合代码", "C1"), row("计划代码", "P1", "组合代码", "C2"),
                row("计划代码", "P1", "组合代码", "C1"), row("计划代码", "P2", "组合代码", null)),
                entry);

        assertEquals(2L, result.get(0).getValues().get("组合数"));
        assertNull(result.get(1).getValues().get("组合数"));
    }

    @Test
    void derive_正常ケース_補完元列がレコードにない_nullで補完されること() {
        ForeignKeyEntry entry = plans();
        BackfillColumnMapping optional = mapping("计划类型", "计划类型", null);
        optional.setOptional(true);
        entry.setBackfillColumns(new ArrayList<>(List.of(optional,
                mapping("客户名称", "客户名称", null))));

        List<BackfillCandidate> result =
                deriver.derive(List.of(row("计划代码", "P1")), entry);

        assertTrue(result.get(0).getValues().containsKey("计划类型"));
        assertNull(result.get(0).getValues().get("计划类型"));
        assertNull(result.get(0).getValues().get("客户名称"));
    }
}
