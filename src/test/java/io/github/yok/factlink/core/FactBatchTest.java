package io.github.yok.factlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.factlink.sql.TableRef;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FactBatchTest {

    private static final TableRef FACT = TableRef.of("business", "规模明细");

    @Test
    void of_正常ケース_元のレコードを変更する_バッチ内容が変わらないこと() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("计划代码", "P001");
        record.put("客户名称", null);
        List<Map<String, Object>> records = new ArrayList<>(List.of(record));

        FactBatch batch = FactBatch.of("annuity", FACT, records);
        record.put("计划代码", "CHANGED");
        records.clear();

        assertEquals(1, batch.size());
        assertEquals("P001", batch.getRecords().get(0).get("计划代码"));
        assertTrue(batch.getRecords().get(0).containsKey("客户名称"));
        assertNull(batch.getRecords().get(0).get("客户名称"));
        assertEquals(List.of("计划代码", "客户名称"),
                new ArrayList<>(batch.getRecords().get(0).keySet()));
    }

    @Test
    void of_異常ケース_レコードを変更しようとする_UnsupportedOperationExceptionが送出されること() {
        FactBatch batch = FactBatch.of("annuity", FACT, List.of(new HashMap<>(Map.of("a", 1))));

        assertThrows(UnsupportedOperationException.class,
                () -> batch.getRecords().get(0).put("a", 2));
        assertThrows(UnsupportedOperationException.class, () -> batch.getRecords().clear());
    }

    @Test
    void of_正常ケース_同じレコードで2回生成する_バッチIDが異なること() {
        FactBatch first = FactBatch.of("annuity", FACT, List.of());
        FactBatch second = FactBatch.of("annuity", FACT, List.of());

        assertNotEquals(first.getBatchId(), second.getBatchId());
        assertTrue(first.isEmpty());
        assertEquals(FACT, first.getFactTable());
        assertEquals("annuity", first.getDomain());
    }

    @Test
    void of_異常ケース_nullレコード_NullPointerExceptionが送出されること() {
        List<Map<String, Object>> records = new ArrayList<>();
        records.add(null);
        assertThrows(NullPointerException.class, () -> FactBatch.of("annuity", FACT, records));
        assertThrows(NullPointerException.class, () -> FactBatch.of("annuity", null, List.of()));
    }
}
