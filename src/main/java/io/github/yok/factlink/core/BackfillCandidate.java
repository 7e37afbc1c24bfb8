package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * One distinct reference row derived from the fact batch.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class BackfillCandidate {

    // Key values in target-key-columns order, never null
    private final List<Object> key;
    // Target column -> value, key columns first; derived values may be null
    private final Map<String, Object> values;

    BackfillCandidate(List<Object> key, Map<String, Object> values) {
        this.key = ImmutableList.copyOf(key);
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
