package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Provenance columns stamped on auto-derived reference rows.
 *
 * <p>
 * They are written only when the reference table has them, and only on insert: backfill never
 * rewrites the provenance of an existing row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TrackingFields {

    public static final String SOURCE = "_source";
    public static final String NEEDS_REVIEW = "_needs_review";
    public static final String DERIVED_FROM_DOMAIN = "_derived_from_domain";
    public static final String DERIVED_AT = "_derived_at";

    public static final String AUTO_DERIVED = "auto_derived";

    public static final Set<String> NAMES =
            ImmutableSet.of(SOURCE, NEEDS_REVIEW, DERIVED_FROM_DOMAIN, DERIVED_AT);

    /**
     * Prevents instantiation.
     */
    private TrackingFields() {
        throw new AssertionError("TrackingFields must not be instantiated.");
    }

    /**
     * Returns the tracking values for the columns the table has.
     *
     * @param domain domain the rows were derived from
     * @param clock clock for {@code _derived_at}
     * @param allowedColumns columns of the reference table
     * @return tracking column values, possibly empty
     */
    static Map<String, Object> values(String domain, Clock clock, Set<String> allowedColumns) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put(SOURCE, AUTO_DERIVED);
        all.put(NEEDS_REVIEW, Boolean.TRUE);
        all.put(DERIVED_FROM_DOMAIN, domain);
        all.put(DERIVED_AT, OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
        all.keySet().retainAll(allowedColumns);
        return all;
    }
}
