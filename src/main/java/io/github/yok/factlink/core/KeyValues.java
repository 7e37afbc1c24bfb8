package io.github.yok.factlink.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical form of key tuples, used to group derived candidates and to match them against keys
 * read back from the database.
 *
 * <p>
 * The driver may return a different Java type than the caller supplied (for example
 * {@code BigDecimal} for a {@code Long} key), so tuples are compared by canonical text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class KeyValues {

    /**
     * Prevents instantiation.
     */
    private KeyValues() {
        throw new AssertionError("KeyValues must not be instantiated.");
    }

    /**
     * Returns the canonical text of a key tuple.
     *
     * @param key key values
     * @return canonical form
     */
    static List<String> canonical(List<?> key) {
        return key.stream().map(KeyValues::canonical).collect(Collectors.toList());
    }

    private static String canonical(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return new BigDecimal(value.toString()).toPlainString();
        }
        return value.toString().trim();
    }
}
