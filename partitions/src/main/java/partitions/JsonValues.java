package partitions;

import partitions.exceptions.PartitionFormatException;

import java.util.Map;

/**
 * Helpers for reading the decoded JSON map form of groups and partitions.
 */
final class JsonValues {

    private JsonValues() {}

    static Map<?, ?> requireMap(Object value, String kind) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new PartitionFormatException(kind + " dict expected but got " + value);
        }
        return map;
    }

    /**
     * Checks the keys in the given order and fails on the first missing one.
     */
    static void requireKeys(Map<?, ?> map, String kind, String... keys) {
        for (String key : keys) {
            if (!map.containsKey(key)) {
                throw missingKey(map, kind, key);
            }
        }
    }

    static PartitionFormatException missingKey(Map<?, ?> map, String kind, String key) {
        return new PartitionFormatException(
                kind + " dict " + map + " missing value key '" + key + "'");
    }

    /**
     * Reads a text field, which may be null but must not be any other type.
     */
    static String stringOrNull(Map<?, ?> map, String kind, String key) {
        Object raw = map.get(key);
        if (raw == null || raw instanceof String) {
            return (String) raw;
        }
        throw new PartitionFormatException(
                kind + " dict " + map + " has non-string value key '" + key + "'");
    }

    /**
     * Numeric comparison, so a version decoded as 1L or 1.0 still matches 1.
     */
    static boolean isVersion(Object raw, int expected) {
        return raw instanceof Number n && n.doubleValue() == expected;
    }
}
