package qrelay.core.utils;

/**
 * Dot-delimited routing key matching.
 * <p>
 * A binding pattern is split into segments. {@code *} matches exactly one segment and
 * {@code #} matches zero or more segments, wherever it appears in the pattern.
 * Everything else must match the routing key segment literally.
 */
public final class RoutingKeys {

    public static final String SINGLE_SEGMENT_WILDCARD = "*";
    public static final String MULTI_SEGMENT_WILDCARD = "#";

    private RoutingKeys() {
    }

    public static boolean topicMatches(String pattern, String routingKey) {
        if (pattern == null || routingKey == null) {
            return false;
        }
        return matchSegments(segments(pattern), 0, segments(routingKey), 0);
    }

    public static String[] segments(String key) {
        return key.split("\\.", -1);
    }

    private static boolean matchSegments(String[] pattern, int p, String[] key, int k) {
        if (p == pattern.length) {
            return k == key.length;
        }

        String segment = pattern[p];

        if (segment.equals(MULTI_SEGMENT_WILDCARD)) {
            // collapse runs of '#'
            if (p + 1 < pattern.length && pattern[p + 1].equals(MULTI_SEGMENT_WILDCARD)) {
                return matchSegments(pattern, p + 1, key, k);
            }
            for (int next = k; next <= key.length; next++) {
                if (matchSegments(pattern, p + 1, key, next)) {
                    return true;
                }
            }
            return false;
        }

        if (k == key.length) {
            return false;
        }

        if (segment.equals(SINGLE_SEGMENT_WILDCARD) || segment.equals(key[k])) {
            return matchSegments(pattern, p + 1, key, k + 1);
        }
        return false;
    }
}
