package com.actiongate.rules;

import java.util.Map;

/**
 * Resolves dotted paths such as {@code ctx.amount} against nested maps.
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * @return the value at {@code path}, or null when any segment is missing or an
     *         intermediate value is not a map
     */
    public static Object resolve(Map<String, ?> context, String path) {
        if (context == null || path == null || path.isEmpty()) {
            return null;
        }
        Object current = context;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map) || segment.isEmpty()) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }
}
