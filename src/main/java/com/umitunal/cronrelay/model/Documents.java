package com.umitunal.cronrelay.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, read-only copies of JSON-like documents (maps, lists and scalar values).
 */
final class Documents {

    private Documents() {
    }

    /**
     * Copy {@code document} so that later changes to any nested map or collection of the
     * source are not visible in the copy. Scalars are shared. A null document becomes empty.
     */
    static Map<String, Object> immutableCopy(Map<String, Object> document) {
        if (document == null) {
            return Collections.emptyMap();
        }
        return copyMap(document);
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static List<Object> copyCollection(Collection<?> source) {
        List<Object> copy = new ArrayList<>(source.size());
        for (Object value : source) {
            copy.add(copyValue(value));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            return copyCollection((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return copyCollection(Arrays.asList((Object[]) value));
        }
        return value;
    }
}
