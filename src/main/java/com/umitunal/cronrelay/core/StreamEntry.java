package com.umitunal.cronrelay.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entry read from a stream: its id and its flat field set.
 */
public class StreamEntry {
    private final StreamEntryId id;
    private final Map<String, String> fields;

    public StreamEntry(StreamEntryId id, Map<String, String> fields) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public StreamEntryId getId() {
        return id;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public String getField(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return "StreamEntry{id=" + id + ", fields=" + fields.keySet() + "}";
    }
}
