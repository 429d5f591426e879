package com.umitunal.cronrelay.serialization;

import com.umitunal.cronrelay.exception.CodecException;
import com.umitunal.cronrelay.model.DomainEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a {@link DomainEvent} to and from the flat record appended to a stream.
 *
 * Every field is a string: {@code eventId}, {@code type}, {@code source},
 * {@code timestamp} (decimal epoch millis) and {@code data} (a JSON document).
 */
public class EventRecordCodec {
    public static final String EVENT_ID = "eventId";
    public static final String TYPE = "type";
    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATA = "data";

    private final JsonCodec<Map<String, Object>> documentCodec;

    public EventRecordCodec() {
        this(JsonCodec.forDocument());
    }

    public EventRecordCodec(JsonCodec<Map<String, Object>> documentCodec) {
        this.documentCodec = documentCodec;
    }

    public Map<String, String> toFields(DomainEvent event) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(EVENT_ID, event.getEventId());
        fields.put(TYPE, event.getEventType());
        fields.put(SOURCE, event.getSource());
        fields.put(TIMESTAMP, Long.toString(event.getTimestamp()));
        fields.put(DATA, documentCodec.encodeToString(event.getData()));
        return fields;
    }

    /**
     * @throws CodecException if a required field is missing or malformed
     */
    public DomainEvent fromFields(Map<String, String> fields) {
        String eventId = required(fields, EVENT_ID);
        String type = required(fields, TYPE);
        String timestamp = required(fields, TIMESTAMP);

        long millis;
        try {
            millis = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            throw new CodecException("Invalid event timestamp: " + timestamp, e);
        }

        String data = fields.get(DATA);
        Map<String, Object> document = data == null || data.isEmpty()
                ? Map.of()
                : documentCodec.decodeFromString(data);

        return new DomainEvent(eventId, type, fields.get(SOURCE), millis, document);
    }

    private static String required(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (value == null) {
            throw new CodecException("Stream entry is missing field '" + name + "'", null);
        }
        return value;
    }
}
