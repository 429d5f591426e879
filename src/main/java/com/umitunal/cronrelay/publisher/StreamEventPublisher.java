package com.umitunal.cronrelay.publisher;

import com.umitunal.cronrelay.core.StreamEntryId;
import com.umitunal.cronrelay.core.StreamStore;
import com.umitunal.cronrelay.exception.CodecException;
import com.umitunal.cronrelay.exception.PublishException;
import com.umitunal.cronrelay.exception.StreamStoreException;
import com.umitunal.cronrelay.model.DomainEvent;
import com.umitunal.cronrelay.serialization.EventRecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Publishes events as flat records through a {@link StreamStore}.
 */
public class StreamEventPublisher implements EventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(StreamEventPublisher.class);

    private final StreamStore store;
    private final EventRecordCodec recordCodec;

    public StreamEventPublisher(StreamStore store) {
        this(store, new EventRecordCodec());
    }

    public StreamEventPublisher(StreamStore store, EventRecordCodec recordCodec) {
        this.store = store;
        this.recordCodec = recordCodec;
    }

    @Override
    public String publish(String streamName, DomainEvent event) throws PublishException {
        Map<String, String> fields;
        try {
            fields = recordCodec.toFields(event);
        } catch (CodecException e) {
            logger.error("Failed to encode event {} for stream {}", event.getEventId(), streamName, e);
            throw new PublishException(streamName, "Event " + event.getEventId() + " could not be encoded", e);
        }

        try {
            StreamEntryId entryId = store.append(streamName, fields);
            logger.info("Event published to stream {}: eventId={}, type={}, entryId={}",
                    streamName, event.getEventId(), event.getEventType(), entryId);
            return entryId.toString();
        } catch (StreamStoreException e) {
            logger.error("Failed to publish event {} to stream {}", event.getEventId(), streamName, e);
            throw new PublishException(streamName,
                    "Failed to publish event " + event.getEventId() + " to " + streamName + ": " + e.getMessage(), e);
        }
    }
}
