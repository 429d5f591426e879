package com.umitunal.cronrelay.publisher;

import com.umitunal.cronrelay.exception.PublishException;
import com.umitunal.cronrelay.model.DomainEvent;

/**
 * Appends domain events to named streams. Implementations must be safe to call
 * concurrently.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Publish an event.
     *
     * @param streamName stream to append to
     * @param event the event
     * @return id the store assigned to the entry
     * @throws PublishException if the store is unreachable or rejects the append
     */
    String publish(String streamName, DomainEvent event) throws PublishException;
}
