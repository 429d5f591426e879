package com.umitunal.cronrelay.consumer;

import com.umitunal.cronrelay.model.DomainEvent;

/**
 * Processes events of one type. Handlers may see the same event more than once and
 * should be idempotent.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handle an event. Returning normally acknowledges the entry; throwing leaves it pending.
     *
     * @param event the event
     * @throws Exception if processing fails
     */
    void handle(DomainEvent event) throws Exception;
}
