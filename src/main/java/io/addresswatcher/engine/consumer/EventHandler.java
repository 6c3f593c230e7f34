package io.addresswatcher.engine.consumer;

import io.addresswatcher.engine.event.ChangeEvent;

/**
 * Business logic invoked for each decoded change event.
 *
 * <p>A failure is logged and the stream moves on to the next record; the failed event is not
 * redelivered.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(ChangeEvent event) throws Exception;
}
