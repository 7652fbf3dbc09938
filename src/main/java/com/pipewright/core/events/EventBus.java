package com.pipewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for run events. Safe for concurrent publish from task threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());
        for (Consumer<PipelineEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber threw exception processing event {}: {}",
                        event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<PipelineEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
