package com.branchwork.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory event bus for coordinator and registry events.
 * <p>
 * Subscribers pick a topic: one sub-task of an epic, a whole epic, or everything. An event is
 * delivered to the most specific topic first, then to its epic, then to global subscribers, all on
 * the publishing thread. Agent-level events carry no epic and only reach global subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final Topic ALL = new Topic(null, null);

    private final ConcurrentHashMap<Topic, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> topics =
            new ConcurrentHashMap<>();

    /**
     * Delivers {@code event} to every matching subscriber. A subscriber that throws is logged and
     * skipped; the publisher never sees the exception.
     */
    public void publish(OrchestrationEvent event) {
        log.debug("Publishing {} for epic {} sub-task {}", event.eventType(), event.epicId(), event.subTaskId());
        if (event.epicId() != null) {
            if (event.subTaskId() != null) {
                deliver(new Topic(event.epicId(), event.subTaskId()), event);
            }
            deliver(new Topic(event.epicId(), null), event);
        }
        deliver(ALL, event);
    }

    /**
     * Events of one epic, including those of all its sub-tasks.
     */
    public Subscription subscribe(String epicId, Consumer<OrchestrationEvent> consumer) {
        return register(new Topic(Objects.requireNonNull(epicId, "epicId"), null), consumer);
    }

    /**
     * Events of a single sub-task: assignment, start, completion and failure.
     */
    public Subscription subscribeSubTask(String epicId, String subTaskId, Consumer<OrchestrationEvent> consumer) {
        return register(new Topic(Objects.requireNonNull(epicId, "epicId"),
                Objects.requireNonNull(subTaskId, "subTaskId")), consumer);
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        return register(ALL, consumer);
    }

    int topicCount() {
        return topics.size();
    }

    private Subscription register(Topic topic, Consumer<OrchestrationEvent> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        topics.compute(topic, (key, subscribers) -> {
            var list = subscribers != null ? subscribers : new CopyOnWriteArrayList<Consumer<OrchestrationEvent>>();
            list.add(consumer);
            return list;
        });
        log.debug("Subscribed to {}", topic);
        // empty topics are dropped so finished epics do not accumulate
        return () -> topics.computeIfPresent(topic, (key, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    private void deliver(Topic topic, OrchestrationEvent event) {
        List<Consumer<OrchestrationEvent>> subscribers = topics.get(topic);
        if (subscribers == null) {
            return;
        }
        for (Consumer<OrchestrationEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber of {} failed on {}: {}", topic, event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Handle returned by every subscribe method. Closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private record Topic(String epicId, String subTaskId) {

        @Override
        public String toString() {
            if (epicId == null) {
                return "all events";
            }
            return subTaskId == null ? "epic " + epicId : "sub-task " + subTaskId + " of epic " + epicId;
        }
    }
}
