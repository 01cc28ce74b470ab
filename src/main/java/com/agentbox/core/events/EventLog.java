package com.agentbox.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Append-only, cursor-addressed log of sandbox events with live subscriptions.
 * <p>
 * Cursor assignment, storage and subscriber notification happen under a single
 * append lock, so every subscriber observes records in strict cursor order and a
 * record is fully delivered before the next one is appended. Reads never take the
 * append lock: a subscriber may replay the log from inside its callback.
 * <p>
 * The log lives in process memory only; a daemon restart starts again at cursor 1.
 */
@Component
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final ConcurrentSkipListMap<Long, EventRecord> records = new ConcurrentSkipListMap<>();

    private final CopyOnWriteArrayList<SubscriberEntry> subscribers = new CopyOnWriteArrayList<>();

    private final ReentrantLock appendLock = new ReentrantLock();

    /** Guarded by {@link #appendLock}. */
    private long nextCursor = 1;

    private volatile long lastCursor = 0;

    /**
     * Assigns the next cursor to the event, stores it and notifies every current
     * subscriber before returning.
     *
     * @param event the event to append
     * @return the stored record
     */
    public EventRecord append(SandboxEvent event) {
        appendLock.lock();
        try {
            EventRecord record = new EventRecord(nextCursor++, event);
            records.put(record.cursor(), record);
            lastCursor = record.cursor();
            log.debug("Appended {} event {} at cursor {}", event.source().wireName(), event.type(), record.cursor());
            for (SubscriberEntry subscriber : subscribers) {
                deliverSafely(subscriber, record);
            }
            return record;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Returns all records with {@code cursor > afterCursor}, in append order.
     */
    public List<EventRecord> getFromCursor(long afterCursor) {
        return List.copyOf(records.tailMap(afterCursor, false).values());
    }

    /**
     * Registers a live handler for records appended from now on.
     *
     * @param handler callback invoked synchronously on the appending thread
     * @return a {@link Subscription} handle; unsubscribing twice is harmless
     */
    public Subscription subscribe(Consumer<EventRecord> handler) {
        SubscriberEntry entry = new SubscriberEntry(handler);
        subscribers.add(entry);
        return () -> {
            if (entry.active.compareAndSet(true, false)) {
                subscribers.remove(entry);
            }
        };
    }

    public long lastCursor() {
        return lastCursor;
    }

    public int size() {
        return records.size();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void deliverSafely(SubscriberEntry subscriber, EventRecord record) {
        try {
            subscriber.handler.accept(record);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing cursor {} ({}): {}",
                    record.cursor(), record.event().type(), e.getMessage(), e);
        }
    }

    private static final class SubscriberEntry {
        private final Consumer<EventRecord> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private SubscriberEntry(Consumer<EventRecord> handler) {
            this.handler = handler;
        }
    }
}
