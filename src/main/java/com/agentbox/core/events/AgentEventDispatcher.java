package com.agentbox.core.events;

import com.agentbox.core.metrics.DaemonMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single writer of the {@link EventLog}.
 * <p>
 * Agent events arrive on the subprocess reader thread and daemon events on HTTP
 * request threads; both are queued here and appended by one dispatcher thread, so
 * appends and the synchronous projection they trigger never interleave.
 */
@Component
public class AgentEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentEventDispatcher.class);

    private final EventLog eventLog;
    private final DaemonMetrics metrics;
    private final BlockingQueue<SandboxEvent> queue = new LinkedBlockingQueue<>();

    private Thread worker;

    public AgentEventDispatcher(EventLog eventLog, @Autowired(required = false) DaemonMetrics metrics) {
        this.eventLog = eventLog;
        this.metrics = metrics;
    }

    @PostConstruct
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        worker = new Thread(this::runLoop, "event-dispatcher");
        worker.setDaemon(true);
        worker.start();
        log.info("Event dispatcher started");
    }

    /**
     * Queues an event for appending. Never blocks the caller.
     */
    public void submit(SandboxEvent event) {
        queue.add(event);
    }

    @PreDestroy
    public synchronized void stop() {
        Thread current = worker;
        worker = null;
        if (current != null) {
            current.interrupt();
            try {
                current.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        drainQueued();
        log.info("Event dispatcher stopped");
    }

    public int pendingCount() {
        return queue.size();
    }

    private void runLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            SandboxEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                append(event);
            } catch (RuntimeException e) {
                log.error("Failed to append {} event {}", event.source().wireName(), event.type(), e);
            }
        }
    }

    private void drainQueued() {
        List<SandboxEvent> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        remaining.forEach(this::append);
    }

    private EventRecord append(SandboxEvent event) {
        EventRecord record = eventLog.append(event);
        if (metrics != null) {
            metrics.recordEventAppended(event.source());
        }
        return record;
    }
}
