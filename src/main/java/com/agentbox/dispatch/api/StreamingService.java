package com.agentbox.dispatch.api;

import com.agentbox.core.events.EventLog;
import com.agentbox.core.events.EventRecord;
import com.agentbox.core.events.Subscription;
import com.agentbox.core.metrics.DaemonMetrics;
import com.agentbox.daemon.DaemonProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams the {@link EventLog} to clients as resumable text-event-stream frames.
 * <p>
 * A connection first receives every record after the requested cursor. Following
 * connections then receive live records. Each following connection owns a
 * single-thread sender: it subscribes before replaying and skips records at or
 * below the last delivered cursor, so no record is lost or repeated within one
 * connection. A heartbeat carrying the last delivered cursor is sent when a
 * connection has been silent for a full interval.
 * <p>
 * A failed send ends only that connection.
 */
@Service
public class StreamingService {

    private static final Logger log = LoggerFactory.getLogger(StreamingService.class);

    private static final int HEARTBEAT_CHECKS_PER_INTERVAL = 5;

    private final EventLog eventLog;
    private final Duration heartbeatInterval;
    private final DaemonMetrics metrics;

    private final CopyOnWriteArrayList<Connection> connections = new CopyOnWriteArrayList<>();
    private final AtomicLong connectionIds = new AtomicLong();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "stream-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public StreamingService(EventLog eventLog, DaemonProperties properties,
                            @Autowired(required = false) DaemonMetrics metrics) {
        this(eventLog, Duration.ofSeconds(properties.getStream().getHeartbeatSeconds()), metrics);
    }

    StreamingService(EventLog eventLog, Duration heartbeatInterval, DaemonMetrics metrics) {
        this.eventLog = eventLog;
        this.heartbeatInterval = heartbeatInterval;
        this.metrics = metrics;
    }

    @PostConstruct
    public void startHeartbeat() {
        long checkMs = heartbeatCheckPeriod().toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, checkMs, checkMs, TimeUnit.MILLISECONDS);
        log.info("Stream heartbeat scheduler started (interval={}ms, checked every {}ms)",
                heartbeatInterval.toMillis(), checkMs);
    }

    /**
     * Connections are checked several times per interval, so a heartbeat goes out
     * at most one check period after a connection has been silent for a full interval.
     */
    Duration heartbeatCheckPeriod() {
        return Duration.ofMillis(Math.max(1, heartbeatInterval.toMillis() / HEARTBEAT_CHECKS_PER_INTERVAL));
    }

    @PreDestroy
    public void stop() {
        heartbeatScheduler.shutdownNow();
        for (Connection connection : connections) {
            connection.close(true);
        }
        log.info("Streaming service stopped");
    }

    /**
     * Opens a connection.
     *
     * @param cursor resume point; records with a greater cursor are delivered
     * @param follow keep the connection open for live records
     * @param sink   destination of the frames
     * @return handle used to close the connection when the client goes away
     */
    public StreamConnection open(long cursor, boolean follow, StreamSink sink) {
        long start = Math.max(0, cursor);
        if (!follow) {
            replayAndComplete(start, sink);
            return () -> { };
        }

        var connection = new Connection(connectionIds.incrementAndGet(), start, sink);
        connections.add(connection);
        if (metrics != null) {
            metrics.recordStreamOpened();
        }
        connection.begin();
        log.debug("Stream connection {} opened at cursor {}", connection.id, start);
        return () -> connection.close(false);
    }

    public int activeConnectionCount() {
        return connections.size();
    }

    private void replayAndComplete(long cursor, StreamSink sink) {
        List<EventRecord> records = eventLog.getFromCursor(cursor);
        try {
            for (EventRecord record : records) {
                sink.send(toFrame(record));
            }
        } catch (IOException e) {
            log.debug("Replay from cursor {} aborted: {}", cursor, e.getMessage());
        }
        completeQuietly(sink);
    }

    private void sendHeartbeats() {
        long now = System.nanoTime();
        for (Connection connection : connections) {
            if (now - connection.lastSentNanos >= heartbeatInterval.toNanos()) {
                connection.heartbeat();
            }
        }
    }

    static StreamFrame toFrame(EventRecord record) {
        return new StreamFrame(String.valueOf(record.cursor()), null, record.toEnvelope().toString());
    }

    private static void completeQuietly(StreamSink sink) {
        try {
            sink.complete();
        } catch (RuntimeException e) {
            log.debug("Completing stream failed: {}", e.getMessage());
        }
    }

    /**
     * Closes a streaming connection. Closing twice is harmless.
     */
    @FunctionalInterface
    public interface StreamConnection {
        void close();
    }

    private final class Connection {

        private final long id;
        private final StreamSink sink;
        private final ExecutorService sender;
        private final AtomicBoolean closed = new AtomicBoolean();

        /** Written only by the sender thread. */
        private volatile long lastDelivered;
        private volatile long lastSentNanos = System.nanoTime();
        private volatile Subscription subscription;

        private Connection(long id, long cursor, StreamSink sink) {
            this.id = id;
            this.sink = sink;
            this.lastDelivered = cursor;
            this.sender = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "stream-sender-" + id);
                t.setDaemon(true);
                return t;
            });
        }

        void begin() {
            submit(() -> {
                subscription = eventLog.subscribe(record -> submit(() -> deliver(record)));
                if (closed.get()) {
                    subscription.unsubscribe();
                    return;
                }
                for (EventRecord record : eventLog.getFromCursor(lastDelivered)) {
                    deliver(record);
                }
            });
        }

        void heartbeat() {
            submit(() -> write(StreamFrame.heartbeat(lastDelivered)));
        }

        private void deliver(EventRecord record) {
            if (record.cursor() <= lastDelivered || closed.get()) {
                return;
            }
            if (write(toFrame(record))) {
                lastDelivered = record.cursor();
            }
        }

        private boolean write(StreamFrame frame) {
            if (closed.get()) {
                return false;
            }
            try {
                sink.send(frame);
                lastSentNanos = System.nanoTime();
                return true;
            } catch (IOException | RuntimeException e) {
                log.debug("Stream connection {} send failed: {}", id, e.getMessage());
                close(true);
                return false;
            }
        }

        private void submit(Runnable task) {
            if (closed.get()) {
                return;
            }
            try {
                sender.execute(task);
            } catch (RejectedExecutionException e) {
                log.debug("Stream connection {} already closed", id);
            }
        }

        void close(boolean completeSink) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Subscription current = subscription;
            if (current != null) {
                current.unsubscribe();
            }
            sender.shutdown();
            connections.remove(this);
            if (metrics != null) {
                metrics.recordStreamClosed();
            }
            if (completeSink) {
                completeQuietly(sink);
            }
            log.debug("Stream connection {} closed at cursor {}", id, lastDelivered);
        }
    }
}
