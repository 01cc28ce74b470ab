package com.agentbox.core.metrics;

import com.agentbox.core.events.EventSource;
import com.agentbox.core.model.TurnStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for the sandbox daemon.
 */
@Service
public class DaemonMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeStreams = new AtomicInteger();

    public DaemonMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("agentbox.stream.active", activeStreams, AtomicInteger::get)
                .description("Open event stream connections")
                .register(registry);
    }

    public void recordEventAppended(EventSource source) {
        Counter.builder("agentbox.events.appended")
                .tag("source", source.wireName())
                .register(registry)
                .increment();
    }

    public void recordTurnClosed(TurnStatus status) {
        Counter.builder("agentbox.turns.closed")
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }

    // --- Persistence ---

    /**
     * Records one outbound persistence request, successful or not.
     *
     * @param endpoint "state" or "logs"
     * @param success  whether a 2xx response was received
     */
    public void recordPersistenceAttempt(String endpoint, boolean success) {
        Counter.builder("agentbox.persistence.attempts")
                .description("Outbound persistence HTTP attempts")
                .tag("endpoint", endpoint)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records a persistence write that failed after all retries.
     *
     * @param endpoint "state" or "logs"
     */
    public void recordPersistenceFailure(String endpoint) {
        Counter.builder("agentbox.persistence.failures")
                .description("Persistence writes abandoned after exhausting retries")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void recordPersistenceDuration(long ms) {
        Timer.builder("agentbox.persistence.turn.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    // --- Streaming ---

    public void recordStreamOpened() {
        activeStreams.incrementAndGet();
        Counter.builder("agentbox.stream.connections")
                .register(registry)
                .increment();
    }

    public void recordStreamClosed() {
        activeStreams.decrementAndGet();
    }

    public void recordAgentStartFailure() {
        Counter.builder("agentbox.agent.start_failures")
                .register(registry)
                .increment();
    }
}
