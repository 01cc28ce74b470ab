package com.agentbox.agent;

import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.events.Subscription;
import com.agentbox.core.metrics.DaemonMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Provider that creates the real one on first use and replaces it whenever the
 * factory's revision changes (new credentials, new working directory).
 *
 * <p>Event handlers registered here survive replacements: each new provider is
 * wired to forward its events to all of them. Creation and replacement run under
 * one lock, so concurrent callers never start two agent processes.
 *
 * <p>Starting is attempted up to {@code maxStartAttempts} times with a fresh
 * provider each time before an {@link AgentStartException} is thrown.
 */
public class LazyAgentSupervisor implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(LazyAgentSupervisor.class);

    private final AgentProviderFactory factory;
    private final int maxStartAttempts;
    private final DaemonMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Consumer<SandboxEvent>> handlers = new CopyOnWriteArrayList<>();

    /** Guarded by {@link #lock}. */
    private AgentProvider provider;
    private long providerRevision = -1;
    private Subscription providerSubscription;
    private boolean started;

    public LazyAgentSupervisor(AgentProviderFactory factory, int maxStartAttempts, DaemonMetrics metrics) {
        this.factory = factory;
        this.maxStartAttempts = Math.max(1, maxStartAttempts);
        this.metrics = metrics;
    }

    @Override
    public void start() {
        lock.lock();
        try {
            started = true;
            ensureProvider();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            started = false;
            discardProvider();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the supervisor if needed, replaces a stale provider, then sends.
     */
    @Override
    public void sendPrompt(PromptRequest request) {
        AgentProvider current;
        lock.lock();
        try {
            started = true;
            current = ensureProvider();
        } finally {
            lock.unlock();
        }
        current.sendPrompt(request);
    }

    @Override
    public void abort(AbortRequest request) {
        AgentProvider current = currentProvider();
        if (current == null) {
            log.debug("Abort requested with no agent running");
            return;
        }
        current.abort(request);
    }

    @Override
    public Optional<AgentState> getState() {
        AgentProvider current = currentProvider();
        return current != null ? current.getState() : Optional.empty();
    }

    @Override
    public Subscription onEvent(Consumer<SandboxEvent> handler) {
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    public boolean isStarted() {
        lock.lock();
        try {
            return started;
        } finally {
            lock.unlock();
        }
    }

    public long providerRevision() {
        lock.lock();
        try {
            return providerRevision;
        } finally {
            lock.unlock();
        }
    }

    private AgentProvider currentProvider() {
        lock.lock();
        try {
            return provider;
        } finally {
            lock.unlock();
        }
    }

    private AgentProvider ensureProvider() {
        long revision = factory.getRevision();
        if (provider != null && providerRevision == revision) {
            return provider;
        }
        if (provider != null) {
            log.info("Agent inputs changed (revision {} -> {}); restarting agent", providerRevision, revision);
        }
        discardProvider();

        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxStartAttempts; attempt++) {
            AgentProvider candidate = factory.create(revision);
            wire(candidate, revision);
            try {
                candidate.start();
                return candidate;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Agent start attempt {}/{} failed: {}", attempt, maxStartAttempts, e.getMessage());
                discardProvider();
            }
        }
        if (metrics != null) {
            metrics.recordAgentStartFailure();
        }
        throw new AgentStartException("Agent failed to start after %d attempts".formatted(maxStartAttempts),
                maxStartAttempts, lastError);
    }

    private void wire(AgentProvider candidate, long revision) {
        provider = candidate;
        providerRevision = revision;
        providerSubscription = candidate.onEvent(this::dispatch);
    }

    private void discardProvider() {
        if (providerSubscription != null) {
            providerSubscription.unsubscribe();
            providerSubscription = null;
        }
        AgentProvider previous = provider;
        provider = null;
        providerRevision = -1;
        if (previous != null) {
            try {
                previous.stop();
            } catch (RuntimeException e) {
                log.warn("Stopping previous agent provider failed: {}", e.getMessage());
            }
        }
    }

    private void dispatch(SandboxEvent event) {
        for (Consumer<SandboxEvent> handler : handlers) {
            try {
                handler.accept(event);
            } catch (Exception e) {
                log.warn("Agent event handler failed for {}: {}", event.type(), e.getMessage(), e);
            }
        }
    }
}
