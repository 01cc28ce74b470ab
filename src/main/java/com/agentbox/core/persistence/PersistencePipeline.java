package com.agentbox.core.persistence;

import com.agentbox.core.logging.MdcContext;
import com.agentbox.core.metrics.DaemonMetrics;
import com.agentbox.core.model.ClosedTurn;
import com.agentbox.core.model.PersistedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Writes closed turns to the core API, one at a time, in the order they closed.
 * <p>
 * A single worker thread runs the tasks, so a turn's writes never start before the
 * previous turn's writes have finished. Failures are logged and the next turn is
 * processed; nothing is propagated to the caller.
 * <p>
 * The checkpoint is advanced and saved before the network write. A crash between
 * the two loses the unsent rows, since the next start resumes past them.
 */
public class PersistencePipeline {

    private static final Logger log = LoggerFactory.getLogger(PersistencePipeline.class);

    /** Body of the state endpoint. */
    public record StateBatch(long cursor, List<PersistedMessage> messages) {}

    private final CoreApiClient client;
    private final CheckpointStore checkpoints;
    private final TurnMessageConverter converter;
    private final DaemonMetrics metrics;
    private final ExecutorService worker;

    /** Touched only by the worker thread. */
    private final List<PersistedMessage> pending = new ArrayList<>();

    private volatile PersistenceTarget target;

    public PersistencePipeline(CoreApiClient client, CheckpointStore checkpoints,
                               TurnMessageConverter converter, DaemonMetrics metrics) {
        this.client = client;
        this.checkpoints = checkpoints;
        this.converter = converter;
        this.metrics = metrics;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "persistence-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void configure(PersistenceTarget newTarget) {
        this.target = newTarget;
        log.info("Persistence target set to sandbox {} at {}", newTarget.sandboxId(), newTarget.coreApiUrl());
    }

    public PersistenceTarget target() {
        return target;
    }

    /**
     * Queues a closed turn. Without a configured target the turn is skipped.
     *
     * @return completes when the turn's writes have finished or failed
     */
    public CompletableFuture<Void> enqueue(ClosedTurn closedTurn) {
        PersistenceTarget snapshot = target;
        if (snapshot == null) {
            log.debug("No persistence target; skipping turn {}", closedTurn.index());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> persist(closedTurn, snapshot), worker);
    }

    /**
     * Messages converted but not yet acknowledged by the state endpoint.
     * Call only after the last enqueued future completed.
     */
    public List<PersistedMessage> pendingMessages() {
        return List.copyOf(pending);
    }

    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Persistence worker did not finish within 10s; {} pending messages dropped", pending.size());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    private void persist(ClosedTurn closedTurn, PersistenceTarget persistTarget) {
        int turnIndex = closedTurn.index();
        long started = System.currentTimeMillis();
        MdcContext.setTurn(persistTarget.sandboxId(), turnIndex);
        try {
            var conversion = converter.convert(closedTurn.events(), checkpoints.get(), turnIndex);
            if (!conversion.messages().isEmpty()) {
                pending.addAll(conversion.messages());
                checkpoints.set(conversion.nextCursor());
                checkpoints.save();
            }

            if (!pending.isEmpty()) {
                try {
                    client.postJson(persistTarget.stateUrl(),
                            new StateBatch(checkpoints.get(), List.copyOf(pending)), "state");
                    log.info("Persisted {} messages up to cursor {}", pending.size(), checkpoints.get());
                    pending.clear();
                } catch (PersistenceException e) {
                    log.warn("State persistence failed for turn {}; {} messages kept for the next batch: {}",
                            turnIndex, pending.size(), e.getMessage());
                    return;
                }
            }

            try {
                client.postNdjson(persistTarget.logsUrl(turnIndex), converter.toNdjson(closedTurn.events()), "logs");
                log.debug("Archived {} events for turn {}", closedTurn.events().size(), turnIndex);
            } catch (PersistenceException e) {
                log.warn("Log archive failed for turn {}: {}", turnIndex, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.warn("Persistence of turn {} failed: {}", turnIndex, e.getMessage(), e);
        } finally {
            if (metrics != null) {
                metrics.recordPersistenceDuration(System.currentTimeMillis() - started);
            }
            MdcContext.clear();
        }
    }
}
