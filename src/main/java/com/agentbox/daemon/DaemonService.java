package com.agentbox.daemon;

import com.agentbox.agent.AbortRequest;
import com.agentbox.agent.AgentStartException;
import com.agentbox.agent.AgentState;
import com.agentbox.agent.CredentialsPayload;
import com.agentbox.agent.CredentialsStore;
import com.agentbox.agent.LazyAgentSupervisor;
import com.agentbox.agent.PromptRequest;
import com.agentbox.agent.WorkingDirectoryStore;
import com.agentbox.core.events.AgentEventDispatcher;
import com.agentbox.core.events.EventLog;
import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.events.Subscription;
import com.agentbox.core.logging.MdcContext;
import com.agentbox.core.model.ProjectionSnapshot;
import com.agentbox.core.persistence.PersistencePipeline;
import com.agentbox.core.persistence.PersistenceTarget;
import com.agentbox.core.projection.TurnProjectionEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control operations of the sandbox daemon.
 * <p>
 * Wires the pipeline on startup: agent events go to the dispatcher, the event log
 * feeds the projection and closed turns go to persistence. Every operation records
 * its outcome as a daemon event so stream clients see it in order with agent output.
 */
@Service
public class DaemonService {

    private static final Logger log = LoggerFactory.getLogger(DaemonService.class);

    public static final String SANDBOX_READY = "sandbox_ready";
    public static final String INIT_COMPLETE = "init_complete";
    public static final String PROMPT_QUEUED = "prompt_queued";
    public static final String PROMPT_SEND_FAILED = "prompt_send_failed";
    public static final String DAEMON_ERROR = "daemon_error";

    private final LazyAgentSupervisor supervisor;
    private final AgentEventDispatcher dispatcher;
    private final EventLog eventLog;
    private final TurnProjectionEngine projection;
    private final PersistencePipeline pipeline;
    private final CredentialsStore credentials;
    private final WorkingDirectoryStore workingDirectory;
    private final DaemonProperties properties;
    private final Clock clock;

    private final List<Subscription> subscriptions = new ArrayList<>();

    @Autowired
    public DaemonService(LazyAgentSupervisor supervisor, AgentEventDispatcher dispatcher, EventLog eventLog,
                         TurnProjectionEngine projection, PersistencePipeline pipeline,
                         CredentialsStore credentials, WorkingDirectoryStore workingDirectory,
                         DaemonProperties properties) {
        this(supervisor, dispatcher, eventLog, projection, pipeline, credentials, workingDirectory, properties,
                Clock.systemUTC());
    }

    DaemonService(LazyAgentSupervisor supervisor, AgentEventDispatcher dispatcher, EventLog eventLog,
                  TurnProjectionEngine projection, PersistencePipeline pipeline,
                  CredentialsStore credentials, WorkingDirectoryStore workingDirectory,
                  DaemonProperties properties, Clock clock) {
        this.supervisor = supervisor;
        this.dispatcher = dispatcher;
        this.eventLog = eventLog;
        this.projection = projection;
        this.pipeline = pipeline;
        this.credentials = credentials;
        this.workingDirectory = workingDirectory;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void wire() {
        subscriptions.add(supervisor.onEvent(dispatcher::submit));
        subscriptions.add(eventLog.subscribe(projection::apply));
        projection.addTurnClosedListener(pipeline::enqueue);

        var persistence = properties.getPersistence();
        if (persistence.hasTarget()) {
            configureTarget(persistence.getSandboxId(), persistence.getCoreApiUrl());
        }
        log.info("Daemon pipeline wired");
    }

    @PreDestroy
    public void unwire() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
    }

    public void updateCredentials(CredentialsPayload payload) {
        if (payload == null) {
            record(DAEMON_ERROR, Map.of("error", "credentials_error", "detail", "missing credentials payload"));
            throw new DaemonException("credentials_error", 400, "missing credentials payload");
        }
        try {
            long revision = credentials.update(payload);
            record(SANDBOX_READY, Map.of("revision", revision));
        } catch (RuntimeException e) {
            log.warn("Applying credentials failed: {}", e.getMessage());
            record(DAEMON_ERROR, Map.of("error", "credentials_error", "detail", describe(e)));
            throw new DaemonException("credentials_error", 500, "failed to apply credentials", e);
        }
    }

    public void init(InitRequest request) {
        if (request == null) {
            throw new DaemonException("invalid_request", 400, "missing init payload");
        }
        if (request.sandboxId() != null && request.coreApiUrl() != null) {
            configureTarget(request.sandboxId(), request.coreApiUrl());
        }
        if (request.workspace() != null && !request.workspace().isBlank()) {
            workingDirectory.update(Path.of(request.workspace()));
        }

        PromptRequest queued = null;
        if (request.prompt() != null && request.prompt().message() != null && !request.prompt().message().isBlank()) {
            var prompt = request.prompt();
            String behavior = prompt.streamingBehavior() != null ? prompt.streamingBehavior() : PromptRequest.FOLLOW_UP;
            queued = new PromptRequest(prompt.message(), prompt.images(), behavior);
            record(PROMPT_QUEUED, promptFields(queued));
        }
        record(INIT_COMPLETE, Map.of());

        if (queued != null) {
            try {
                supervisor.sendPrompt(queued);
            } catch (RuntimeException e) {
                log.warn("Sending initial prompt failed: {}", e.getMessage());
                record(PROMPT_SEND_FAILED, Map.of("error", describe(e)));
            }
        }
    }

    public void prompt(PromptRequest request) {
        if (request == null || !request.isValid()) {
            throw new DaemonException("invalid_request", 400, "prompt requires a message and a valid streamingBehavior");
        }
        try {
            supervisor.sendPrompt(request);
        } catch (AgentStartException e) {
            log.error("Agent failed to start after {} attempts", e.getAttempts(), e);
            record(DAEMON_ERROR, Map.of("error", "provider_start_failed", "detail", describe(e)));
            throw new DaemonException("provider_start_failed", 503, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("Sending prompt failed: {}", e.getMessage());
            record(DAEMON_ERROR, Map.of("error", "provider_error", "detail", describe(e)));
            throw new DaemonException("provider_error", 500, "failed to send prompt", e);
        }
        record(PROMPT_QUEUED, promptFields(request));
    }

    public void abort(AbortRequest request) {
        try {
            supervisor.abort(request != null ? request : new AbortRequest(null));
        } catch (RuntimeException e) {
            log.warn("Abort failed: {}", e.getMessage());
            record(DAEMON_ERROR, Map.of("error", "abort_failed", "detail", describe(e)));
            throw new DaemonException("abort_failed", 500, "failed to abort", e);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        if (request != null && request.reason() != null) {
            fields.put("reason", request.reason());
        }
        record(TurnProjectionEngine.TURN_INTERRUPTED, fields);
    }

    public void shutdown() {
        record(TurnProjectionEngine.SANDBOX_TERMINATED, Map.of());
        supervisor.stop();
        log.info("Sandbox shutdown requested; agent stopped");
    }

    public Optional<AgentState> agentState() {
        return supervisor.getState();
    }

    public ProjectionSnapshot turns() {
        return projection.snapshot();
    }

    private void configureTarget(String sandboxId, String coreApiUrl) {
        MdcContext.setSandbox(sandboxId);
        try {
            pipeline.configure(new PersistenceTarget(sandboxId, coreApiUrl));
            log.info("Persisting turns to {}", coreApiUrl);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid persistence target: {}", e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void record(String type, Map<String, ?> fields) {
        dispatcher.submit(SandboxEvent.daemon(type, clock.millis(), fields));
    }

    private static Map<String, Object> promptFields(PromptRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", request.message());
        if (request.streamingBehavior() != null) {
            fields.put("streamingBehavior", request.streamingBehavior());
        }
        return fields;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
