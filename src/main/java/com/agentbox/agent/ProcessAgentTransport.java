package com.agentbox.agent;

import com.agentbox.core.events.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs the agent as a child process and speaks newline-delimited JSON over its stdio.
 *
 * <p>stdout is read on a dedicated daemon thread. Each trimmed, non-blank line is
 * parsed; lines that are not JSON objects are dropped. {@code response} lines
 * settle the pending request with the same id and every other line is handed to
 * the registered line handlers. stderr is inherited by the daemon.
 *
 * <p>An instance starts at most once. After {@link #stop()} it cannot be restarted.
 */
public class ProcessAgentTransport implements AgentTransport {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentTransport.class);

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    /**
     * A correlated request waiting for its response line.
     *
     * @param id            the {@code id} written with the command
     * @param future        settled exactly once
     * @param timeoutHandle cancelled when the response arrives
     */
    record PendingRequest(String id, CompletableFuture<JsonNode> future, ScheduledFuture<?> timeoutHandle) {}

    private final List<String> command;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    private final List<Consumer<ObjectNode>> handlers = new CopyOnWriteArrayList<>();
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestCounter = new AtomicLong();
    private final Object writeLock = new Object();
    private final ScheduledExecutorService timeouts;

    private volatile Process process;
    private volatile BufferedWriter stdin;
    private volatile boolean started;
    private volatile boolean stopped;

    public ProcessAgentTransport(List<String> command, Path workingDirectory, Map<String, String> environment,
                                 Duration requestTimeout, ObjectMapper objectMapper) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Agent command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.objectMapper = objectMapper;
        this.timeouts = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "agent-request-timeouts");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void start() {
        if (started) {
            return;
        }
        if (stopped) {
            throw new AgentTransportException("transport already stopped");
        }
        var builder = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().putAll(environment);

        try {
            process = builder.start();
        } catch (IOException e) {
            throw new AgentTransportException("Failed to start agent process: " + String.join(" ", command), e);
        }
        stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        started = true;

        Thread reader = new Thread(this::readLoop, "agent-stdout-reader");
        reader.setDaemon(true);
        reader.start();
        log.info("Started agent process {} (pid {})", command.get(0), process.pid());
    }

    @Override
    public void send(ObjectNode commandLine) {
        BufferedWriter writer = stdin;
        if (!started || stopped || writer == null) {
            throw new AgentTransportException("transport not started");
        }
        String line;
        try {
            line = objectMapper.writeValueAsString(commandLine);
        } catch (JsonProcessingException e) {
            throw new AgentTransportException("Failed to serialize command", e);
        }
        synchronized (writeLock) {
            try {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new AgentTransportException("Failed to write to agent stdin", e);
            }
        }
    }

    @Override
    public CompletableFuture<JsonNode> sendCommand(ObjectNode commandLine) {
        if (stopped) {
            return CompletableFuture.failedFuture(new AgentTransportException("transport stopped"));
        }
        String id = "req-" + requestCounter.incrementAndGet();
        ObjectNode withId = commandLine.deepCopy();
        withId.put("id", id);

        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        ScheduledFuture<?> timeoutHandle = timeouts.schedule(() -> {
            PendingRequest expired = pending.remove(id);
            if (expired != null) {
                expired.future().completeExceptionally(new AgentTransportException(
                        "request %s timed out after %d ms".formatted(id, requestTimeout.toMillis())));
            }
        }, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        pending.put(id, new PendingRequest(id, future, timeoutHandle));

        try {
            send(withId);
        } catch (AgentTransportException e) {
            PendingRequest failed = pending.remove(id);
            if (failed != null) {
                failed.timeoutHandle().cancel(false);
            }
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public Subscription onLine(Consumer<ObjectNode> handler) {
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;

        BufferedWriter writer = stdin;
        stdin = null;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("Closing agent stdin failed: {}", e.getMessage());
            }
        }
        Process current = process;
        if (current != null) {
            try {
                current.destroy();
            } catch (RuntimeException e) {
                log.debug("Terminating agent process failed: {}", e.getMessage());
            }
        }

        List<PendingRequest> outstanding = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingRequest request : outstanding) {
            request.timeoutHandle().cancel(false);
            request.future().completeExceptionally(new AgentTransportException("transport stopped"));
        }
        handlers.clear();
        timeouts.shutdownNow();
        log.info("Stopped agent transport ({} pending requests rejected)", outstanding.size());
    }

    @Override
    public boolean isRunning() {
        Process current = process;
        return started && !stopped && current != null && current.isAlive();
    }

    int pendingCount() {
        return pending.size();
    }

    private void readLoop() {
        Process current = process;
        try (var reader = new BufferedReader(new InputStreamReader(current.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            if (!stopped) {
                log.warn("Reading agent stdout failed: {}", e.getMessage());
            }
        }
        try {
            int exitCode = current.waitFor();
            log.info("Agent process exited with code {}", exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void handleLine(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return;
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Dropping unparseable agent line: {}", e.getOriginalMessage());
            return;
        }
        if (!(parsed instanceof ObjectNode object)) {
            log.debug("Dropping non-object agent line");
            return;
        }

        JsonNode type = object.get("type");
        if (type != null && "response".equals(type.asText())) {
            handleResponse(object);
            return;
        }
        if (type == null || !type.isTextual()) {
            object.put("type", "unknown");
        }
        for (Consumer<ObjectNode> handler : handlers) {
            try {
                handler.accept(object);
            } catch (Exception e) {
                log.warn("Agent line handler failed: {}", e.getMessage(), e);
            }
        }
    }

    private void handleResponse(ObjectNode response) {
        JsonNode id = response.get("id");
        if (id == null || !id.isTextual()) {
            return;
        }
        PendingRequest request = pending.remove(id.asText());
        if (request == null) {
            log.debug("Ignoring response for unknown request {}", id.asText());
            return;
        }
        request.timeoutHandle().cancel(false);
        if (response.path("success").asBoolean(false)) {
            JsonNode data = response.get("data");
            request.future().complete(data != null ? data : NullNode.getInstance());
        } else {
            String error = response.path("error").asText("request failed");
            request.future().completeExceptionally(new AgentTransportException(error));
        }
    }
}
