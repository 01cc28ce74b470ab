package com.agentbox.daemon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentbox")
public class DaemonProperties {

    private Agent agent = new Agent();
    private Stream stream = new Stream();
    private Persistence persistence = new Persistence();

    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public static class Agent {
        private String command = "pi";
        private String args = "--mode rpc --no-session";
        private String cwd = "";
        private long requestTimeoutMs = 5000;
        private int maxStartAttempts = 3;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getArgs() { return args; }
        public void setArgs(String args) { this.args = args; }
        public String getCwd() { return cwd; }
        public void setCwd(String cwd) { this.cwd = cwd; }
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
        public int getMaxStartAttempts() { return maxStartAttempts; }
        public void setMaxStartAttempts(int maxStartAttempts) { this.maxStartAttempts = maxStartAttempts; }

        /**
         * Command plus arguments. {@code args} may be a JSON array
         * ({@code ["--mode","rpc"]}) or a whitespace-separated string.
         */
        public List<String> commandLine() {
            List<String> line = new ArrayList<>();
            line.add(command);
            line.addAll(parseArgs(args));
            return line;
        }

        static List<String> parseArgs(String raw) {
            if (raw == null || raw.isBlank()) {
                return List.of();
            }
            String trimmed = raw.trim();
            if (trimmed.startsWith("[")) {
                try {
                    JsonNode array = new ObjectMapper().readTree(trimmed);
                    List<String> parsed = new ArrayList<>();
                    array.forEach(item -> parsed.add(item.asText()));
                    return parsed;
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Invalid agent args JSON: " + trimmed, e);
                }
            }
            return Arrays.asList(trimmed.split("\\s+"));
        }
    }

    public static class Stream {
        private int heartbeatSeconds = 15;
        private long emitterTimeoutMs = 30 * 60 * 1000L;

        public int getHeartbeatSeconds() { return heartbeatSeconds; }
        public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
        public long getEmitterTimeoutMs() { return emitterTimeoutMs; }
        public void setEmitterTimeoutMs(long emitterTimeoutMs) { this.emitterTimeoutMs = emitterTimeoutMs; }
    }

    public static class Persistence {
        private String sandboxId = "";
        private String coreApiUrl = "";
        private String checkpointPath = "";
        private String workspaceRoot = "/root";
        private int attempts = 3;
        private long baseDelayMs = 250;
        private int requestTimeoutSeconds = 30;

        public String getSandboxId() { return sandboxId; }
        public void setSandboxId(String sandboxId) { this.sandboxId = sandboxId; }
        public String getCoreApiUrl() { return coreApiUrl; }
        public void setCoreApiUrl(String coreApiUrl) { this.coreApiUrl = coreApiUrl; }
        public String getCheckpointPath() { return checkpointPath; }
        public void setCheckpointPath(String checkpointPath) { this.checkpointPath = checkpointPath; }
        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

        public boolean hasTarget() {
            return sandboxId != null && !sandboxId.isBlank() && coreApiUrl != null && !coreApiUrl.isBlank();
        }
    }
}
