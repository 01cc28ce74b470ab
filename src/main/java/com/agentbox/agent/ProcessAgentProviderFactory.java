package com.agentbox.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Builds subprocess-backed providers from the current credentials and working directory.
 * The revision combines both, so a change to either yields a new agent process.
 */
public class ProcessAgentProviderFactory implements AgentProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentProviderFactory.class);

    static final long CREDENTIALS_REVISION_WEIGHT = 1_000_000L;

    private final List<String> command;
    private final Path defaultWorkingDirectory;
    private final Duration requestTimeout;
    private final CredentialsStore credentials;
    private final WorkingDirectoryStore workingDirectory;
    private final ObjectMapper objectMapper;

    public ProcessAgentProviderFactory(List<String> command, Path defaultWorkingDirectory, Duration requestTimeout,
                                       CredentialsStore credentials, WorkingDirectoryStore workingDirectory,
                                       ObjectMapper objectMapper) {
        this.command = List.copyOf(command);
        this.defaultWorkingDirectory = defaultWorkingDirectory;
        this.requestTimeout = requestTimeout;
        this.credentials = credentials;
        this.workingDirectory = workingDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentProvider create(long revision) {
        Path cwd = workingDirectory.current() != null ? workingDirectory.current() : defaultWorkingDirectory;
        log.info("Creating agent provider (revision {}, cwd {})", revision, cwd);
        var transport = new ProcessAgentTransport(command, cwd, credentials.environment(), requestTimeout,
                objectMapper);
        return new RpcAgentProvider(transport, objectMapper);
    }

    @Override
    public long getRevision() {
        return credentials.revision() * CREDENTIALS_REVISION_WEIGHT + workingDirectory.revision();
    }
}
