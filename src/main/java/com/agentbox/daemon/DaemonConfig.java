package com.agentbox.daemon;

import com.agentbox.agent.CredentialsStore;
import com.agentbox.agent.LazyAgentSupervisor;
import com.agentbox.agent.ProcessAgentProviderFactory;
import com.agentbox.agent.WorkingDirectoryStore;
import com.agentbox.core.metrics.DaemonMetrics;
import com.agentbox.core.persistence.CheckpointStore;
import com.agentbox.core.persistence.CoreApiClient;
import com.agentbox.core.persistence.FileCheckpointStore;
import com.agentbox.core.persistence.PersistencePipeline;
import com.agentbox.core.persistence.TurnMessageConverter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class DaemonConfig {

    @Bean
    public ProcessAgentProviderFactory agentProviderFactory(DaemonProperties properties,
                                                            CredentialsStore credentials,
                                                            WorkingDirectoryStore workingDirectory,
                                                            ObjectMapper objectMapper) {
        var agent = properties.getAgent();
        Path defaultCwd = agent.getCwd() == null || agent.getCwd().isBlank() ? null : Path.of(agent.getCwd());
        return new ProcessAgentProviderFactory(agent.commandLine(), defaultCwd,
                Duration.ofMillis(agent.getRequestTimeoutMs()), credentials, workingDirectory, objectMapper);
    }

    @Bean(destroyMethod = "stop")
    public LazyAgentSupervisor agentSupervisor(ProcessAgentProviderFactory factory, DaemonProperties properties,
                                               @Autowired(required = false) DaemonMetrics metrics) {
        return new LazyAgentSupervisor(factory, properties.getAgent().getMaxStartAttempts(), metrics);
    }

    @Bean
    public CheckpointStore checkpointStore(DaemonProperties properties, ObjectMapper objectMapper) {
        var persistence = properties.getPersistence();
        Path path = persistence.getCheckpointPath() == null || persistence.getCheckpointPath().isBlank()
                ? FileCheckpointStore.defaultCheckpointPath(persistence.getWorkspaceRoot(), System.getenv("HOME"))
                : Path.of(persistence.getCheckpointPath());
        return new FileCheckpointStore(path, objectMapper);
    }

    @Bean
    public CoreApiClient coreApiClient(DaemonProperties properties, ObjectMapper objectMapper,
                                       @Autowired(required = false) DaemonMetrics metrics) {
        var persistence = properties.getPersistence();
        return new CoreApiClient(objectMapper, persistence.getAttempts(), persistence.getBaseDelayMs(),
                Duration.ofSeconds(persistence.getRequestTimeoutSeconds()), metrics);
    }

    @Bean(destroyMethod = "shutdown")
    public PersistencePipeline persistencePipeline(CoreApiClient client, CheckpointStore checkpointStore,
                                                   ObjectMapper objectMapper,
                                                   @Autowired(required = false) DaemonMetrics metrics) {
        return new PersistencePipeline(client, checkpointStore, new TurnMessageConverter(objectMapper), metrics);
    }
}
