package com.agentbox.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Working directory the agent runs in. The revision changes only when the directory does.
 */
@Component
public class WorkingDirectoryStore {

    private static final Logger log = LoggerFactory.getLogger(WorkingDirectoryStore.class);

    private Path current;
    private long revision;

    public synchronized boolean update(Path directory) {
        Path normalized = directory != null ? directory.toAbsolutePath().normalize() : null;
        if (Objects.equals(current, normalized)) {
            return false;
        }
        current = normalized;
        revision++;
        log.info("Agent working directory set to {} (revision {})", normalized, revision);
        return true;
    }

    public synchronized Path current() {
        return current;
    }

    public synchronized long revision() {
        return revision;
    }
}
