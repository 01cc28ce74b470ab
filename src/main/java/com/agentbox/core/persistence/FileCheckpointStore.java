package com.agentbox.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Stores the checkpoint as {@code {"cursor":n,"updatedAt":ms}} in a JSON file.
 * <p>
 * The file is read once on construction; a missing or unreadable file starts at 0.
 * Save failures are logged and never thrown.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private volatile long cursor;

    public FileCheckpointStore(Path path, ObjectMapper objectMapper) {
        this(path, objectMapper, Clock.systemUTC());
    }

    FileCheckpointStore(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cursor = load();
    }

    /**
     * Default location: {@code /root/.agentbox/cursor.json} for a workspace under
     * {@code /root}, otherwise {@code $HOME/.agentbox/cursor.json}, falling back to
     * the workspace itself when {@code HOME} is unset.
     */
    public static Path defaultCheckpointPath(String workspaceRoot, String home) {
        if ("/root".equals(workspaceRoot) || workspaceRoot.startsWith("/root/")) {
            return Path.of("/root", ".agentbox", "cursor.json");
        }
        if (home != null && !home.isBlank()) {
            return Path.of(home.trim(), ".agentbox", "cursor.json");
        }
        return Path.of(workspaceRoot, ".agentbox", "cursor.json");
    }

    @Override
    public long get() {
        return cursor;
    }

    @Override
    public void set(long next) {
        cursor = Math.max(0, next);
    }

    @Override
    public void save() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectNode json = objectMapper.createObjectNode();
            json.put("cursor", cursor);
            json.put("updatedAt", clock.millis());
            Files.writeString(path, objectMapper.writeValueAsString(json));
            log.debug("Saved checkpoint cursor {} to {}", cursor, path);
        } catch (IOException e) {
            log.warn("Failed to save checkpoint to {}: {}", path, e.getMessage());
        }
    }

    public Path path() {
        return path;
    }

    private long load() {
        try {
            JsonNode json = objectMapper.readTree(Files.readString(path));
            if (json == null || !json.isObject()) {
                return 0;
            }
            JsonNode value = json.get("cursor");
            if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
                return 0;
            }
            long loaded = Math.max(0, value.asLong());
            log.info("Loaded checkpoint cursor {} from {}", loaded, path);
            return loaded;
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return 0;
        }
    }
}
