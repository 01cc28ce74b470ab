package com.agentbox.dispatch.api;

import com.agentbox.core.model.ProjectionSnapshot;
import com.agentbox.daemon.DaemonProperties;
import com.agentbox.daemon.DaemonService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Event stream and turn projection endpoints.
 */
@RestController
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final StreamingService streamingService;
    private final DaemonService daemonService;
    private final long emitterTimeoutMs;

    public StreamController(StreamingService streamingService, DaemonService daemonService,
                            DaemonProperties properties) {
        this.streamingService = streamingService;
        this.daemonService = daemonService;
        this.emitterTimeoutMs = properties.getStream().getEmitterTimeoutMs();
    }

    /**
     * GET /stream?cursor=N&follow=1: Replays records after {@code cursor}, then
     * optionally keeps streaming live records.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "cursor", required = false) String cursor,
                             @RequestParam(value = "follow", required = false) String follow) {
        long start = parseCursor(cursor);
        boolean keepOpen = parseFollow(follow);
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        var connection = streamingService.open(start, keepOpen, new EmitterStreamSink(emitter));

        emitter.onCompletion(connection::close);
        emitter.onTimeout(connection::close);
        emitter.onError(ex -> {
            log.debug("Stream emitter error: {}", ex.getMessage());
            connection.close();
        });
        return emitter;
    }

    /**
     * GET /turns: Current turn projection.
     */
    @GetMapping("/turns")
    public ResponseEntity<ProjectionSnapshot> turns() {
        return ResponseEntity.ok(daemonService.turns());
    }

    static long parseCursor(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static boolean parseFollow(String raw) {
        return "1".equals(raw) || "true".equalsIgnoreCase(raw);
    }
}
