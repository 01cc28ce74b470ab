package com.agentbox.dispatch.api;

import com.agentbox.agent.AbortRequest;
import com.agentbox.agent.CredentialsPayload;
import com.agentbox.agent.PromptRequest;
import com.agentbox.daemon.DaemonException;
import com.agentbox.daemon.DaemonService;
import com.agentbox.daemon.InitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for sandbox control operations.
 */
@RestController
public class DaemonController {

    private static final Logger log = LoggerFactory.getLogger(DaemonController.class);

    private final DaemonService daemonService;

    public DaemonController(DaemonService daemonService) {
        this.daemonService = daemonService;
    }

    /**
     * GET /health: Liveness check.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ok();
    }

    /**
     * POST /credentials: Replace the agent credentials. The agent restarts on next use.
     */
    @PostMapping("/credentials")
    public ResponseEntity<Map<String, Object>> credentials(@RequestBody(required = false) CredentialsPayload payload) {
        daemonService.updateCredentials(payload);
        return ok();
    }

    /**
     * POST /init: Configure persistence and workspace, optionally sending a first prompt.
     */
    @PostMapping("/init")
    public ResponseEntity<Map<String, Object>> init(@RequestBody(required = false) InitRequest request) {
        daemonService.init(request);
        return ok();
    }

    @PostMapping("/prompt")
    public ResponseEntity<Map<String, Object>> prompt(@RequestBody(required = false) PromptRequest request) {
        daemonService.prompt(request);
        return ok();
    }

    @PostMapping("/abort")
    public ResponseEntity<Map<String, Object>> abort(@RequestBody(required = false) AbortRequest request) {
        daemonService.abort(request);
        return ok();
    }

    @PostMapping("/shutdown")
    public ResponseEntity<Map<String, Object>> shutdown() {
        daemonService.shutdown();
        return ok();
    }

    /**
     * GET /state: Session details reported by the agent, empty when it is not running.
     */
    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> state() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        daemonService.agentState().ifPresent(state -> body.put("state", state));
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(DaemonException.class)
    public ResponseEntity<Map<String, Object>> handleDaemonException(DaemonException e) {
        log.debug("Request failed with {}: {}", e.getCode(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", e.getCode());
        return ResponseEntity.status(e.getStatus()).body(body);
    }

    private static ResponseEntity<Map<String, Object>> ok() {
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
