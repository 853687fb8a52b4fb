package com.vulnconsole.dispatch.api;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentDetail;
import com.vulnconsole.core.model.ExploitFile;
import com.vulnconsole.core.model.MissingImages;
import com.vulnconsole.core.model.ReadinessResult;
import com.vulnconsole.core.model.RunningContainer;
import com.vulnconsole.core.operations.OperationResult;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for listing environments and running operations on them.
 * <p>
 * Environment ids contain a slash, so they travel as a query parameter or in
 * the request body rather than in the path.
 */
@RestController
@RequestMapping("/api/v1/environments")
public class EnvironmentController {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentController.class);

    private static final int MAX_WAIT_SECONDS = 600;

    private final ReconciliationEngine engine;
    private final SseStreamingService sseStreamingService;

    public EnvironmentController(ReconciliationEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/environments — List environments. {@code use_cache=false} forces a rescan.
     */
    @GetMapping
    public List<EnvironmentDescriptor> list(@RequestParam(name = "use_cache", defaultValue = "true") boolean useCache) {
        return engine.getEnvironments(!useCache);
    }

    /**
     * POST /api/v1/environments/refresh — Force a rescan.
     */
    @PostMapping("/refresh")
    public Map<String, Object> refresh() {
        List<EnvironmentDescriptor> environments = engine.getEnvironments(true);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("count", environments.size());
        return result;
    }

    /**
     * GET /api/v1/environments/detail — One environment with its composition file text.
     */
    @GetMapping("/detail")
    public ResponseEntity<EnvironmentDetail> detail(@RequestParam String id) {
        return engine.detail(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/exploits")
    public ResponseEntity<List<ExploitFile>> exploits(@RequestParam String id) {
        return engine.exploits(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/start")
    public ResponseEntity<OperationResult> start(@RequestBody EnvironmentRequest request) {
        return toResponse(engine.start(request.id()));
    }

    @PostMapping("/stop")
    public ResponseEntity<OperationResult> stop(@RequestBody EnvironmentRequest request) {
        return toResponse(engine.stop(request.id()));
    }

    @GetMapping("/missing-images")
    public ResponseEntity<MissingImages> missingImages(@RequestParam String id) {
        return engine.missingImages(id)
                .map(result -> result.runtimeUnavailable()
                        ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result)
                        : ResponseEntity.ok(result))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/environments/pull — Pull missing images, streaming progress as SSE.
     */
    @GetMapping(value = "/pull", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter pull(@RequestParam String id) {
        SseEmitter emitter = sseStreamingService.createEmitter(id);
        OperationResult result = engine.pullImages(id);
        if (result.kind() != OperationResult.Kind.ACCEPTED) {
            log.info("Pull for {} not started: {}", id, result.kind());
            sseStreamingService.rejectAndComplete(emitter, result);
        }
        return emitter;
    }

    @GetMapping("/wait-ready")
    public ResponseEntity<ReadinessResult> waitReady(@RequestParam String id,
                                                     @RequestParam(defaultValue = "60") int timeout) {
        int seconds = Math.max(0, Math.min(timeout, MAX_WAIT_SECONDS));
        return engine.waitReady(id, Duration.ofSeconds(seconds))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/running")
    public List<RunningContainer> running() {
        return engine.runningContainers();
    }

    @ExceptionHandler(RuntimeUnavailableException.class)
    public ResponseEntity<Map<String, Object>> runtimeUnavailable(RuntimeUnavailableException e) {
        log.warn("Container runtime unavailable: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    static ResponseEntity<OperationResult> toResponse(OperationResult result) {
        HttpStatus status = switch (result.kind()) {
            case SUCCESS, FAILURE -> HttpStatus.OK;
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case BUSY, PORT_CONFLICT -> HttpStatus.CONFLICT;
            case RUNTIME_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(result);
    }
}
